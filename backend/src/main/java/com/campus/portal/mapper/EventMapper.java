package com.campus.portal.mapper;

import com.campus.portal.dto.EventDTO;
import com.campus.portal.dto.RegistrationDTO;
import com.campus.portal.dto.UpdateEventRequest;
import com.campus.portal.entity.Event;
import com.campus.portal.entity.EventRegistration;
import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;

import java.time.Instant;

@Mapper(
        componentModel = "spring",
        nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE
)
public interface EventMapper {

    @Mapping(target = "clubId", source = "club.id")
    @Mapping(target = "clubName", source = "club.name")
    @Mapping(target = "organizerId", source = "organizer.id")
    @Mapping(target = "activeRegistrations", expression = "java(event.activeRegistrationCount())")
    @Mapping(target = "availableSpots", expression = "java(event.availableSpots())")
    @Mapping(target = "full", expression = "java(event.isFull())")
    @Mapping(target = "registrationOpen", expression = "java(event.isRegistrationOpen(now))")
    EventDTO toDto(Event event, @Context Instant now);

    @Mapping(target = "eventId", source = "event.id")
    @Mapping(target = "eventTitle", source = "event.title")
    @Mapping(target = "userId", source = "user.id")
    @Mapping(target = "userName", source = "user.name")
    RegistrationDTO toDto(EventRegistration registration);

    // club, organizer, status and roster are never changed through an update
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "club", ignore = true)
    @Mapping(target = "organizer", ignore = true)
    @Mapping(target = "status", ignore = true)
    @Mapping(target = "registrations", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "version", ignore = true)
    void update(UpdateEventRequest request, @MappingTarget Event event);
}
