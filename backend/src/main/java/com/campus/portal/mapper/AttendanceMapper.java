package com.campus.portal.mapper;

import com.campus.portal.dto.AttendanceRecordDTO;
import com.campus.portal.dto.FeedbackDTO;
import com.campus.portal.entity.AttendanceRecord;
import com.campus.portal.entity.EventFeedback;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring")
public interface AttendanceMapper {

    @Mapping(target = "eventId", source = "event.id")
    @Mapping(target = "eventTitle", source = "event.title")
    @Mapping(target = "userId", source = "user.id")
    @Mapping(target = "userName", source = "user.name")
    AttendanceRecordDTO toDto(AttendanceRecord record);

    List<AttendanceRecordDTO> toDtos(List<AttendanceRecord> records);

    @Mapping(target = "eventId", source = "event.id")
    @Mapping(target = "userId", source = "user.id")
    @Mapping(target = "userName", source = "user.name")
    FeedbackDTO toDto(EventFeedback feedback);
}
