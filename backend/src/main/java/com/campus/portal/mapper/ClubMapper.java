package com.campus.portal.mapper;

import com.campus.portal.dto.ClubDTO;
import com.campus.portal.dto.MembershipDTO;
import com.campus.portal.dto.UpdateClubRequest;
import com.campus.portal.entity.Club;
import com.campus.portal.entity.ClubMembership;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;

import java.util.List;

@Mapper(
        componentModel = "spring",
        nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE
)
public interface ClubMapper {

    @Mapping(target = "coordinatorId", source = "coordinator.id")
    @Mapping(target = "coordinatorName", source = "coordinator.name")
    @Mapping(target = "memberCount", expression = "java(club.activeMemberCount())")
    ClubDTO toDto(Club club);

    @Mapping(target = "userId", source = "user.id")
    @Mapping(target = "userName", source = "user.name")
    MembershipDTO toDto(ClubMembership membership);

    List<MembershipDTO> toMembershipDtos(List<ClubMembership> memberships);

    // partial update; coordinator and roster have their own operations
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "coordinator", ignore = true)
    @Mapping(target = "members", ignore = true)
    @Mapping(target = "active", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "version", ignore = true)
    void update(UpdateClubRequest request, @MappingTarget Club club);
}
