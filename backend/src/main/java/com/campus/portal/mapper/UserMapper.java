package com.campus.portal.mapper;

import com.campus.portal.dto.UserDTO;
import com.campus.portal.entity.User;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface UserMapper {

    UserDTO toDto(User user);
}
