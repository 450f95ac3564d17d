package com.codeops.drive.dto.mapper;

import com.codeops.drive.dto.response.UserSummaryResponse;
import com.codeops.drive.entity.DriveUser;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for directory users.
 */
@Mapper(componentModel = "spring")
public interface UserMapper {

    @Mapping(target = "name", source = "displayName")
    UserSummaryResponse toSummary(DriveUser entity);
}
