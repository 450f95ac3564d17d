package com.codeops.drive.dto.mapper;

import com.codeops.drive.dto.response.BreadcrumbItemResponse;
import com.codeops.drive.dto.response.FolderResponse;
import com.codeops.drive.entity.Folder;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper for Folder entity to response DTOs.
 */
@Mapper(componentModel = "spring")
public interface FolderMapper {

    FolderResponse toResponse(Folder entity);

    BreadcrumbItemResponse toBreadcrumbItem(Folder entity);
}
