package com.codeops.drive.dto.mapper;

import com.codeops.drive.dto.response.FileResponse;
import com.codeops.drive.entity.StoredFile;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for StoredFile entity to response DTOs. The blob key is never mapped.
 */
@Mapper(componentModel = "spring")
public interface StoredFileMapper {

    /**
     * Maps a StoredFile entity to the owner-facing response DTO.
     *
     * @param entity the StoredFile entity
     * @return the response DTO
     */
    @Mapping(target = "fileSize", source = "blobSize")
    FileResponse toResponse(StoredFile entity);
}
