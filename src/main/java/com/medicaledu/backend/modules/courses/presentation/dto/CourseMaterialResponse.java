package com.medicaledu.backend.modules.courses.presentation.dto;

import java.util.UUID;

import com.medicaledu.backend.modules.courses.domain.CourseMaterial;

public record CourseMaterialResponse(
        UUID id,
        String title,
        String description,
        String fileUrl,
        String fileName,
        String contentType,
        long fileSizeBytes,
        int sortIndex,
        boolean free,
        boolean required,
        Integer durationMinutes
) {

    public static CourseMaterialResponse from(CourseMaterial material) {
        return new CourseMaterialResponse(
                material.getId(),
                material.getTitle(),
                material.getDescription(),
                material.getFileUrl().getValue(),
                material.getFileName(),
                material.getContentType(),
                material.getFileSizeBytes(),
                material.getSortIndex(),
                material.isFree(),
                material.isRequired(),
                material.getDurationMinutes()
        );
    }
}
