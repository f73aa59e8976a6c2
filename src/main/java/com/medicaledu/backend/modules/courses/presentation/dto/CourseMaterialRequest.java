package com.medicaledu.backend.modules.courses.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CourseMaterialRequest(
        @NotBlank @Size(max = 200) String title,
        @Size(max = 1000) String description,
        @NotBlank @Size(max = 2048) String fileUrl,
        @Size(max = 255) String fileName,
        @Size(max = 100) String contentType,
        @PositiveOrZero long fileSizeBytes,
        @PositiveOrZero Integer sortIndex,
        boolean free,
        boolean required,
        @PositiveOrZero Integer durationMinutes
) {
}
