package com.medicaledu.backend.modules.courses.domain;

import com.medicaledu.backend.global.common.domain.Url;

/**
 * Values for a new material. A {@code null} sort index appends the material at the end.
 */
public record CourseMaterialDraft(
        String title,
        String description,
        Url fileUrl,
        String fileName,
        String contentType,
        long fileSizeBytes,
        Integer sortIndex,
        boolean free,
        boolean required,
        Integer durationMinutes
) {
}
