package com.medicaledu.backend.modules.courses.application;

import java.util.ArrayList;
import java.util.List;

import com.medicaledu.backend.global.common.domain.Url;
import com.medicaledu.backend.modules.courses.domain.CourseMaterialDraft;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseMaterialRequest;

final class CourseMaterialDrafts {

    private CourseMaterialDrafts() {
    }

    static CourseMaterialDraft from(CourseMaterialRequest request) {
        return new CourseMaterialDraft(
                request.title(),
                request.description(),
                Url.of(request.fileUrl()),
                request.fileName(),
                request.contentType(),
                request.fileSizeBytes(),
                request.sortIndex(),
                request.free(),
                request.required(),
                request.durationMinutes()
        );
    }

    static List<CourseMaterialDraft> from(List<CourseMaterialRequest> requests) {
        return requests == null ? List.of() : requests.stream().map(CourseMaterialDrafts::from).toList();
    }

    /**
     * URL and currency checks shared by the course validators.
     */
    static List<String> validateUrls(String thumbnailUrl, String videoUrl, List<CourseMaterialRequest> materials) {
        List<String> errors = new ArrayList<>();
        if (thumbnailUrl != null && !thumbnailUrl.isBlank() && !Url.isValid(thumbnailUrl)) {
            errors.add("thumbnailUrl: must be a valid http(s) URL");
        }
        if (videoUrl != null && !videoUrl.isBlank() && !Url.isValid(videoUrl)) {
            errors.add("videoUrl: must be a valid http(s) URL");
        }
        if (materials != null) {
            for (int i = 0; i < materials.size(); i++) {
                CourseMaterialRequest material = materials.get(i);
                if (material != null && material.fileUrl() != null && !Url.isValid(material.fileUrl())) {
                    errors.add("materials[" + i + "].fileUrl: must be a valid http(s) URL");
                }
            }
        }
        return errors;
    }

    static Url optionalUrl(String value) {
        return value == null || value.isBlank() ? null : Url.of(value);
    }
}
