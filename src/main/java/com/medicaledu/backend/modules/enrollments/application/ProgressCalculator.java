package com.medicaledu.backend.modules.enrollments.application;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.medicaledu.backend.modules.courses.domain.CourseMaterial;
import com.medicaledu.backend.modules.enrollments.domain.CourseProgress;

/**
 * Share of counted materials completed, rounded down. Required materials are counted when the
 * course has any, otherwise every material is.
 */
final class ProgressCalculator {

    private ProgressCalculator() {
    }

    static int percentage(List<CourseMaterial> materials, List<CourseProgress> progress) {
        List<CourseMaterial> required = materials.stream().filter(CourseMaterial::isRequired).toList();
        List<CourseMaterial> counted = required.isEmpty() ? materials : required;
        if (counted.isEmpty()) {
            return 0;
        }
        Set<UUID> completedIds = progress.stream()
                .filter(CourseProgress::isCompleted)
                .map(CourseProgress::getMaterialId)
                .collect(Collectors.toSet());
        long done = counted.stream().filter(material -> completedIds.contains(material.getId())).count();
        return (int) (done * 100 / counted.size());
    }
}
