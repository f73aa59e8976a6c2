package com.medicaledu.backend.modules.courses.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.courses.domain.Course;
import com.medicaledu.backend.modules.courses.domain.CourseMaterial;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseResponse;

import org.springframework.stereotype.Service;

@Service
public class ReorderCourseMaterialsHandler implements RequestHandler<ReorderCourseMaterialsCommand, Result<CourseResponse>> {

    private final CourseRepository courseRepository;
    private final Clock clock;

    public ReorderCourseMaterialsHandler(CourseRepository courseRepository, Clock clock) {
        this.courseRepository = courseRepository;
        this.clock = clock;
    }

    @Override
    public Result<CourseResponse> handle(ReorderCourseMaterialsCommand command) {
        Course course = courseRepository.findById(command.courseId()).orElse(null);
        if (course == null) {
            return Result.notFound("COURSE_NOT_FOUND");
        }
        Set<UUID> current = new HashSet<>();
        for (CourseMaterial material : course.getMaterials()) {
            current.add(material.getId());
        }
        Set<UUID> requested = new HashSet<>(command.materialIds());
        if (requested.size() != command.materialIds().size() || !requested.equals(current)) {
            return Result.validationFailure(List.of("materialIds: must list every course material exactly once"));
        }
        course.reorderMaterials(command.materialIds(), OffsetDateTime.now(clock));
        courseRepository.save(course);
        return Result.success(CourseResponse.from(course));
    }
}
