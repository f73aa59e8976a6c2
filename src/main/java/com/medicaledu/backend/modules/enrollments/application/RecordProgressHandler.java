package com.medicaledu.backend.modules.enrollments.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.courses.domain.Course;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;
import com.medicaledu.backend.modules.enrollments.domain.CourseProgress;
import com.medicaledu.backend.modules.enrollments.domain.Enrollment;
import com.medicaledu.backend.modules.enrollments.infrastructure.persistence.CourseProgressRepository;
import com.medicaledu.backend.modules.enrollments.infrastructure.persistence.EnrollmentRepository;
import com.medicaledu.backend.modules.enrollments.presentation.dto.EnrollmentResponse;

import org.springframework.stereotype.Service;

@Service
public class RecordProgressHandler implements RequestHandler<RecordProgressCommand, Result<EnrollmentResponse>> {

    private final EnrollmentRepository enrollmentRepository;
    private final CourseProgressRepository progressRepository;
    private final CourseRepository courseRepository;
    private final Clock clock;

    public RecordProgressHandler(
            EnrollmentRepository enrollmentRepository,
            CourseProgressRepository progressRepository,
            CourseRepository courseRepository,
            Clock clock
    ) {
        this.enrollmentRepository = enrollmentRepository;
        this.progressRepository = progressRepository;
        this.courseRepository = courseRepository;
        this.clock = clock;
    }

    @Override
    public Result<EnrollmentResponse> handle(RecordProgressCommand command) {
        Enrollment enrollment = enrollmentRepository.findByIdForUpdate(command.enrollmentId()).orElse(null);
        if (enrollment == null) {
            return Result.notFound("ENROLLMENT_NOT_FOUND");
        }
        if (!enrollment.isActive()) {
            return Result.conflict("ENROLLMENT_INACTIVE");
        }
        if (enrollment.isCompleted()) {
            return Result.conflict("ENROLLMENT_ALREADY_COMPLETED");
        }
        Course course = courseRepository.findById(enrollment.getCourseId()).orElse(null);
        if (course == null || course.findMaterial(command.materialId()) == null) {
            return Result.notFound("MATERIAL_NOT_FOUND");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);

        CourseProgress progress = progressRepository
                .findByEnrollmentIdAndMaterialId(enrollment.getId(), command.materialId())
                .orElseGet(() -> CourseProgress.start(enrollment.getId(), command.materialId()));
        if (command.secondsSpent() > 0) {
            progress.addTime(command.secondsSpent());
        }
        if (command.completed()) {
            progress.markCompleted(now);
        }
        progressRepository.save(progress);

        int percentage = ProgressCalculator.percentage(
                course.getMaterials(), progressRepository.findByEnrollmentId(enrollment.getId()));
        enrollment.updateProgress(percentage, now);
        enrollmentRepository.save(enrollment);
        return Result.success(EnrollmentResponse.from(enrollment));
    }
}
