package com.medicaledu.backend.modules.enrollments.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.enrollments.domain.Enrollment;
import com.medicaledu.backend.modules.enrollments.infrastructure.persistence.EnrollmentRepository;
import com.medicaledu.backend.modules.enrollments.presentation.dto.EnrollmentResponse;

import org.springframework.stereotype.Service;

@Service
public class SetEnrollmentActiveHandler implements RequestHandler<SetEnrollmentActiveCommand, Result<EnrollmentResponse>> {

    private final EnrollmentRepository enrollmentRepository;
    private final Clock clock;

    public SetEnrollmentActiveHandler(EnrollmentRepository enrollmentRepository, Clock clock) {
        this.enrollmentRepository = enrollmentRepository;
        this.clock = clock;
    }

    @Override
    public Result<EnrollmentResponse> handle(SetEnrollmentActiveCommand command) {
        Enrollment enrollment = enrollmentRepository.findByIdForUpdate(command.enrollmentId()).orElse(null);
        if (enrollment == null) {
            return Result.notFound("ENROLLMENT_NOT_FOUND");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (command.active()) {
            if (enrollment.isActive()) {
                return Result.conflict("ENROLLMENT_ALREADY_ACTIVE");
            }
            if (enrollmentRepository.existsByStudentIdAndCourseIdAndActiveTrue(enrollment.getStudentId(), enrollment.getCourseId())) {
                return Result.conflict("ALREADY_ENROLLED");
            }
            enrollment.reactivate(now);
        } else {
            if (!enrollment.isActive()) {
                return Result.conflict("ENROLLMENT_ALREADY_INACTIVE");
            }
            enrollment.deactivate(now);
        }
        enrollmentRepository.save(enrollment);
        return Result.success(EnrollmentResponse.from(enrollment));
    }
}
