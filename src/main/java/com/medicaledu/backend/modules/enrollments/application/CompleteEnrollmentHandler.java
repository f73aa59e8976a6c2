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
public class CompleteEnrollmentHandler implements RequestHandler<CompleteEnrollmentCommand, Result<EnrollmentResponse>> {

    private final EnrollmentRepository enrollmentRepository;
    private final Clock clock;

    public CompleteEnrollmentHandler(EnrollmentRepository enrollmentRepository, Clock clock) {
        this.enrollmentRepository = enrollmentRepository;
        this.clock = clock;
    }

    @Override
    public Result<EnrollmentResponse> handle(CompleteEnrollmentCommand command) {
        Enrollment enrollment = enrollmentRepository.findByIdForUpdate(command.enrollmentId()).orElse(null);
        if (enrollment == null) {
            return Result.notFound("ENROLLMENT_NOT_FOUND");
        }
        if (enrollment.isCompleted()) {
            return Result.conflict("ENROLLMENT_ALREADY_COMPLETED");
        }
        enrollment.complete(OffsetDateTime.now(clock));
        enrollmentRepository.save(enrollment);
        return Result.success(EnrollmentResponse.from(enrollment));
    }
}
