package com.medicaledu.backend.modules.enrollments.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.enrollments.infrastructure.persistence.EnrollmentRepository;
import com.medicaledu.backend.modules.enrollments.presentation.dto.EnrollmentResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetEnrollmentByIdHandler implements RequestHandler<GetEnrollmentByIdQuery, Result<EnrollmentResponse>> {

    private final EnrollmentRepository enrollmentRepository;

    public GetEnrollmentByIdHandler(EnrollmentRepository enrollmentRepository) {
        this.enrollmentRepository = enrollmentRepository;
    }

    @Override
    public Result<EnrollmentResponse> handle(GetEnrollmentByIdQuery query) {
        return enrollmentRepository.findById(query.enrollmentId())
                .map(EnrollmentResponse::from)
                .map(Result::success)
                .orElseGet(() -> Result.notFound("ENROLLMENT_NOT_FOUND"));
    }
}
