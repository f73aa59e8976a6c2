package com.medicaledu.backend.modules.enrollments.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.enrollments.infrastructure.persistence.EnrollmentRepository;
import com.medicaledu.backend.modules.enrollments.presentation.dto.EnrollmentResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetEnrollmentsByUserHandler
        implements RequestHandler<GetEnrollmentsByUserQuery, Result<PageResponse<EnrollmentResponse>>> {

    private final EnrollmentRepository enrollmentRepository;

    public GetEnrollmentsByUserHandler(EnrollmentRepository enrollmentRepository) {
        this.enrollmentRepository = enrollmentRepository;
    }

    @Override
    public Result<PageResponse<EnrollmentResponse>> handle(GetEnrollmentsByUserQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), GetEnrollmentsHandler.NEWEST_FIRST);
        return Result.success(PageResponse.from(
                enrollmentRepository.findByStudentId(query.userId(), pageRequest), EnrollmentResponse::from));
    }
}
