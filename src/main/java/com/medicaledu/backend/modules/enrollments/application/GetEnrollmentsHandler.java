package com.medicaledu.backend.modules.enrollments.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.enrollments.infrastructure.persistence.EnrollmentRepository;
import com.medicaledu.backend.modules.enrollments.presentation.dto.EnrollmentResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetEnrollmentsHandler implements RequestHandler<GetEnrollmentsQuery, Result<PageResponse<EnrollmentResponse>>> {

    static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "enrolledAt");

    private final EnrollmentRepository enrollmentRepository;

    public GetEnrollmentsHandler(EnrollmentRepository enrollmentRepository) {
        this.enrollmentRepository = enrollmentRepository;
    }

    @Override
    public Result<PageResponse<EnrollmentResponse>> handle(GetEnrollmentsQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), NEWEST_FIRST);
        return Result.success(PageResponse.from(
                enrollmentRepository.search(query.courseId(), query.userId(), pageRequest), EnrollmentResponse::from));
    }
}
