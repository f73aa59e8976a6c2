package com.medicaledu.backend.modules.availability.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.availability.infrastructure.persistence.AvailabilitySlotRepository;
import com.medicaledu.backend.modules.availability.presentation.dto.AvailabilitySlotResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetAvailabilitySlotsByInstructorHandler
        implements RequestHandler<GetAvailabilitySlotsByInstructorQuery, Result<PageResponse<AvailabilitySlotResponse>>> {

    private final AvailabilitySlotRepository slotRepository;

    public GetAvailabilitySlotsByInstructorHandler(AvailabilitySlotRepository slotRepository) {
        this.slotRepository = slotRepository;
    }

    @Override
    public Result<PageResponse<AvailabilitySlotResponse>> handle(GetAvailabilitySlotsByInstructorQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), Sort.by(Sort.Direction.ASC, "startTimeUtc"));
        return Result.success(PageResponse.from(
                slotRepository.findByInstructorId(query.instructorId(), pageRequest), AvailabilitySlotResponse::from));
    }
}
