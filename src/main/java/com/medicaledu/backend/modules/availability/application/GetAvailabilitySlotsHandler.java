package com.medicaledu.backend.modules.availability.application;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

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
public class GetAvailabilitySlotsHandler
        implements RequestHandler<GetAvailabilitySlotsQuery, Result<PageResponse<AvailabilitySlotResponse>>> {

    static final OffsetDateTime LOWER_BOUND = OffsetDateTime.of(1970, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    static final OffsetDateTime UPPER_BOUND = OffsetDateTime.of(9999, 12, 31, 0, 0, 0, 0, ZoneOffset.UTC);

    private final AvailabilitySlotRepository slotRepository;

    public GetAvailabilitySlotsHandler(AvailabilitySlotRepository slotRepository) {
        this.slotRepository = slotRepository;
    }

    @Override
    public Result<PageResponse<AvailabilitySlotResponse>> handle(GetAvailabilitySlotsQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), Sort.by(Sort.Direction.ASC, "startTimeUtc"));
        return Result.success(PageResponse.from(slotRepository.search(
                query.instructorId(),
                query.startDate() != null ? query.startDate() : LOWER_BOUND,
                query.endDate() != null ? query.endDate() : UPPER_BOUND,
                query.availableOnly(),
                pageRequest
        ), AvailabilitySlotResponse::from));
    }
}
