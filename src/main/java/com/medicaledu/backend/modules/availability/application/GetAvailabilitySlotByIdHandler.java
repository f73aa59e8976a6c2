package com.medicaledu.backend.modules.availability.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.availability.infrastructure.persistence.AvailabilitySlotRepository;
import com.medicaledu.backend.modules.availability.presentation.dto.AvailabilitySlotResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetAvailabilitySlotByIdHandler
        implements RequestHandler<GetAvailabilitySlotByIdQuery, Result<AvailabilitySlotResponse>> {

    private final AvailabilitySlotRepository slotRepository;

    public GetAvailabilitySlotByIdHandler(AvailabilitySlotRepository slotRepository) {
        this.slotRepository = slotRepository;
    }

    @Override
    public Result<AvailabilitySlotResponse> handle(GetAvailabilitySlotByIdQuery query) {
        return slotRepository.findById(query.slotId())
                .map(slot -> Result.success(AvailabilitySlotResponse.from(slot)))
                .orElseGet(() -> Result.notFound("SLOT_NOT_FOUND"));
    }
}
