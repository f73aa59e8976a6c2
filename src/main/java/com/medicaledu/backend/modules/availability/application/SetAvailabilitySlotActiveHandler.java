package com.medicaledu.backend.modules.availability.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.availability.domain.AvailabilitySlot;
import com.medicaledu.backend.modules.availability.infrastructure.persistence.AvailabilitySlotRepository;
import com.medicaledu.backend.modules.availability.presentation.dto.AvailabilitySlotResponse;

import org.springframework.stereotype.Service;

@Service
public class SetAvailabilitySlotActiveHandler
        implements RequestHandler<SetAvailabilitySlotActiveCommand, Result<AvailabilitySlotResponse>> {

    private final AvailabilitySlotRepository slotRepository;
    private final Clock clock;

    public SetAvailabilitySlotActiveHandler(AvailabilitySlotRepository slotRepository, Clock clock) {
        this.slotRepository = slotRepository;
        this.clock = clock;
    }

    @Override
    public Result<AvailabilitySlotResponse> handle(SetAvailabilitySlotActiveCommand command) {
        AvailabilitySlot slot = slotRepository.findById(command.slotId()).orElse(null);
        if (slot == null) {
            return Result.notFound("SLOT_NOT_FOUND");
        }
        if (slot.isActive() == command.active()) {
            return Result.conflict(command.active() ? "SLOT_ALREADY_ACTIVE" : "SLOT_ALREADY_INACTIVE");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (command.active()) {
            slot.activate(now);
        } else {
            slot.deactivate(now);
        }
        slotRepository.save(slot);
        return Result.success(AvailabilitySlotResponse.from(slot));
    }
}
