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
public class ChangeSlotParticipantsHandler
        implements RequestHandler<ChangeSlotParticipantsCommand, Result<AvailabilitySlotResponse>> {

    private final AvailabilitySlotRepository slotRepository;
    private final Clock clock;

    public ChangeSlotParticipantsHandler(AvailabilitySlotRepository slotRepository, Clock clock) {
        this.slotRepository = slotRepository;
        this.clock = clock;
    }

    @Override
    public Result<AvailabilitySlotResponse> handle(ChangeSlotParticipantsCommand command) {
        AvailabilitySlot slot = slotRepository.findByIdForUpdate(command.slotId()).orElse(null);
        if (slot == null) {
            return Result.notFound("SLOT_NOT_FOUND");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (command.release()) {
            if (slot.getCurrentParticipants() < command.quantity()) {
                return Result.conflict("SLOT_PARTICIPANTS_UNDERFLOW");
            }
            slot.removeParticipants(command.quantity(), now);
        } else {
            if (!slot.isActive()) {
                return Result.conflict("SLOT_INACTIVE");
            }
            if (slot.getRemainingCapacity() < command.quantity()) {
                return Result.conflict("SLOT_FULL");
            }
            slot.addParticipants(command.quantity(), now);
        }
        slotRepository.save(slot);
        return Result.success(AvailabilitySlotResponse.from(slot));
    }
}
