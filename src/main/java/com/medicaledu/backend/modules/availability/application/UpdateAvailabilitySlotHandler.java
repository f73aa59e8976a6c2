package com.medicaledu.backend.modules.availability.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.availability.domain.AvailabilitySlot;
import com.medicaledu.backend.modules.availability.infrastructure.persistence.AvailabilitySlotRepository;
import com.medicaledu.backend.modules.availability.presentation.dto.AvailabilitySlotResponse;

import org.springframework.stereotype.Service;

@Service
public class UpdateAvailabilitySlotHandler
        implements RequestHandler<UpdateAvailabilitySlotCommand, Result<AvailabilitySlotResponse>> {

    private final AvailabilitySlotRepository slotRepository;
    private final Clock clock;

    public UpdateAvailabilitySlotHandler(AvailabilitySlotRepository slotRepository, Clock clock) {
        this.slotRepository = slotRepository;
        this.clock = clock;
    }

    @Override
    public Result<AvailabilitySlotResponse> handle(UpdateAvailabilitySlotCommand command) {
        AvailabilitySlot slot = slotRepository.findByIdForUpdate(command.slotId()).orElse(null);
        if (slot == null) {
            return Result.notFound("SLOT_NOT_FOUND");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (command.startTimeUtc() != null) {
            if (slot.getCurrentParticipants() > 0) {
                return Result.conflict("SLOT_HAS_PARTICIPANTS");
            }
            if (slotRepository.existsOverlapping(slot.getInstructorId(), command.startTimeUtc(), command.endTimeUtc(), slot.getId())) {
                return Result.conflict("SLOT_OVERLAPS_EXISTING");
            }
            slot.updateTime(command.startTimeUtc(), command.endTimeUtc(), now);
        }
        if (command.price() != null) {
            Currency currency = command.currency() != null ? Currency.of(command.currency()) : slot.getPrice().getCurrency();
            slot.updatePrice(Money.of(command.price(), currency), now);
        }
        if (command.maxParticipants() != null) {
            if (command.maxParticipants() < slot.getCurrentParticipants()) {
                return Result.conflict("SLOT_CAPACITY_BELOW_PARTICIPANTS");
            }
            slot.updateMaxParticipants(command.maxParticipants(), now);
        }
        if (command.notes() != null) {
            slot.updateNotes(command.notes(), now);
        }
        if (command.recurringPattern() != null) {
            if (command.recurringPattern().isBlank()) {
                slot.cancelRecurring(now);
            } else {
                slot.setRecurring(command.recurringPattern(), now);
            }
        }
        slotRepository.save(slot);
        return Result.success(AvailabilitySlotResponse.from(slot));
    }
}
