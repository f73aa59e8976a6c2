package com.medicaledu.backend.modules.availability.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.availability.domain.AvailabilitySlot;
import com.medicaledu.backend.modules.availability.infrastructure.persistence.AvailabilitySlotRepository;
import com.medicaledu.backend.modules.availability.presentation.dto.AvailabilitySlotResponse;

import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class CreateAvailabilitySlotHandler
        implements RequestHandler<CreateAvailabilitySlotCommand, Result<AvailabilitySlotResponse>> {

    private final AvailabilitySlotRepository slotRepository;
    private final Clock clock;

    public CreateAvailabilitySlotHandler(AvailabilitySlotRepository slotRepository, Clock clock) {
        this.slotRepository = slotRepository;
        this.clock = clock;
    }

    @Override
    public Result<AvailabilitySlotResponse> handle(CreateAvailabilitySlotCommand command) {
        if (slotRepository.existsOverlapping(command.instructorId(), command.startTimeUtc(), command.endTimeUtc(), null)) {
            return Result.conflict("SLOT_OVERLAPS_EXISTING");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        AvailabilitySlot slot = AvailabilitySlot.create(
                command.courseId(),
                command.instructorId(),
                command.startTimeUtc(),
                command.endTimeUtc(),
                Money.of(command.price(), command.currency()),
                command.maxParticipants(),
                command.notes(),
                now
        );
        if (StringUtils.hasText(command.recurringPattern())) {
            slot.setRecurring(command.recurringPattern(), now);
        }
        slotRepository.save(slot);
        return Result.success(AvailabilitySlotResponse.from(slot));
    }
}
