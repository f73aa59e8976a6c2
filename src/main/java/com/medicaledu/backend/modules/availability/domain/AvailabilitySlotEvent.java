package com.medicaledu.backend.modules.availability.domain;

import com.medicaledu.backend.global.common.domain.DomainEvent;

public interface AvailabilitySlotEvent extends DomainEvent {

    String AGGREGATE_TYPE = "AvailabilitySlot";

    @Override
    default String aggregateType() {
        return AGGREGATE_TYPE;
    }
}
