package com.medicaledu.backend.modules.bookings.domain;

import com.medicaledu.backend.global.common.domain.AuditActionType;
import com.medicaledu.backend.global.common.domain.DomainEvent;

public interface BookingEvent extends DomainEvent {

    String AGGREGATE_TYPE = "Booking";

    @Override
    default String aggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    default AuditActionType auditAction() {
        return AuditActionType.BOOKING_UPDATED;
    }
}
