package com.medicaledu.backend.modules.payments.domain;

import com.medicaledu.backend.global.common.domain.AuditActionType;
import com.medicaledu.backend.global.common.domain.DomainEvent;

public interface PaymentEvent extends DomainEvent {

    String AGGREGATE_TYPE = "Payment";

    @Override
    default String aggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    default AuditActionType auditAction() {
        return AuditActionType.PAYMENT_PROCESSED;
    }
}
