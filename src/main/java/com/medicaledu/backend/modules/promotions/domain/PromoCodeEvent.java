package com.medicaledu.backend.modules.promotions.domain;

import com.medicaledu.backend.global.common.domain.DomainEvent;

public interface PromoCodeEvent extends DomainEvent {

    String AGGREGATE_TYPE = "PromoCode";

    @Override
    default String aggregateType() {
        return AGGREGATE_TYPE;
    }
}
