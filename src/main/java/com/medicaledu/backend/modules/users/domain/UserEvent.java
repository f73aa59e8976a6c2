package com.medicaledu.backend.modules.users.domain;

import com.medicaledu.backend.global.common.domain.DomainEvent;

public interface UserEvent extends DomainEvent {

    String AGGREGATE_TYPE = "User";

    @Override
    default String aggregateType() {
        return AGGREGATE_TYPE;
    }
}
