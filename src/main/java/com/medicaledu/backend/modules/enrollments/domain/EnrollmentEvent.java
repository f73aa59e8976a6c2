package com.medicaledu.backend.modules.enrollments.domain;

import com.medicaledu.backend.global.common.domain.DomainEvent;

public interface EnrollmentEvent extends DomainEvent {

    String AGGREGATE_TYPE = "Enrollment";

    @Override
    default String aggregateType() {
        return AGGREGATE_TYPE;
    }
}
