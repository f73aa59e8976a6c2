package com.medicaledu.backend.modules.courses.domain;

import com.medicaledu.backend.global.common.domain.DomainEvent;

public interface CourseEvent extends DomainEvent {

    String AGGREGATE_TYPE = "Course";

    @Override
    default String aggregateType() {
        return AGGREGATE_TYPE;
    }
}
