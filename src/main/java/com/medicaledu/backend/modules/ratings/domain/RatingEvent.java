package com.medicaledu.backend.modules.ratings.domain;

import com.medicaledu.backend.global.common.domain.DomainEvent;

/**
 * Events of both rating aggregates. {@link #aggregateType()} tells them apart.
 */
public interface RatingEvent extends DomainEvent {

    String COURSE_RATING = "CourseRating";
    String INSTRUCTOR_RATING = "InstructorRating";
}
