package com.medicaledu.backend.modules.courses.infrastructure.persistence;

import com.medicaledu.backend.modules.courses.domain.Course;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface CourseRepositoryCustom {

    Page<Course> searchCourses(CourseSearchCondition condition, Pageable pageable);
}
