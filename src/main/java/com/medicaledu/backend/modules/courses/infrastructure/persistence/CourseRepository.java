package com.medicaledu.backend.modules.courses.infrastructure.persistence;

import java.util.UUID;

import com.medicaledu.backend.modules.courses.domain.Course;
import com.medicaledu.backend.modules.courses.domain.CourseCategory;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CourseRepository extends JpaRepository<Course, UUID>, CourseRepositoryCustom {

    Page<Course> findByInstructorIdAndDeletedAtIsNull(UUID instructorId, Pageable pageable);

    Page<Course> findByCategoryAndPublishedTrueAndDeletedAtIsNull(CourseCategory category, Pageable pageable);
}
