package com.medicaledu.backend.modules.enrollments.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.modules.enrollments.domain.CourseProgress;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CourseProgressRepository extends JpaRepository<CourseProgress, UUID> {

    Optional<CourseProgress> findByEnrollmentIdAndMaterialId(UUID enrollmentId, UUID materialId);

    List<CourseProgress> findByEnrollmentId(UUID enrollmentId);
}
