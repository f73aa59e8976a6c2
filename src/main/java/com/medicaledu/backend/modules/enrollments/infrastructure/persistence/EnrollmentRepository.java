package com.medicaledu.backend.modules.enrollments.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.modules.enrollments.domain.Enrollment;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EnrollmentRepository extends JpaRepository<Enrollment, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Enrollment e where e.id = :id")
    Optional<Enrollment> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByStudentIdAndCourseIdAndActiveTrue(UUID studentId, UUID courseId);

    boolean existsByStudentIdAndCourseId(UUID studentId, UUID courseId);

    Page<Enrollment> findByStudentId(UUID studentId, Pageable pageable);

    Page<Enrollment> findByCourseId(UUID courseId, Pageable pageable);

    @Query("""
            select e
              from Enrollment e
             where (:courseId is null or e.courseId = :courseId)
               and (:studentId is null or e.studentId = :studentId)
            """)
    Page<Enrollment> search(@Param("courseId") UUID courseId, @Param("studentId") UUID studentId, Pageable pageable);
}
