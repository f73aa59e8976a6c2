package com.medicaledu.backend.modules.ratings.infrastructure.persistence;

import java.util.UUID;

import com.medicaledu.backend.modules.ratings.domain.CourseRating;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CourseRatingRepository extends JpaRepository<CourseRating, UUID> {

    boolean existsByCourseIdAndStudentId(UUID courseId, UUID studentId);

    Page<CourseRating> findByCourseIdAndPublicRatingTrue(UUID courseId, Pageable pageable);

    @Query("select avg(r.rating) from CourseRating r where r.courseId = :courseId and r.publicRating = true")
    Double averageRating(@Param("courseId") UUID courseId);

    long countByCourseIdAndPublicRatingTrue(UUID courseId);
}
