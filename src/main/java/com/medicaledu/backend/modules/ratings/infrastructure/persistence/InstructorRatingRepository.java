package com.medicaledu.backend.modules.ratings.infrastructure.persistence;

import java.util.UUID;

import com.medicaledu.backend.modules.ratings.domain.InstructorRating;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InstructorRatingRepository extends JpaRepository<InstructorRating, UUID> {

    boolean existsByBookingId(UUID bookingId);

    Page<InstructorRating> findByInstructorIdAndPublicRatingTrue(UUID instructorId, Pageable pageable);

    @Query("select avg(r.rating) from InstructorRating r where r.instructorId = :instructorId and r.publicRating = true")
    Double averageRating(@Param("instructorId") UUID instructorId);

    long countByInstructorIdAndPublicRatingTrue(UUID instructorId);
}
