package com.medicaledu.backend.modules.bookings.infrastructure.persistence;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BookingRepository extends JpaRepository<Booking, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from Booking b where b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") UUID id);

    Page<Booking> findByStudentId(UUID studentId, Pageable pageable);

    Page<Booking> findByInstructorId(UUID instructorId, Pageable pageable);

    @Query("""
            select b
              from Booking b
             where (:userId is null or b.studentId = :userId)
               and (:instructorId is null or b.instructorId = :instructorId)
               and (:status is null or b.status = :status)
            """)
    Page<Booking> search(@Param("userId") UUID userId,
                         @Param("instructorId") UUID instructorId,
                         @Param("status") BookingStatus status,
                         Pageable pageable);

    boolean existsBySlotIdAndStudentIdAndStatusIn(UUID slotId, UUID studentId, Collection<BookingStatus> statuses);
}
