package com.medicaledu.backend.modules.availability.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.modules.availability.domain.AvailabilitySlot;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AvailabilitySlotRepository extends JpaRepository<AvailabilitySlot, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from AvailabilitySlot s where s.id = :id")
    Optional<AvailabilitySlot> findByIdForUpdate(@Param("id") UUID id);

    Page<AvailabilitySlot> findByInstructorId(UUID instructorId, Pageable pageable);

    /**
     * Slots starting inside {@code [from, to]}. {@code availableOnly} keeps active slots that
     * still have free capacity.
     */
    @Query("""
            select s
              from AvailabilitySlot s
             where (:instructorId is null or s.instructorId = :instructorId)
               and s.startTimeUtc >= :from
               and s.startTimeUtc <= :to
               and (:availableOnly = false
                    or (s.active = true and s.booked = false and s.currentParticipants < s.maxParticipants))
            """)
    Page<AvailabilitySlot> search(@Param("instructorId") UUID instructorId,
                                  @Param("from") OffsetDateTime from,
                                  @Param("to") OffsetDateTime to,
                                  @Param("availableOnly") boolean availableOnly,
                                  Pageable pageable);

    @Query("""
            select count(s) > 0
              from AvailabilitySlot s
             where s.instructorId = :instructorId
               and s.active = true
               and s.startTimeUtc < :end
               and s.endTimeUtc > :start
               and (:excludeId is null or s.id <> :excludeId)
            """)
    boolean existsOverlapping(@Param("instructorId") UUID instructorId,
                              @Param("start") OffsetDateTime start,
                              @Param("end") OffsetDateTime end,
                              @Param("excludeId") UUID excludeId);
}
