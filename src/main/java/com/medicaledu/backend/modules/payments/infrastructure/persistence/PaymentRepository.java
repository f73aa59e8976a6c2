package com.medicaledu.backend.modules.payments.infrastructure.persistence;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.modules.payments.domain.Payment;
import com.medicaledu.backend.modules.payments.domain.PaymentStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Payment p where p.id = :id")
    Optional<Payment> findByIdForUpdate(@Param("id") UUID id);

    Page<Payment> findByUserId(UUID userId, Pageable pageable);

    @Query("select p from Payment p where (:status is null or p.status = :status)")
    Page<Payment> search(@Param("status") PaymentStatus status, Pageable pageable);

    boolean existsByBookingIdAndStatusIn(UUID bookingId, Collection<PaymentStatus> statuses);
}
