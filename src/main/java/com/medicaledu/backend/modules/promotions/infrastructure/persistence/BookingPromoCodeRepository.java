package com.medicaledu.backend.modules.promotions.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.modules.promotions.domain.BookingPromoCode;

import org.springframework.data.jpa.repository.JpaRepository;

public interface BookingPromoCodeRepository extends JpaRepository<BookingPromoCode, UUID> {

    List<BookingPromoCode> findByBookingId(UUID bookingId);

    long countByPromoCodeId(UUID promoCodeId);
}
