package com.medicaledu.backend.modules.promotions.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Record of a promo code applied to a booking.
 */
@Entity
@Table(name = "booking_promo_code")
public class BookingPromoCode extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "booking_id", nullable = false, columnDefinition = "uuid")
    private UUID bookingId;

    @Column(name = "promo_code_id", nullable = false, columnDefinition = "uuid")
    private UUID promoCodeId;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "discount_amount", nullable = false, precision = 12, scale = 2)),
            @AttributeOverride(name = "currency", column = @Column(name = "discount_currency", nullable = false, length = 3))
    })
    private Money discountAmount;

    @Column(name = "applied_at", nullable = false)
    private OffsetDateTime appliedAt;

    protected BookingPromoCode() {
    }

    public static BookingPromoCode apply(UUID bookingId, UUID promoCodeId, Money discountAmount, OffsetDateTime now) {
        if (bookingId == null || promoCodeId == null) {
            throw new IllegalArgumentException("Booking and promo code are required.");
        }
        if (discountAmount == null) {
            throw new IllegalArgumentException("Discount amount is required.");
        }
        BookingPromoCode applied = new BookingPromoCode();
        applied.bookingId = bookingId;
        applied.promoCodeId = promoCodeId;
        applied.discountAmount = discountAmount;
        applied.appliedAt = now;
        return applied;
    }

    public void updateDiscountAmount(Money newAmount) {
        if (newAmount == null) {
            throw new IllegalArgumentException("Discount amount is required.");
        }
        this.discountAmount = newAmount;
    }

    public UUID getId() {
        return id;
    }

    public UUID getBookingId() {
        return bookingId;
    }

    public UUID getPromoCodeId() {
        return promoCodeId;
    }

    public Money getDiscountAmount() {
        return discountAmount;
    }

    public OffsetDateTime getAppliedAt() {
        return appliedAt;
    }
}
