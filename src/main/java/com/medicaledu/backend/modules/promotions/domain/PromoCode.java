package com.medicaledu.backend.modules.promotions.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.domain.PromoCodeValue;
import com.medicaledu.backend.global.jpa.AbstractAggregateEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Discount code. An empty applicable course list means the code applies to every course.
 */
@Entity
@Table(name = "promo_code")
public class PromoCode extends AbstractAggregateEntity {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "code", nullable = false, unique = true, length = PromoCodeValue.MAX_LENGTH)
    private PromoCodeValue code;

    @Column(name = "description", length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "discount_type", nullable = false, length = 16)
    private DiscountType discountType;

    @Column(name = "discount_value", nullable = false, precision = 12, scale = 2)
    private BigDecimal discountValue;

    @Column(name = "currency", nullable = false, length = 3)
    private Currency currency;

    @Column(name = "max_uses")
    private Integer maxUses;

    @Column(name = "current_uses", nullable = false)
    private int currentUses;

    @Column(name = "valid_from", nullable = false)
    private OffsetDateTime validFrom;

    @Column(name = "valid_until", nullable = false)
    private OffsetDateTime validUntil;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "applicable_course_ids", columnDefinition = "jsonb")
    private List<UUID> applicableCourseIds = new ArrayList<>();

    protected PromoCode() {
    }

    public static PromoCode create(
            PromoCodeValue code,
            String description,
            DiscountType discountType,
            BigDecimal discountValue,
            Currency currency,
            Integer maxUses,
            OffsetDateTime validFrom,
            OffsetDateTime validUntil,
            List<UUID> applicableCourseIds,
            OffsetDateTime now
    ) {
        if (code == null) {
            throw new IllegalArgumentException("Promo code is required.");
        }
        if (discountType == null) {
            throw new IllegalArgumentException("Discount type is required.");
        }
        if (validFrom == null || validUntil == null || !validUntil.isAfter(validFrom)) {
            throw new IllegalArgumentException("Valid until must be after valid from.");
        }
        PromoCode promoCode = new PromoCode();
        promoCode.id = UUID.randomUUID();
        promoCode.code = code;
        promoCode.description = description;
        promoCode.discountType = discountType;
        promoCode.discountValue = requireDiscountValue(discountType, discountValue);
        promoCode.currency = currency != null ? currency : Currency.USD;
        promoCode.maxUses = requireMaxUses(maxUses);
        promoCode.validFrom = validFrom;
        promoCode.validUntil = validUntil;
        promoCode.applicableCourseIds = applicableCourseIds == null ? new ArrayList<>() : new ArrayList<>(applicableCourseIds);
        promoCode.registerEvent(new PromoCodeEvents.Created(promoCode.id, now, code.getValue()));
        return promoCode;
    }

    public boolean isUsageExhausted() {
        return maxUses != null && currentUses >= maxUses;
    }

    public boolean isValidAt(OffsetDateTime now) {
        return active && !now.isBefore(validFrom) && !now.isAfter(validUntil) && !isUsageExhausted();
    }

    public boolean isApplicable(UUID courseId, OffsetDateTime now) {
        if (!isValidAt(now)) {
            return false;
        }
        return applicableCourseIds.isEmpty() || applicableCourseIds.contains(courseId);
    }

    /**
     * Discount for {@code amount}, never larger than the amount itself.
     */
    public Money calculateDiscount(Money amount) {
        if (discountType == DiscountType.PERCENTAGE) {
            BigDecimal factor = discountValue.divide(ONE_HUNDRED, 4, RoundingMode.HALF_EVEN);
            return amount.multiply(factor).min(amount);
        }
        if (!currency.equals(amount.getCurrency())) {
            throw new IllegalStateException("Promo code currency " + currency + " does not match " + amount.getCurrency());
        }
        return Money.of(discountValue, currency).min(amount);
    }

    public void redeem(OffsetDateTime now) {
        if (!active) {
            throw new IllegalStateException("Promo code is not active.");
        }
        if (isUsageExhausted()) {
            throw new IllegalStateException("Promo code has reached its maximum number of uses.");
        }
        currentUses++;
        registerEvent(new PromoCodeEvents.Redeemed(id, now, currentUses));
    }

    public void updateDescription(String description, OffsetDateTime now) {
        this.description = description;
        registerEvent(new PromoCodeEvents.Updated(id, now));
    }

    public void updateDiscountValue(BigDecimal value, OffsetDateTime now) {
        this.discountValue = requireDiscountValue(discountType, value);
        registerEvent(new PromoCodeEvents.Updated(id, now));
    }

    public void updateMaxUses(Integer newMaxUses, OffsetDateTime now) {
        Integer checked = requireMaxUses(newMaxUses);
        if (checked != null && checked < currentUses) {
            throw new IllegalStateException("Max uses cannot drop below current uses.");
        }
        this.maxUses = checked;
        registerEvent(new PromoCodeEvents.Updated(id, now));
    }

    public void updateApplicableCourseIds(List<UUID> courseIds, OffsetDateTime now) {
        this.applicableCourseIds = courseIds == null ? new ArrayList<>() : new ArrayList<>(courseIds);
        registerEvent(new PromoCodeEvents.Updated(id, now));
    }

    public void deactivate(OffsetDateTime now) {
        if (!active) {
            throw new IllegalStateException("Promo code is already inactive.");
        }
        this.active = false;
        registerEvent(new PromoCodeEvents.Deactivated(id, now));
    }

    private static BigDecimal requireDiscountValue(DiscountType type, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("Discount value cannot be negative.");
        }
        if (type == DiscountType.PERCENTAGE && value.compareTo(ONE_HUNDRED) > 0) {
            throw new IllegalArgumentException("Percentage discount cannot exceed 100.");
        }
        return value.setScale(2, RoundingMode.HALF_EVEN);
    }

    private static Integer requireMaxUses(Integer maxUses) {
        if (maxUses != null && maxUses <= 0) {
            throw new IllegalArgumentException("Max uses must be positive if specified.");
        }
        return maxUses;
    }

    @Override
    public UUID getId() {
        return id;
    }

    public PromoCodeValue getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public DiscountType getDiscountType() {
        return discountType;
    }

    public BigDecimal getDiscountValue() {
        return discountValue;
    }

    public Currency getCurrency() {
        return currency;
    }

    public Integer getMaxUses() {
        return maxUses;
    }

    public int getCurrentUses() {
        return currentUses;
    }

    public OffsetDateTime getValidFrom() {
        return validFrom;
    }

    public OffsetDateTime getValidUntil() {
        return validUntil;
    }

    public boolean isActive() {
        return active;
    }

    public List<UUID> getApplicableCourseIds() {
        return List.copyOf(applicableCourseIds);
    }
}
