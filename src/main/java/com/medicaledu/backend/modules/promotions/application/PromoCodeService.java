package com.medicaledu.backend.modules.promotions.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.domain.PromoCodeValue;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.modules.promotions.domain.BookingPromoCode;
import com.medicaledu.backend.modules.promotions.domain.DiscountType;
import com.medicaledu.backend.modules.promotions.domain.PromoCode;
import com.medicaledu.backend.modules.promotions.infrastructure.persistence.BookingPromoCodeRepository;
import com.medicaledu.backend.modules.promotions.infrastructure.persistence.PromoCodeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Prices promo codes for bookings and records their use. Runs inside the caller's transaction.
 */
@Service
public class PromoCodeService {

    private static final Logger log = LoggerFactory.getLogger(PromoCodeService.class);

    private final PromoCodeRepository promoCodeRepository;
    private final BookingPromoCodeRepository bookingPromoCodeRepository;

    public PromoCodeService(PromoCodeRepository promoCodeRepository, BookingPromoCodeRepository bookingPromoCodeRepository) {
        this.promoCodeRepository = promoCodeRepository;
        this.bookingPromoCodeRepository = bookingPromoCodeRepository;
    }

    public record PromoQuote(PromoCode promoCode, Money discount) {
    }

    /**
     * Locks the code row and works out the discount for {@code amount}. Nothing is redeemed yet.
     */
    public Result<PromoQuote> quote(String rawCode, UUID courseId, Money amount, OffsetDateTime now) {
        if (!PromoCodeValue.isValid(rawCode)) {
            return Result.failure("INVALID_PROMO_CODE");
        }
        PromoCode promoCode = promoCodeRepository.findByCodeForUpdate(PromoCodeValue.of(rawCode)).orElse(null);
        if (promoCode == null) {
            return Result.notFound("PROMO_CODE_NOT_FOUND");
        }
        String reason = rejectionReason(promoCode, courseId, now);
        if (reason != null) {
            return Result.failure(reason);
        }
        if (promoCode.getDiscountType() == DiscountType.FIXED_AMOUNT
                && !promoCode.getCurrency().equals(amount.getCurrency())) {
            return Result.failure("PROMO_CODE_CURRENCY_MISMATCH");
        }
        return Result.success(new PromoQuote(promoCode, promoCode.calculateDiscount(amount)));
    }

    public BookingPromoCode redeem(PromoQuote quote, UUID bookingId, OffsetDateTime now) {
        PromoCode promoCode = quote.promoCode();
        promoCode.redeem(now);
        promoCodeRepository.save(promoCode);
        BookingPromoCode applied = bookingPromoCodeRepository.save(
                BookingPromoCode.apply(bookingId, promoCode.getId(), quote.discount(), now));
        log.info("Promo code {} applied to booking {} (discount {})", promoCode.getCode(), bookingId, quote.discount());
        return applied;
    }

    static String rejectionReason(PromoCode promoCode, UUID courseId, OffsetDateTime now) {
        if (!promoCode.isActive()) {
            return "PROMO_CODE_INACTIVE";
        }
        if (now.isBefore(promoCode.getValidFrom())) {
            return "PROMO_CODE_NOT_YET_VALID";
        }
        if (now.isAfter(promoCode.getValidUntil())) {
            return "PROMO_CODE_EXPIRED";
        }
        if (promoCode.isUsageExhausted()) {
            return "PROMO_CODE_USAGE_EXHAUSTED";
        }
        if (courseId != null && !promoCode.isApplicable(courseId, now)) {
            return "PROMO_CODE_NOT_APPLICABLE";
        }
        return null;
    }
}
