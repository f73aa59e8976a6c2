package com.medicaledu.backend.modules.promotions.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.domain.PromoCodeValue;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.common.result.ResultErrorType;
import com.medicaledu.backend.modules.promotions.domain.BookingPromoCode;
import com.medicaledu.backend.modules.promotions.domain.DiscountType;
import com.medicaledu.backend.modules.promotions.domain.PromoCode;
import com.medicaledu.backend.modules.promotions.infrastructure.persistence.BookingPromoCodeRepository;
import com.medicaledu.backend.modules.promotions.infrastructure.persistence.PromoCodeRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PromoCodeServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private PromoCodeRepository promoCodeRepository;

    @Mock
    private BookingPromoCodeRepository bookingPromoCodeRepository;

    private PromoCodeService service;

    private final UUID courseId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new PromoCodeService(promoCodeRepository, bookingPromoCodeRepository);
    }

    @Test
    void percentageCodeIsQuotedAgainstAmount() {
        PromoCode code = percentage("SPRING20", 1, List.of());
        when(promoCodeRepository.findByCodeForUpdate(PromoCodeValue.of("SPRING20"))).thenReturn(Optional.of(code));

        Result<PromoCodeService.PromoQuote> quote = service.quote("spring20", courseId, usd("150.00"), NOW);

        assertThat(quote.isSuccess()).isTrue();
        assertThat(quote.getValue().discount()).isEqualTo(usd("30.00"));
        assertThat(code.getCurrentUses()).isZero();
    }

    @Test
    void malformedCodeNeverHitsRepository() {
        Result<PromoCodeService.PromoQuote> quote = service.quote("!", courseId, usd("10.00"), NOW);

        assertThat(quote.getErrors()).containsExactly("INVALID_PROMO_CODE");
        verifyNoInteractions(promoCodeRepository);
    }

    @Test
    void unknownCodeIsNotFound() {
        when(promoCodeRepository.findByCodeForUpdate(any())).thenReturn(Optional.empty());

        Result<PromoCodeService.PromoQuote> quote = service.quote("NOPE1", courseId, usd("10.00"), NOW);

        assertThat(quote.getErrorType()).isEqualTo(ResultErrorType.NOT_FOUND);
        assertThat(quote.getErrors()).containsExactly("PROMO_CODE_NOT_FOUND");
    }

    @Test
    void codeLimitedToOtherCoursesIsNotApplicable() {
        PromoCode code = percentage("SURGERY10", null, List.of(UUID.randomUUID()));
        when(promoCodeRepository.findByCodeForUpdate(any())).thenReturn(Optional.of(code));

        Result<PromoCodeService.PromoQuote> quote = service.quote("SURGERY10", courseId, usd("10.00"), NOW);

        assertThat(quote.getErrors()).containsExactly("PROMO_CODE_NOT_APPLICABLE");
    }

    @Test
    void fixedAmountInOtherCurrencyIsRejected() {
        PromoCode code = PromoCode.create(PromoCodeValue.of("EURO15"), null, DiscountType.FIXED_AMOUNT,
                new BigDecimal("15"), Currency.EUR, null, NOW.minusDays(1), NOW.plusDays(1), null, NOW);
        when(promoCodeRepository.findByCodeForUpdate(any())).thenReturn(Optional.of(code));

        Result<PromoCodeService.PromoQuote> quote = service.quote("EURO15", courseId, usd("100.00"), NOW);

        assertThat(quote.getErrors()).containsExactly("PROMO_CODE_CURRENCY_MISMATCH");
    }

    @Test
    void redeemCountsUseAndRecordsBookingLink() {
        PromoCode code = percentage("ONCE", 1, List.of());
        when(promoCodeRepository.save(any(PromoCode.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(bookingPromoCodeRepository.save(any(BookingPromoCode.class))).thenAnswer(invocation -> invocation.getArgument(0));
        UUID bookingId = UUID.randomUUID();

        BookingPromoCode applied = service.redeem(new PromoCodeService.PromoQuote(code, usd("5.00")), bookingId, NOW);

        assertThat(code.getCurrentUses()).isEqualTo(1);
        assertThat(code.isUsageExhausted()).isTrue();
        assertThat(applied.getBookingId()).isEqualTo(bookingId);
        assertThat(applied.getPromoCodeId()).isEqualTo(code.getId());
    }

    @Test
    void exhaustedCodeIsRejectedBeforeRedeem() {
        PromoCode code = percentage("ONCE", 1, List.of());
        code.redeem(NOW);
        when(promoCodeRepository.findByCodeForUpdate(any())).thenReturn(Optional.of(code));

        Result<PromoCodeService.PromoQuote> quote = service.quote("ONCE", courseId, usd("10.00"), NOW);

        assertThat(quote.getErrors()).containsExactly("PROMO_CODE_USAGE_EXHAUSTED");
        verify(promoCodeRepository, never()).save(any());
    }

    private PromoCode percentage(String code, Integer maxUses, List<UUID> courses) {
        return PromoCode.create(PromoCodeValue.of(code), null, DiscountType.PERCENTAGE, new BigDecimal("20"),
                Currency.USD, maxUses, NOW.minusDays(1), NOW.plusDays(30), courses, NOW);
    }

    private static Money usd(String amount) {
        return Money.of(new BigDecimal(amount), Currency.USD);
    }
}
