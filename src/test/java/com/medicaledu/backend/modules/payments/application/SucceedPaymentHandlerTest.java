package com.medicaledu.backend.modules.payments.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.common.result.ResultErrorType;
import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.payments.domain.Payment;
import com.medicaledu.backend.modules.payments.domain.PaymentProvider;
import com.medicaledu.backend.modules.payments.domain.PaymentStatus;
import com.medicaledu.backend.modules.payments.infrastructure.persistence.PaymentRepository;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SucceedPaymentHandlerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private BookingRepository bookingRepository;

    private SucceedPaymentHandler handler;

    private Booking booking;
    private Payment payment;

    @BeforeEach
    void setUp() {
        handler = new SucceedPaymentHandler(paymentRepository, bookingRepository,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        Money price = Money.of(new BigDecimal("150.00"), Currency.EUR);
        booking = Booking.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                price, null, null, null, NOW.minusHours(1));
        payment = Payment.create(booking.getId(), booking.getStudentId(), price, PaymentProvider.STRIPE, null,
                NOW.minusHours(1));
    }

    @Test
    void succeededPaymentConfirmsPendingBooking() {
        when(paymentRepository.findByIdForUpdate(payment.getId())).thenReturn(Optional.of(payment));
        when(bookingRepository.findByIdForUpdate(booking.getId())).thenReturn(Optional.of(booking));

        Result<PaymentResponse> result = handler.handle(new SucceedPaymentCommand(payment.getId(), " pi_123 "));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().status()).isEqualTo(PaymentStatus.SUCCEEDED);
        assertThat(result.getValue().providerTransactionId()).isEqualTo("pi_123");
        assertThat(result.getValue().processedAt()).isEqualTo(NOW);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(booking.getConfirmedAt()).isEqualTo(NOW);
        verify(paymentRepository).save(payment);
        verify(bookingRepository).save(booking);
    }

    @Test
    void alreadyConfirmedBookingIsLeftAlone() {
        booking.confirm(NOW.minusMinutes(30));
        when(paymentRepository.findByIdForUpdate(payment.getId())).thenReturn(Optional.of(payment));
        when(bookingRepository.findByIdForUpdate(booking.getId())).thenReturn(Optional.of(booking));

        Result<PaymentResponse> result = handler.handle(new SucceedPaymentCommand(payment.getId(), null));

        assertThat(result.isSuccess()).isTrue();
        assertThat(booking.getConfirmedAt()).isEqualTo(NOW.minusMinutes(30));
        verify(bookingRepository, never()).save(any());
    }

    @Test
    void nonPendingPaymentIsConflict() {
        payment.markFailed("card declined", NOW.minusMinutes(5));
        when(paymentRepository.findByIdForUpdate(payment.getId())).thenReturn(Optional.of(payment));

        Result<PaymentResponse> result = handler.handle(new SucceedPaymentCommand(payment.getId(), null));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.CONFLICT);
        assertThat(result.getErrors()).containsExactly("PAYMENT_NOT_PENDING");
        verifyNoInteractions(bookingRepository);
    }

    @Test
    void unknownPaymentIsNotFound() {
        UUID paymentId = UUID.randomUUID();
        when(paymentRepository.findByIdForUpdate(paymentId)).thenReturn(Optional.empty());

        Result<PaymentResponse> result = handler.handle(new SucceedPaymentCommand(paymentId, null));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.NOT_FOUND);
        assertThat(result.getErrors()).containsExactly("PAYMENT_NOT_FOUND");
    }
}
