package com.medicaledu.backend.modules.payments.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.payments.domain.Payment;
import com.medicaledu.backend.modules.payments.domain.PaymentStatus;
import com.medicaledu.backend.modules.payments.infrastructure.persistence.PaymentRepository;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;

import org.springframework.stereotype.Service;

@Service
public class SucceedPaymentHandler implements RequestHandler<SucceedPaymentCommand, Result<PaymentResponse>> {

    private final PaymentRepository paymentRepository;
    private final BookingRepository bookingRepository;
    private final Clock clock;

    public SucceedPaymentHandler(PaymentRepository paymentRepository, BookingRepository bookingRepository, Clock clock) {
        this.paymentRepository = paymentRepository;
        this.bookingRepository = bookingRepository;
        this.clock = clock;
    }

    @Override
    public Result<PaymentResponse> handle(SucceedPaymentCommand command) {
        Payment payment = paymentRepository.findByIdForUpdate(command.paymentId()).orElse(null);
        if (payment == null) {
            return Result.notFound("PAYMENT_NOT_FOUND");
        }
        if (payment.getStatus() != PaymentStatus.PENDING) {
            return Result.conflict("PAYMENT_NOT_PENDING");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        payment.markSucceeded(command.providerTransactionId(), now);
        paymentRepository.save(payment);

        bookingRepository.findByIdForUpdate(payment.getBookingId())
                .filter(booking -> booking.getStatus() == BookingStatus.PENDING)
                .ifPresent(booking -> {
                    booking.confirm(now);
                    bookingRepository.save(booking);
                });
        return Result.success(PaymentResponse.from(payment));
    }
}
