package com.medicaledu.backend.modules.payments.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.payments.domain.Payment;
import com.medicaledu.backend.modules.payments.domain.PaymentStatus;
import com.medicaledu.backend.modules.payments.infrastructure.persistence.PaymentRepository;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CreatePaymentHandler implements RequestHandler<CreatePaymentCommand, Result<PaymentResponse>> {

    private static final Logger log = LoggerFactory.getLogger(CreatePaymentHandler.class);

    private final PaymentRepository paymentRepository;
    private final BookingRepository bookingRepository;
    private final Clock clock;

    public CreatePaymentHandler(PaymentRepository paymentRepository, BookingRepository bookingRepository, Clock clock) {
        this.paymentRepository = paymentRepository;
        this.bookingRepository = bookingRepository;
        this.clock = clock;
    }

    @Override
    public Result<PaymentResponse> handle(CreatePaymentCommand command) {
        // the booking row lock serialises concurrent payment creation for the same booking
        Booking booking = bookingRepository.findByIdForUpdate(command.bookingId()).orElse(null);
        if (booking == null) {
            return Result.notFound("BOOKING_NOT_FOUND");
        }
        if (!booking.isActive()) {
            return Result.conflict("BOOKING_NOT_PAYABLE");
        }
        if (paymentRepository.existsByBookingIdAndStatusIn(
                booking.getId(), EnumSet.of(PaymentStatus.PENDING, PaymentStatus.SUCCEEDED))) {
            return Result.conflict("PAYMENT_ALREADY_EXISTS");
        }
        Payment payment = paymentRepository.save(Payment.create(
                booking.getId(),
                booking.getStudentId(),
                booking.getAmount(),
                command.provider(),
                command.providerTransactionId(),
                OffsetDateTime.now(clock)
        ));
        log.info("Payment {} created for booking {} ({})", payment.getId(), booking.getId(), payment.getAmount());
        return Result.success(PaymentResponse.from(payment));
    }
}
