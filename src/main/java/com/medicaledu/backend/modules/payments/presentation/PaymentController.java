package com.medicaledu.backend.modules.payments.presentation;

import java.net.URI;
import java.util.UUID;

import com.medicaledu.backend.global.error.ResultProblems;
import com.medicaledu.backend.global.pipeline.Mediator;
import com.medicaledu.backend.global.security.SecurityUtils;
import com.medicaledu.backend.global.web.PageRequests;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.bookings.application.GetBookingByIdQuery;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;
import com.medicaledu.backend.modules.payments.application.CancelPaymentCommand;
import com.medicaledu.backend.modules.payments.application.CreatePaymentCommand;
import com.medicaledu.backend.modules.payments.application.FailPaymentCommand;
import com.medicaledu.backend.modules.payments.application.GetPaymentByIdQuery;
import com.medicaledu.backend.modules.payments.application.GetPaymentsByUserQuery;
import com.medicaledu.backend.modules.payments.application.GetPaymentsQuery;
import com.medicaledu.backend.modules.payments.application.RefundPaymentCommand;
import com.medicaledu.backend.modules.payments.application.SucceedPaymentCommand;
import com.medicaledu.backend.modules.payments.domain.PaymentStatus;
import com.medicaledu.backend.modules.payments.presentation.dto.CreatePaymentRequest;
import com.medicaledu.backend.modules.payments.presentation.dto.FailPaymentRequest;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;
import com.medicaledu.backend.modules.payments.presentation.dto.RefundPaymentRequest;
import com.medicaledu.backend.modules.payments.presentation.dto.SucceedPaymentRequest;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Payment records for bookings. Provider callbacks are modelled as the succeed and fail
 * endpoints, which only administrators may call.
 */
@RestController
@RequestMapping("/api/payments")
public class PaymentController {

    private final Mediator mediator;

    public PaymentController(Mediator mediator) {
        this.mediator = mediator;
    }

    @GetMapping("/{paymentId}")
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable("paymentId") UUID paymentId) {
        PaymentResponse payment = ResultProblems.orThrow(mediator.send(new GetPaymentByIdQuery(paymentId)));
        SecurityUtils.requireSelfOrAdmin(payment.userId());
        return ResponseEntity.ok(payment);
    }

    @GetMapping
    public ResponseEntity<PageResponse<PaymentResponse>> getPayments(
            @RequestParam(name = "status", required = false) PaymentStatus status,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        SecurityUtils.requireAdmin();
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetPaymentsQuery(status, PageRequests.page(page), PageRequests.size(size)))));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<PageResponse<PaymentResponse>> getPaymentsByUser(
            @PathVariable("userId") UUID userId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        SecurityUtils.requireSelfOrAdmin(userId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetPaymentsByUserQuery(userId, PageRequests.page(page), PageRequests.size(size)))));
    }

    @Operation(summary = "Start a payment", description = "Creates a pending payment for the booking amount.")
    @PostMapping
    public ResponseEntity<PaymentResponse> createPayment(@RequestBody CreatePaymentRequest request) {
        BookingResponse booking = ResultProblems.orThrow(mediator.send(new GetBookingByIdQuery(request.bookingId())));
        SecurityUtils.requireSelfOrAdmin(booking.studentId());
        PaymentResponse created = ResultProblems.orThrow(mediator.send(new CreatePaymentCommand(
                request.bookingId(), request.provider(), request.providerTransactionId())));
        return ResponseEntity.created(URI.create("/api/payments/" + created.id())).body(created);
    }

    @PostMapping("/{paymentId}/succeed")
    public ResponseEntity<PaymentResponse> succeedPayment(
            @PathVariable("paymentId") UUID paymentId,
            @RequestBody(required = false) SucceedPaymentRequest request
    ) {
        SecurityUtils.requireAdmin();
        String transactionId = request == null ? null : request.providerTransactionId();
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new SucceedPaymentCommand(paymentId, transactionId))));
    }

    @PostMapping("/{paymentId}/fail")
    public ResponseEntity<PaymentResponse> failPayment(
            @PathVariable("paymentId") UUID paymentId,
            @RequestBody FailPaymentRequest request
    ) {
        SecurityUtils.requireAdmin();
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new FailPaymentCommand(paymentId, request.reason()))));
    }

    @PostMapping("/{paymentId}/cancel")
    public ResponseEntity<PaymentResponse> cancelPayment(@PathVariable("paymentId") UUID paymentId) {
        PaymentResponse payment = ResultProblems.orThrow(mediator.send(new GetPaymentByIdQuery(paymentId)));
        SecurityUtils.requireSelfOrAdmin(payment.userId());
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new CancelPaymentCommand(paymentId))));
    }

    @PostMapping("/{paymentId}/refund")
    public ResponseEntity<PaymentResponse> refundPayment(
            @PathVariable("paymentId") UUID paymentId,
            @RequestBody RefundPaymentRequest request
    ) {
        SecurityUtils.requireAdmin();
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new RefundPaymentCommand(paymentId, request.amount(), request.reason()))));
    }
}
