package com.medicaledu.backend.modules.bookings.presentation;

import java.net.URI;
import java.util.UUID;

import com.medicaledu.backend.global.error.ResultProblems;
import com.medicaledu.backend.global.pipeline.Mediator;
import com.medicaledu.backend.global.security.SecurityUtils;
import com.medicaledu.backend.global.web.PageRequests;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.bookings.application.CancelBookingCommand;
import com.medicaledu.backend.modules.bookings.application.CompleteBookingCommand;
import com.medicaledu.backend.modules.bookings.application.ConfirmBookingCommand;
import com.medicaledu.backend.modules.bookings.application.CreateBookingCommand;
import com.medicaledu.backend.modules.bookings.application.GetBookingByIdQuery;
import com.medicaledu.backend.modules.bookings.application.GetBookingsByInstructorQuery;
import com.medicaledu.backend.modules.bookings.application.GetBookingsByUserQuery;
import com.medicaledu.backend.modules.bookings.application.GetBookingsQuery;
import com.medicaledu.backend.modules.bookings.application.NoShowBookingCommand;
import com.medicaledu.backend.modules.bookings.application.RescheduleBookingCommand;
import com.medicaledu.backend.modules.bookings.application.UpdateBookingNotesCommand;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;
import com.medicaledu.backend.modules.bookings.presentation.dto.CancelBookingRequest;
import com.medicaledu.backend.modules.bookings.presentation.dto.CreateBookingRequest;
import com.medicaledu.backend.modules.bookings.presentation.dto.RescheduleBookingRequest;
import com.medicaledu.backend.modules.bookings.presentation.dto.UpdateBookingNotesRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/bookings")
public class BookingController {

    private final Mediator mediator;

    public BookingController(Mediator mediator) {
        this.mediator = mediator;
    }

    @GetMapping("/{bookingId}")
    public ResponseEntity<BookingResponse> getBooking(@PathVariable("bookingId") UUID bookingId) {
        return ResponseEntity.ok(requireParticipant(bookingId));
    }

    @GetMapping
    public ResponseEntity<PageResponse<BookingResponse>> getBookings(
            @RequestParam(name = "userId", required = false) UUID userId,
            @RequestParam(name = "instructorId", required = false) UUID instructorId,
            @RequestParam(name = "status", required = false) BookingStatus status,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        if (userId != null) {
            SecurityUtils.requireSelfOrAdmin(userId);
        } else if (instructorId != null) {
            SecurityUtils.requireSelfOrAdmin(instructorId);
        } else {
            SecurityUtils.requireAdmin();
        }
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new GetBookingsQuery(
                userId, instructorId, status, PageRequests.page(page), PageRequests.size(size)))));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<PageResponse<BookingResponse>> getBookingsByUser(
            @PathVariable("userId") UUID userId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        SecurityUtils.requireSelfOrAdmin(userId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetBookingsByUserQuery(userId, PageRequests.page(page), PageRequests.size(size)))));
    }

    @GetMapping("/instructor/{instructorId}")
    public ResponseEntity<PageResponse<BookingResponse>> getBookingsByInstructor(
            @PathVariable("instructorId") UUID instructorId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        SecurityUtils.requireSelfOrAdmin(instructorId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetBookingsByInstructorQuery(instructorId, PageRequests.page(page), PageRequests.size(size)))));
    }

    @Operation(summary = "Book a slot", description = "Reserves one seat on the slot and applies an optional promo code.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Booking created"),
            @ApiResponse(responseCode = "404", description = "Slot or promo code not found"),
            @ApiResponse(responseCode = "409", description = "Slot full, inactive or already booked by the student")
    })
    @PostMapping
    public ResponseEntity<BookingResponse> createBooking(@RequestBody CreateBookingRequest request) {
        SecurityUtils.requireSelfOrAdmin(request.studentId());
        BookingResponse created = ResultProblems.orThrow(mediator.send(new CreateBookingCommand(
                request.studentId(), request.slotId(), request.promoCode(), request.notes())));
        return ResponseEntity.created(URI.create("/api/bookings/" + created.id())).body(created);
    }

    @PostMapping("/{bookingId}/confirm")
    public ResponseEntity<BookingResponse> confirmBooking(@PathVariable("bookingId") UUID bookingId) {
        requireInstructor(bookingId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new ConfirmBookingCommand(bookingId))));
    }

    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<BookingResponse> cancelBooking(
            @PathVariable("bookingId") UUID bookingId,
            @RequestBody CancelBookingRequest request
    ) {
        requireParticipant(bookingId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new CancelBookingCommand(bookingId, request.reason(), SecurityUtils.getCurrentUserId()))));
    }

    @PostMapping("/{bookingId}/complete")
    public ResponseEntity<BookingResponse> completeBooking(@PathVariable("bookingId") UUID bookingId) {
        requireInstructor(bookingId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new CompleteBookingCommand(bookingId))));
    }

    @PostMapping("/{bookingId}/no-show")
    public ResponseEntity<BookingResponse> markNoShow(@PathVariable("bookingId") UUID bookingId) {
        requireInstructor(bookingId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new NoShowBookingCommand(bookingId))));
    }

    @PostMapping("/{bookingId}/reschedule")
    public ResponseEntity<BookingResponse> rescheduleBooking(
            @PathVariable("bookingId") UUID bookingId,
            @RequestBody RescheduleBookingRequest request
    ) {
        requireParticipant(bookingId);
        BookingResponse replacement = ResultProblems.orThrow(mediator.send(
                new RescheduleBookingCommand(bookingId, request.newSlotId())));
        return ResponseEntity.created(URI.create("/api/bookings/" + replacement.id())).body(replacement);
    }

    @PutMapping("/{bookingId}/notes")
    public ResponseEntity<BookingResponse> updateNotes(
            @PathVariable("bookingId") UUID bookingId,
            @RequestBody UpdateBookingNotesRequest request
    ) {
        requireParticipant(bookingId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new UpdateBookingNotesCommand(
                bookingId,
                request.studentNotes(),
                request.instructorNotes(),
                request.meetingUrl(),
                request.meetingNotes()
        ))));
    }

    private BookingResponse requireParticipant(UUID bookingId) {
        BookingResponse booking = ResultProblems.orThrow(mediator.send(new GetBookingByIdQuery(bookingId)));
        SecurityUtils.requireOneOfOrAdmin(booking.studentId(), booking.instructorId());
        return booking;
    }

    private void requireInstructor(UUID bookingId) {
        BookingResponse booking = ResultProblems.orThrow(mediator.send(new GetBookingByIdQuery(bookingId)));
        SecurityUtils.requireSelfOrAdmin(booking.instructorId());
    }
}
