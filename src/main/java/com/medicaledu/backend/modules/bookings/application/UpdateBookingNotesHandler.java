package com.medicaledu.backend.modules.bookings.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.domain.Url;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import org.springframework.stereotype.Service;

@Service
public class UpdateBookingNotesHandler implements RequestHandler<UpdateBookingNotesCommand, Result<BookingResponse>> {

    private final BookingRepository bookingRepository;
    private final Clock clock;

    public UpdateBookingNotesHandler(BookingRepository bookingRepository, Clock clock) {
        this.bookingRepository = bookingRepository;
        this.clock = clock;
    }

    @Override
    public Result<BookingResponse> handle(UpdateBookingNotesCommand command) {
        Booking booking = bookingRepository.findById(command.bookingId()).orElse(null);
        if (booking == null) {
            return Result.notFound("BOOKING_NOT_FOUND");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        booking.updateNotes(command.studentNotes(), command.instructorNotes(), now);
        if (command.meetingUrl() != null || command.meetingNotes() != null) {
            String rawUrl = command.meetingUrl() != null ? command.meetingUrl()
                    : booking.getMeetingUrl() == null ? null : booking.getMeetingUrl().getValue();
            Url meetingUrl = rawUrl == null || rawUrl.isBlank() ? null : Url.of(rawUrl);
            String meetingNotes = command.meetingNotes() != null ? command.meetingNotes() : booking.getMeetingNotes();
            booking.setMeeting(meetingUrl, meetingNotes, now);
        }
        bookingRepository.save(booking);
        return Result.success(BookingResponse.from(booking));
    }
}
