package com.medicaledu.backend.modules.ratings.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.ratings.domain.InstructorRating;
import com.medicaledu.backend.modules.ratings.infrastructure.persistence.InstructorRatingRepository;
import com.medicaledu.backend.modules.ratings.presentation.dto.RatingResponse;

import org.springframework.stereotype.Service;

@Service
public class CreateInstructorRatingHandler implements RequestHandler<CreateInstructorRatingCommand, Result<RatingResponse>> {

    private final InstructorRatingRepository instructorRatingRepository;
    private final BookingRepository bookingRepository;
    private final Clock clock;

    public CreateInstructorRatingHandler(
            InstructorRatingRepository instructorRatingRepository,
            BookingRepository bookingRepository,
            Clock clock
    ) {
        this.instructorRatingRepository = instructorRatingRepository;
        this.bookingRepository = bookingRepository;
        this.clock = clock;
    }

    @Override
    public Result<RatingResponse> handle(CreateInstructorRatingCommand command) {
        Booking booking = bookingRepository.findById(command.bookingId()).orElse(null);
        if (booking == null) {
            return Result.notFound("BOOKING_NOT_FOUND");
        }
        if (!booking.getStudentId().equals(command.studentId())) {
            return Result.unauthorized("BOOKING_NOT_OWNED");
        }
        if (booking.getStatus() != BookingStatus.COMPLETED) {
            return Result.failure("BOOKING_NOT_COMPLETED");
        }
        if (instructorRatingRepository.existsByBookingId(booking.getId())) {
            return Result.conflict("RATING_ALREADY_EXISTS");
        }
        InstructorRating rating = instructorRatingRepository.save(InstructorRating.rate(
                booking.getInstructorId(),
                booking.getStudentId(),
                booking.getId(),
                command.rating(),
                command.review(),
                command.isPublic(),
                OffsetDateTime.now(clock)
        ));
        return Result.success(RatingResponse.from(rating));
    }
}
