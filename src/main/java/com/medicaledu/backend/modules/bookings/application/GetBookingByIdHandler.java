package com.medicaledu.backend.modules.bookings.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetBookingByIdHandler implements RequestHandler<GetBookingByIdQuery, Result<BookingResponse>> {

    private final BookingRepository bookingRepository;

    public GetBookingByIdHandler(BookingRepository bookingRepository) {
        this.bookingRepository = bookingRepository;
    }

    @Override
    public Result<BookingResponse> handle(GetBookingByIdQuery query) {
        return bookingRepository.findById(query.bookingId())
                .map(BookingResponse::from)
                .map(Result::success)
                .orElseGet(() -> Result.notFound("BOOKING_NOT_FOUND"));
    }
}
