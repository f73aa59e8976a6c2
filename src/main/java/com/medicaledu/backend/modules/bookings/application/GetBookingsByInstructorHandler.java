package com.medicaledu.backend.modules.bookings.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetBookingsByInstructorHandler
        implements RequestHandler<GetBookingsByInstructorQuery, Result<PageResponse<BookingResponse>>> {

    private final BookingRepository bookingRepository;

    public GetBookingsByInstructorHandler(BookingRepository bookingRepository) {
        this.bookingRepository = bookingRepository;
    }

    @Override
    public Result<PageResponse<BookingResponse>> handle(GetBookingsByInstructorQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), GetBookingsHandler.NEWEST_FIRST);
        return Result.success(PageResponse.from(
                bookingRepository.findByInstructorId(query.instructorId(), pageRequest), BookingResponse::from));
    }
}
