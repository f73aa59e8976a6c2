package com.medicaledu.backend.modules.bookings.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetBookingsHandler implements RequestHandler<GetBookingsQuery, Result<PageResponse<BookingResponse>>> {

    static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final BookingRepository bookingRepository;

    public GetBookingsHandler(BookingRepository bookingRepository) {
        this.bookingRepository = bookingRepository;
    }

    @Override
    public Result<PageResponse<BookingResponse>> handle(GetBookingsQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), NEWEST_FIRST);
        return Result.success(PageResponse.from(
                bookingRepository.search(query.userId(), query.instructorId(), query.status(), pageRequest),
                BookingResponse::from));
    }
}
