package com.medicaledu.backend.modules.ratings.presentation.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.medicaledu.backend.global.web.PageResponse;

public record RatingSummaryResponse(
        BigDecimal averageRating,
        long ratingCount,
        PageResponse<RatingResponse> ratings
) {

    public static RatingSummaryResponse of(Double average, long count, PageResponse<RatingResponse> ratings) {
        BigDecimal rounded = average == null
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(average).setScale(2, RoundingMode.HALF_UP);
        return new RatingSummaryResponse(rounded, count, ratings);
    }
}
