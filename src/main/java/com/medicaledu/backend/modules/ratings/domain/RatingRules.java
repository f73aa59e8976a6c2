package com.medicaledu.backend.modules.ratings.domain;

final class RatingRules {

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;
    static final int REVIEW_MAX_LENGTH = 2000;

    private RatingRules() {
    }

    static int checkRating(int rating) {
        if (rating < MIN_RATING || rating > MAX_RATING) {
            throw new IllegalArgumentException("Rating must be between " + MIN_RATING + " and " + MAX_RATING + ".");
        }
        return rating;
    }

    static String checkReview(String review) {
        if (review == null || review.isBlank()) {
            return null;
        }
        if (review.length() > REVIEW_MAX_LENGTH) {
            throw new IllegalArgumentException("Review must not exceed " + REVIEW_MAX_LENGTH + " characters.");
        }
        return review.trim();
    }
}
