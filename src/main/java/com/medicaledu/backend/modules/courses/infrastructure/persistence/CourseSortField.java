package com.medicaledu.backend.modules.courses.infrastructure.persistence;

import java.util.Locale;

public enum CourseSortField {
    TITLE("c.title"),
    PRICE("c.price.amount"),
    CREATED_AT("c.createdAt"),
    PUBLISHED_AT("c.publishedAt"),
    UPDATED_AT("c.updatedAt"),
    DURATION("c.durationMinutes");

    private final String path;

    CourseSortField(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }

    /**
     * Accepts the lower camel names used by the API ({@code createdAt}, {@code publishedAt}, ...).
     */
    public static CourseSortField fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return CREATED_AT;
        }
        String normalized = value.trim().replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
        for (CourseSortField field : values()) {
            if (field.name().equals(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unsupported sort field: " + value);
    }
}
