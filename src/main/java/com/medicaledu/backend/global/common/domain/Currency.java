package com.medicaledu.backend.global.common.domain;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ISO-4217 style three letter currency code.
 */
public final class Currency {

    private static final Pattern CODE_PATTERN = Pattern.compile("^[A-Z]{3}$");

    public static final Currency USD = new Currency("USD");
    public static final Currency EUR = new Currency("EUR");

    private final String code;

    private Currency(String code) {
        this.code = code;
    }

    @JsonCreator
    public static Currency of(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Currency code is required.");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (!CODE_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Currency code must be exactly three letters: " + code);
        }
        return new Currency(normalized);
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Currency other)) {
            return false;
        }
        return code.equals(other.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code);
    }

    @Override
    public String toString() {
        return code;
    }
}
