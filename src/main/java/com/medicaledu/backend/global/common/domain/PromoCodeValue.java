package com.medicaledu.backend.global.common.domain;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Upper-case alphanumeric promo code of 4 to 20 characters. Whitespace is stripped on input.
 */
public final class PromoCodeValue {

    public static final int MIN_LENGTH = 4;
    public static final int MAX_LENGTH = 20;

    private static final Pattern CODE_PATTERN = Pattern.compile("^[A-Z0-9]{4,20}$");
    private static final char[] ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String value;

    private PromoCodeValue(String value) {
        this.value = value;
    }

    @JsonCreator
    public static PromoCodeValue of(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Promo code is required.");
        }
        String normalized = raw.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        if (!CODE_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException(
                    "Promo code must be " + MIN_LENGTH + "-" + MAX_LENGTH + " letters or digits: " + raw);
        }
        return new PromoCodeValue(normalized);
    }

    public static boolean isValid(String raw) {
        return raw != null && CODE_PATTERN.matcher(raw.replaceAll("\\s+", "").toUpperCase(Locale.ROOT)).matches();
    }

    public static PromoCodeValue generate(int length) {
        if (length < MIN_LENGTH || length > MAX_LENGTH) {
            throw new IllegalArgumentException("Length must be between " + MIN_LENGTH + " and " + MAX_LENGTH + ".");
        }
        char[] code = new char[length];
        for (int i = 0; i < length; i++) {
            code[i] = ALPHABET[RANDOM.nextInt(ALPHABET.length)];
        }
        return new PromoCodeValue(new String(code));
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PromoCodeValue other)) {
            return false;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
