package com.medicaledu.backend.global.common.domain;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Absolute http(s) URL. A value without a scheme is treated as https.
 */
public final class Url {

    private static final int MAX_LENGTH = 2048;

    private final String value;

    private Url(String value) {
        this.value = value;
    }

    @JsonCreator
    public static Url of(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("URL is required.");
        }
        String candidate = raw.trim();
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }
        if (candidate.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("URL must not exceed " + MAX_LENGTH + " characters.");
        }
        try {
            URI uri = new URI(candidate);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new IllegalArgumentException("URL must use http or https: " + raw);
            }
            String host = uri.getHost();
            if (host == null || host.isBlank() || (!host.contains(".") && !host.equals("localhost"))) {
                throw new IllegalArgumentException("URL must contain a valid host: " + raw);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + raw, ex);
        }
        return new Url(candidate);
    }

    public static boolean isValid(String raw) {
        if (raw == null || raw.isBlank()) {
            return false;
        }
        try {
            of(raw);
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isSecure() {
        return value.toLowerCase(Locale.ROOT).startsWith("https://");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Url other)) {
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
