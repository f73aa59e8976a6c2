package com.medicaledu.backend.global.error;

import java.util.List;

/**
 * Raised by the validation pipeline step for requests whose handler does not return a {@code Result}.
 */
public class RequestValidationException extends RuntimeException {

    private final List<String> errors;

    public RequestValidationException(List<String> errors) {
        super("Validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
