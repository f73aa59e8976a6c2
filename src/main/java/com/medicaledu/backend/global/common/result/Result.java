package com.medicaledu.backend.global.common.result;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a handled request. Either carries a value or a non-empty list of error messages
 * tagged with an {@link ResultErrorType} so the web layer can pick a status code.
 */
public final class Result<T> {

    private static final String DEFAULT_NOT_FOUND = "Entity Not Found";
    private static final String DEFAULT_UNAUTHORIZED = "Unauthorized access";
    private static final String DEFAULT_CONFLICT = "Entity already exists";

    private final boolean success;
    private final T value;
    private final List<String> errors;
    private final ResultErrorType errorType;

    private Result(boolean success, T value, List<String> errors, ResultErrorType errorType) {
        this.success = success;
        this.value = value;
        this.errors = errors;
        this.errorType = errorType;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(true, value, List.of(), ResultErrorType.NONE);
    }

    public static <T> Result<T> failure(String... errors) {
        return failure(ResultErrorType.FAILURE, errors == null ? List.of() : Arrays.asList(errors));
    }

    public static <T> Result<T> notFound() {
        return notFound(DEFAULT_NOT_FOUND);
    }

    public static <T> Result<T> notFound(String errorMessage) {
        return failure(ResultErrorType.NOT_FOUND, List.of(errorMessage));
    }

    public static <T> Result<T> unauthorized() {
        return unauthorized(DEFAULT_UNAUTHORIZED);
    }

    public static <T> Result<T> unauthorized(String errorMessage) {
        return failure(ResultErrorType.UNAUTHORIZED, List.of(errorMessage));
    }

    public static <T> Result<T> conflict() {
        return conflict(DEFAULT_CONFLICT);
    }

    public static <T> Result<T> conflict(String errorMessage) {
        return failure(ResultErrorType.CONFLICT, List.of(errorMessage));
    }

    public static <T> Result<T> validationFailure(List<String> errors) {
        return failure(ResultErrorType.VALIDATION, errors);
    }

    private static <T> Result<T> failure(ResultErrorType type, List<String> errors) {
        List<String> messages = errors == null ? List.of() : errors.stream()
                .filter(Objects::nonNull)
                .filter(message -> !message.isBlank())
                .toList();
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("A failed result requires at least one error message");
        }
        return new Result<>(false, null, messages, type);
    }

    /**
     * Re-types a failed result so it can be returned from a handler with a different value type.
     */
    @SuppressWarnings("unchecked")
    public <U> Result<U> castFailure() {
        if (success) {
            throw new IllegalStateException("Cannot re-type a successful result");
        }
        return (Result<U>) this;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public T getValue() {
        if (!success) {
            throw new IllegalStateException("Cannot read the value of a failed result: " + errors);
        }
        return value;
    }

    public Optional<T> tryGetValue() {
        return success ? Optional.ofNullable(value) : Optional.empty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public ResultErrorType getErrorType() {
        return errorType;
    }

    @Override
    public String toString() {
        return success ? "Result[success]" : "Result[" + errorType + " " + errors + "]";
    }
}
