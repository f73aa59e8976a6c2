package com.medicaledu.backend.global.error;

import com.medicaledu.backend.global.common.result.Result;

import org.springframework.http.HttpStatus;

/**
 * Unwraps handler results at the web boundary, turning failures into {@link ProblemException}s.
 */
public final class ResultProblems {

    static final String VALIDATION_CODE = "validation_error";

    private ResultProblems() {
    }

    public static <T> T orThrow(Result<T> result) {
        if (result.isSuccess()) {
            return result.getValue();
        }
        throw toProblem(result);
    }

    public static ProblemException toProblem(Result<?> result) {
        if (result.isSuccess()) {
            throw new IllegalArgumentException("Successful result cannot be converted to a problem");
        }
        String detail = String.join("; ", result.getErrors());
        return switch (result.getErrorType()) {
            case NOT_FOUND -> new ProblemException(HttpStatus.NOT_FOUND, result.getErrors().get(0), detail);
            case CONFLICT -> new ProblemException(HttpStatus.CONFLICT, result.getErrors().get(0), detail);
            case UNAUTHORIZED -> new ProblemException(HttpStatus.UNAUTHORIZED, result.getErrors().get(0), detail);
            case VALIDATION -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_CODE, detail);
            default -> new ProblemException(HttpStatus.BAD_REQUEST, result.getErrors().get(0), detail);
        };
    }
}
