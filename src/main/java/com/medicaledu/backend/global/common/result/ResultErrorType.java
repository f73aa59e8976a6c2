package com.medicaledu.backend.global.common.result;

public enum ResultErrorType {
    NONE,
    FAILURE,
    NOT_FOUND,
    UNAUTHORIZED,
    CONFLICT,
    VALIDATION
}
