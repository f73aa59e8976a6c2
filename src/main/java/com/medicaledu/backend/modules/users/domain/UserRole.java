package com.medicaledu.backend.modules.users.domain;

public enum UserRole {
    ADMIN,
    INSTRUCTOR,
    STUDENT
}
