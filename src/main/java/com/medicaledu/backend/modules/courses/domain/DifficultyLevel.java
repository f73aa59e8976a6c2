package com.medicaledu.backend.modules.courses.domain;

public enum DifficultyLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED,
    EXPERT
}
