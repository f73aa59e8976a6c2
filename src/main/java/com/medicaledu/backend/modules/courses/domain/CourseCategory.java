package com.medicaledu.backend.modules.courses.domain;

public enum CourseCategory {
    ANATOMY,
    BIOCHEMISTRY,
    PHARMACOLOGY,
    PATHOLOGY,
    CLINICAL_SKILLS,
    MEDICAL_ETHICS,
    RESEARCH_METHODOLOGY,
    OTHER
}
