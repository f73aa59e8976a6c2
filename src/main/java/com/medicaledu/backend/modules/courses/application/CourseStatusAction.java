package com.medicaledu.backend.modules.courses.application;

public enum CourseStatusAction {
    PUBLISH,
    UNPUBLISH,
    ACTIVATE,
    DEACTIVATE
}
