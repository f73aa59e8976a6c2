package com.medicaledu.backend.modules.enrollments.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.courses.domain.Course;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;
import com.medicaledu.backend.modules.enrollments.domain.Enrollment;
import com.medicaledu.backend.modules.enrollments.infrastructure.persistence.EnrollmentRepository;
import com.medicaledu.backend.modules.enrollments.presentation.dto.EnrollmentResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CreateEnrollmentHandler implements RequestHandler<CreateEnrollmentCommand, Result<EnrollmentResponse>> {

    private static final Logger log = LoggerFactory.getLogger(CreateEnrollmentHandler.class);

    private final EnrollmentRepository enrollmentRepository;
    private final CourseRepository courseRepository;
    private final Clock clock;

    public CreateEnrollmentHandler(EnrollmentRepository enrollmentRepository, CourseRepository courseRepository, Clock clock) {
        this.enrollmentRepository = enrollmentRepository;
        this.courseRepository = courseRepository;
        this.clock = clock;
    }

    @Override
    public Result<EnrollmentResponse> handle(CreateEnrollmentCommand command) {
        Course course = courseRepository.findById(command.courseId()).orElse(null);
        if (course == null || course.getDeletedAt() != null) {
            return Result.notFound("COURSE_NOT_FOUND");
        }
        if (!course.isPublished() || !course.isActive()) {
            return Result.failure("COURSE_NOT_AVAILABLE");
        }
        if (enrollmentRepository.existsByStudentIdAndCourseIdAndActiveTrue(command.studentId(), command.courseId())) {
            return Result.conflict("ALREADY_ENROLLED");
        }
        Enrollment enrollment = enrollmentRepository.save(
                Enrollment.enroll(command.studentId(), command.courseId(), OffsetDateTime.now(clock)));
        log.info("Student {} enrolled in course {}", command.studentId(), command.courseId());
        return Result.success(EnrollmentResponse.from(enrollment));
    }
}
