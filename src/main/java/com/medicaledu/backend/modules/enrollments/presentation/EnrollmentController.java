package com.medicaledu.backend.modules.enrollments.presentation;

import java.net.URI;
import java.util.UUID;

import com.medicaledu.backend.global.error.ResultProblems;
import com.medicaledu.backend.global.pipeline.Mediator;
import com.medicaledu.backend.global.security.SecurityUtils;
import com.medicaledu.backend.global.web.PageRequests;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.courses.application.GetCourseByIdQuery;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseResponse;
import com.medicaledu.backend.modules.enrollments.application.CompleteEnrollmentCommand;
import com.medicaledu.backend.modules.enrollments.application.CreateEnrollmentCommand;
import com.medicaledu.backend.modules.enrollments.application.GetEnrollmentByIdQuery;
import com.medicaledu.backend.modules.enrollments.application.GetEnrollmentsByCourseQuery;
import com.medicaledu.backend.modules.enrollments.application.GetEnrollmentsByUserQuery;
import com.medicaledu.backend.modules.enrollments.application.GetEnrollmentsQuery;
import com.medicaledu.backend.modules.enrollments.application.RecordProgressCommand;
import com.medicaledu.backend.modules.enrollments.application.SetEnrollmentActiveCommand;
import com.medicaledu.backend.modules.enrollments.presentation.dto.CreateEnrollmentRequest;
import com.medicaledu.backend.modules.enrollments.presentation.dto.EnrollmentResponse;
import com.medicaledu.backend.modules.enrollments.presentation.dto.RecordProgressRequest;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/enrollments")
public class EnrollmentController {

    private final Mediator mediator;

    public EnrollmentController(Mediator mediator) {
        this.mediator = mediator;
    }

    @GetMapping("/{enrollmentId}")
    public ResponseEntity<EnrollmentResponse> getEnrollment(@PathVariable("enrollmentId") UUID enrollmentId) {
        return ResponseEntity.ok(requireEnrollmentOwner(enrollmentId));
    }

    @GetMapping
    public ResponseEntity<PageResponse<EnrollmentResponse>> getEnrollments(
            @RequestParam(name = "courseId", required = false) UUID courseId,
            @RequestParam(name = "userId", required = false) UUID userId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        if (userId != null) {
            SecurityUtils.requireSelfOrAdmin(userId);
        } else if (courseId != null) {
            requireCourseInstructor(courseId);
        } else {
            SecurityUtils.requireAdmin();
        }
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetEnrollmentsQuery(courseId, userId, PageRequests.page(page), PageRequests.size(size)))));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<PageResponse<EnrollmentResponse>> getEnrollmentsByUser(
            @PathVariable("userId") UUID userId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        SecurityUtils.requireSelfOrAdmin(userId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetEnrollmentsByUserQuery(userId, PageRequests.page(page), PageRequests.size(size)))));
    }

    @GetMapping("/course/{courseId}")
    public ResponseEntity<PageResponse<EnrollmentResponse>> getEnrollmentsByCourse(
            @PathVariable("courseId") UUID courseId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        requireCourseInstructor(courseId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetEnrollmentsByCourseQuery(courseId, PageRequests.page(page), PageRequests.size(size)))));
    }

    @PostMapping
    public ResponseEntity<EnrollmentResponse> enroll(@RequestBody CreateEnrollmentRequest request) {
        SecurityUtils.requireSelfOrAdmin(request.studentId());
        EnrollmentResponse created = ResultProblems.orThrow(mediator.send(
                new CreateEnrollmentCommand(request.studentId(), request.courseId())));
        return ResponseEntity.created(URI.create("/api/enrollments/" + created.id())).body(created);
    }

    @PostMapping("/{enrollmentId}/progress")
    public ResponseEntity<EnrollmentResponse> recordProgress(
            @PathVariable("enrollmentId") UUID enrollmentId,
            @RequestBody RecordProgressRequest request
    ) {
        requireEnrollmentOwner(enrollmentId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new RecordProgressCommand(
                enrollmentId,
                request.materialId(),
                request.secondsSpent() == null ? 0 : request.secondsSpent(),
                Boolean.TRUE.equals(request.completed())
        ))));
    }

    @PostMapping("/{enrollmentId}/complete")
    public ResponseEntity<EnrollmentResponse> complete(@PathVariable("enrollmentId") UUID enrollmentId) {
        requireEnrollmentOwner(enrollmentId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new CompleteEnrollmentCommand(enrollmentId))));
    }

    @PostMapping("/{enrollmentId}/deactivate")
    public ResponseEntity<EnrollmentResponse> deactivate(@PathVariable("enrollmentId") UUID enrollmentId) {
        requireEnrollmentOwner(enrollmentId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new SetEnrollmentActiveCommand(enrollmentId, false))));
    }

    @PostMapping("/{enrollmentId}/reactivate")
    public ResponseEntity<EnrollmentResponse> reactivate(@PathVariable("enrollmentId") UUID enrollmentId) {
        requireEnrollmentOwner(enrollmentId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new SetEnrollmentActiveCommand(enrollmentId, true))));
    }

    private EnrollmentResponse requireEnrollmentOwner(UUID enrollmentId) {
        EnrollmentResponse enrollment = ResultProblems.orThrow(mediator.send(new GetEnrollmentByIdQuery(enrollmentId)));
        SecurityUtils.requireSelfOrAdmin(enrollment.studentId());
        return enrollment;
    }

    private void requireCourseInstructor(UUID courseId) {
        CourseResponse course = ResultProblems.orThrow(mediator.send(new GetCourseByIdQuery(courseId)));
        SecurityUtils.requireSelfOrAdmin(course.instructorId());
    }
}
