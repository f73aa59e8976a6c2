package com.medicaledu.backend.modules.courses.presentation;

import java.math.BigDecimal;
import java.net.URI;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.error.ResultProblems;
import com.medicaledu.backend.global.pipeline.Mediator;
import com.medicaledu.backend.global.security.SecurityUtils;
import com.medicaledu.backend.global.web.PageRequests;
import com.medicaledu.backend.modules.courses.application.AddCourseMaterialCommand;
import com.medicaledu.backend.modules.courses.application.ChangeCourseStatusCommand;
import com.medicaledu.backend.modules.courses.application.CourseStatusAction;
import com.medicaledu.backend.modules.courses.application.CreateCourseCommand;
import com.medicaledu.backend.modules.courses.application.GetAllCoursesQuery;
import com.medicaledu.backend.modules.courses.application.GetCourseByIdQuery;
import com.medicaledu.backend.modules.courses.application.GetCoursesByCategoryQuery;
import com.medicaledu.backend.modules.courses.application.GetCoursesByInstructorQuery;
import com.medicaledu.backend.modules.courses.application.RemoveCourseMaterialCommand;
import com.medicaledu.backend.modules.courses.application.ReorderCourseMaterialsCommand;
import com.medicaledu.backend.modules.courses.application.UpdateCourseCommand;
import com.medicaledu.backend.modules.courses.domain.CourseCategory;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseMaterialRequest;
import com.medicaledu.backend.modules.courses.presentation.dto.CoursePageResponse;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseResponse;
import com.medicaledu.backend.modules.courses.presentation.dto.CreateCourseRequest;
import com.medicaledu.backend.modules.courses.presentation.dto.ReorderMaterialsRequest;
import com.medicaledu.backend.modules.courses.presentation.dto.UpdateCourseRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/courses")
public class CourseController {

    private final Mediator mediator;

    public CourseController(Mediator mediator) {
        this.mediator = mediator;
    }

    @Operation(summary = "List courses", description = "Filters, sorts and pages courses. Sort fields: title, price, createdAt, publishedAt, updatedAt, duration.")
    @GetMapping
    public ResponseEntity<CoursePageResponse> getCourses(
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "pageSize", required = false) Integer pageSize,
            @RequestParam(name = "isPublished", required = false) Boolean isPublished,
            @RequestParam(name = "isActive", required = false) Boolean isActive,
            @RequestParam(name = "instructorId", required = false) UUID instructorId,
            @RequestParam(name = "title", required = false) String title,
            @RequestParam(name = "description", required = false) String description,
            @RequestParam(name = "category", required = false) CourseCategory category,
            @RequestParam(name = "minPrice", required = false) BigDecimal minPrice,
            @RequestParam(name = "maxPrice", required = false) BigDecimal maxPrice,
            @RequestParam(name = "currency", required = false) String currency,
            @RequestParam(name = "createdFrom", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime createdFrom,
            @RequestParam(name = "createdTo", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime createdTo,
            @RequestParam(name = "publishedFrom", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime publishedFrom,
            @RequestParam(name = "publishedTo", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime publishedTo,
            @RequestParam(name = "minDuration", required = false) Integer minDuration,
            @RequestParam(name = "maxDuration", required = false) Integer maxDuration,
            @RequestParam(name = "minMaxStudents", required = false) Integer minMaxStudents,
            @RequestParam(name = "maxMaxStudents", required = false) Integer maxMaxStudents,
            @RequestParam(name = "sortBy", required = false) String sortBy,
            @RequestParam(name = "sortDirection", required = false) String sortDirection
    ) {
        GetAllCoursesQuery query = new GetAllCoursesQuery(
                PageRequests.page(page),
                PageRequests.size(pageSize, GetAllCoursesQuery.DEFAULT_PAGE_SIZE),
                isPublished,
                isActive,
                instructorId,
                title,
                description,
                category,
                minPrice,
                maxPrice,
                currency,
                createdFrom,
                createdTo,
                publishedFrom,
                publishedTo,
                minDuration,
                maxDuration,
                minMaxStudents,
                maxMaxStudents,
                sortBy,
                sortDirection
        );
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(query)));
    }

    @GetMapping("/{courseId}")
    public ResponseEntity<CourseResponse> getCourse(@PathVariable("courseId") UUID courseId) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new GetCourseByIdQuery(courseId))));
    }

    @GetMapping("/instructor/{instructorId}")
    public ResponseEntity<CoursePageResponse> getCoursesByInstructor(
            @PathVariable("instructorId") UUID instructorId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "pageSize", required = false) Integer pageSize
    ) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new GetCoursesByInstructorQuery(
                instructorId,
                PageRequests.page(page),
                PageRequests.size(pageSize, GetAllCoursesQuery.DEFAULT_PAGE_SIZE)
        ))));
    }

    @GetMapping("/category/{category}")
    public ResponseEntity<CoursePageResponse> getCoursesByCategory(
            @PathVariable("category") CourseCategory category,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "pageSize", required = false) Integer pageSize
    ) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new GetCoursesByCategoryQuery(
                category,
                PageRequests.page(page),
                PageRequests.size(pageSize, GetAllCoursesQuery.DEFAULT_PAGE_SIZE)
        ))));
    }

    @Operation(summary = "Create a course")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Course created"),
            @ApiResponse(responseCode = "403", description = "Caller is neither the instructor nor an administrator"),
            @ApiResponse(responseCode = "422", description = "Validation failed")
    })
    @PostMapping
    public ResponseEntity<CourseResponse> createCourse(@RequestBody CreateCourseRequest request) {
        if (request.instructorId() != null) {
            SecurityUtils.requireSelfOrAdmin(request.instructorId());
        }
        CourseResponse created = ResultProblems.orThrow(mediator.send(new CreateCourseCommand(
                request.instructorId(),
                request.title(),
                request.description(),
                request.price(),
                request.currency(),
                request.durationMinutes(),
                request.maxStudents(),
                request.category(),
                request.difficultyLevel(),
                request.tags(),
                request.thumbnailUrl(),
                request.videoUrl(),
                request.materials()
        )));
        return ResponseEntity.created(URI.create("/api/courses/" + created.id())).body(created);
    }

    @PutMapping("/{courseId}")
    public ResponseEntity<CourseResponse> updateCourse(
            @PathVariable("courseId") UUID courseId,
            @RequestBody UpdateCourseRequest request
    ) {
        requireCourseOwner(courseId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new UpdateCourseCommand(
                courseId,
                request.title(),
                request.description(),
                request.price(),
                request.currency(),
                request.durationMinutes(),
                request.maxStudents(),
                request.category(),
                request.difficultyLevel(),
                request.tags(),
                request.thumbnailUrl(),
                request.videoUrl(),
                request.materials()
        ))));
    }

    @PostMapping("/{courseId}/publish")
    public ResponseEntity<CourseResponse> publish(@PathVariable("courseId") UUID courseId) {
        return changeStatus(courseId, CourseStatusAction.PUBLISH);
    }

    @PostMapping("/{courseId}/unpublish")
    public ResponseEntity<CourseResponse> unpublish(@PathVariable("courseId") UUID courseId) {
        return changeStatus(courseId, CourseStatusAction.UNPUBLISH);
    }

    @PostMapping("/{courseId}/activate")
    public ResponseEntity<CourseResponse> activate(@PathVariable("courseId") UUID courseId) {
        return changeStatus(courseId, CourseStatusAction.ACTIVATE);
    }

    @PostMapping("/{courseId}/deactivate")
    public ResponseEntity<CourseResponse> deactivate(@PathVariable("courseId") UUID courseId) {
        return changeStatus(courseId, CourseStatusAction.DEACTIVATE);
    }

    @PostMapping("/{courseId}/materials")
    public ResponseEntity<CourseResponse> addMaterial(
            @PathVariable("courseId") UUID courseId,
            @RequestBody CourseMaterialRequest request
    ) {
        requireCourseOwner(courseId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new AddCourseMaterialCommand(courseId, request))));
    }

    @DeleteMapping("/{courseId}/materials/{materialId}")
    public ResponseEntity<CourseResponse> removeMaterial(
            @PathVariable("courseId") UUID courseId,
            @PathVariable("materialId") UUID materialId
    ) {
        requireCourseOwner(courseId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new RemoveCourseMaterialCommand(courseId, materialId))));
    }

    @PutMapping("/{courseId}/materials/order")
    public ResponseEntity<CourseResponse> reorderMaterials(
            @PathVariable("courseId") UUID courseId,
            @RequestBody ReorderMaterialsRequest request
    ) {
        requireCourseOwner(courseId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new ReorderCourseMaterialsCommand(courseId, request.materialIds()))));
    }

    private ResponseEntity<CourseResponse> changeStatus(UUID courseId, CourseStatusAction action) {
        requireCourseOwner(courseId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new ChangeCourseStatusCommand(courseId, action))));
    }

    private void requireCourseOwner(UUID courseId) {
        CourseResponse course = ResultProblems.orThrow(mediator.send(new GetCourseByIdQuery(courseId)));
        SecurityUtils.requireSelfOrAdmin(course.instructorId());
    }
}
