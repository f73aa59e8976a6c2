package com.medicaledu.backend.modules.ratings.presentation;

import java.util.UUID;

import com.medicaledu.backend.global.error.ResultProblems;
import com.medicaledu.backend.global.pipeline.Mediator;
import com.medicaledu.backend.global.security.SecurityUtils;
import com.medicaledu.backend.global.web.PageRequests;
import com.medicaledu.backend.modules.ratings.application.CreateCourseRatingCommand;
import com.medicaledu.backend.modules.ratings.application.CreateInstructorRatingCommand;
import com.medicaledu.backend.modules.ratings.application.GetCourseRatingsQuery;
import com.medicaledu.backend.modules.ratings.application.GetInstructorRatingsQuery;
import com.medicaledu.backend.modules.ratings.application.UpdateCourseRatingCommand;
import com.medicaledu.backend.modules.ratings.presentation.dto.CreateCourseRatingRequest;
import com.medicaledu.backend.modules.ratings.presentation.dto.CreateInstructorRatingRequest;
import com.medicaledu.backend.modules.ratings.presentation.dto.RatingResponse;
import com.medicaledu.backend.modules.ratings.presentation.dto.RatingSummaryResponse;
import com.medicaledu.backend.modules.ratings.presentation.dto.UpdateCourseRatingRequest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ratings")
public class RatingController {

    private final Mediator mediator;

    public RatingController(Mediator mediator) {
        this.mediator = mediator;
    }

    @GetMapping("/courses/{courseId}")
    public ResponseEntity<RatingSummaryResponse> getCourseRatings(
            @PathVariable("courseId") UUID courseId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetCourseRatingsQuery(courseId, PageRequests.page(page), PageRequests.size(size)))));
    }

    @GetMapping("/instructors/{instructorId}")
    public ResponseEntity<RatingSummaryResponse> getInstructorRatings(
            @PathVariable("instructorId") UUID instructorId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetInstructorRatingsQuery(instructorId, PageRequests.page(page), PageRequests.size(size)))));
    }

    @PostMapping("/courses")
    public ResponseEntity<RatingResponse> rateCourse(@RequestBody CreateCourseRatingRequest request) {
        SecurityUtils.requireSelfOrAdmin(request.studentId());
        RatingResponse created = ResultProblems.orThrow(mediator.send(new CreateCourseRatingCommand(
                request.courseId(),
                request.studentId(),
                request.rating() == null ? 0 : request.rating(),
                request.review(),
                !Boolean.FALSE.equals(request.isPublic())
        )));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/courses/{ratingId}")
    public ResponseEntity<RatingResponse> updateCourseRating(
            @PathVariable("ratingId") UUID ratingId,
            @RequestBody UpdateCourseRatingRequest request
    ) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new UpdateCourseRatingCommand(
                ratingId,
                SecurityUtils.getCurrentUserId(),
                request.rating(),
                request.review(),
                request.isPublic()
        ))));
    }

    @PostMapping("/instructors")
    public ResponseEntity<RatingResponse> rateInstructor(@RequestBody CreateInstructorRatingRequest request) {
        SecurityUtils.requireSelfOrAdmin(request.studentId());
        RatingResponse created = ResultProblems.orThrow(mediator.send(new CreateInstructorRatingCommand(
                request.bookingId(),
                request.studentId(),
                request.rating() == null ? 0 : request.rating(),
                request.review(),
                !Boolean.FALSE.equals(request.isPublic())
        )));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }
}
