package com.medicaledu.backend.modules.availability.presentation;

import java.net.URI;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.error.ResultProblems;
import com.medicaledu.backend.global.pipeline.Mediator;
import com.medicaledu.backend.global.security.SecurityUtils;
import com.medicaledu.backend.global.web.PageRequests;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.availability.application.ChangeSlotParticipantsCommand;
import com.medicaledu.backend.modules.availability.application.CreateAvailabilitySlotCommand;
import com.medicaledu.backend.modules.availability.application.GetAvailabilitySlotByIdQuery;
import com.medicaledu.backend.modules.availability.application.GetAvailabilitySlotsByInstructorQuery;
import com.medicaledu.backend.modules.availability.application.GetAvailabilitySlotsQuery;
import com.medicaledu.backend.modules.availability.application.SetAvailabilitySlotActiveCommand;
import com.medicaledu.backend.modules.availability.application.UpdateAvailabilitySlotCommand;
import com.medicaledu.backend.modules.availability.presentation.dto.AvailabilitySlotResponse;
import com.medicaledu.backend.modules.availability.presentation.dto.CreateAvailabilitySlotRequest;
import com.medicaledu.backend.modules.availability.presentation.dto.SlotParticipantsRequest;
import com.medicaledu.backend.modules.availability.presentation.dto.UpdateAvailabilitySlotRequest;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.format.annotation.DateTimeFormat;
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
@RequestMapping("/api/availability-slots")
public class AvailabilitySlotController {

    private final Mediator mediator;

    public AvailabilitySlotController(Mediator mediator) {
        this.mediator = mediator;
    }

    @GetMapping("/{slotId}")
    public ResponseEntity<AvailabilitySlotResponse> getSlot(@PathVariable("slotId") UUID slotId) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new GetAvailabilitySlotByIdQuery(slotId))));
    }

    @GetMapping
    public ResponseEntity<PageResponse<AvailabilitySlotResponse>> getSlots(
            @RequestParam(name = "instructorId", required = false) UUID instructorId,
            @RequestParam(name = "isAvailable", required = false) Boolean isAvailable,
            @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startDate,
            @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endDate,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new GetAvailabilitySlotsQuery(
                instructorId,
                Boolean.TRUE.equals(isAvailable),
                startDate,
                endDate,
                PageRequests.page(page),
                PageRequests.size(size)
        ))));
    }

    @Operation(summary = "List bookable slots", description = "Active slots with free capacity, optionally within a start time window.")
    @GetMapping("/available")
    public ResponseEntity<PageResponse<AvailabilitySlotResponse>> getAvailableSlots(
            @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startDate,
            @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endDate,
            @RequestParam(name = "instructorId", required = false) UUID instructorId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new GetAvailabilitySlotsQuery(
                instructorId,
                true,
                startDate,
                endDate,
                PageRequests.page(page),
                PageRequests.size(size)
        ))));
    }

    @GetMapping("/instructor/{instructorId}")
    public ResponseEntity<PageResponse<AvailabilitySlotResponse>> getSlotsByInstructor(
            @PathVariable("instructorId") UUID instructorId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetAvailabilitySlotsByInstructorQuery(instructorId, PageRequests.page(page), PageRequests.size(size)))));
    }

    @PostMapping
    public ResponseEntity<AvailabilitySlotResponse> createSlot(@RequestBody CreateAvailabilitySlotRequest request) {
        if (request.instructorId() != null) {
            SecurityUtils.requireSelfOrAdmin(request.instructorId());
        }
        AvailabilitySlotResponse created = ResultProblems.orThrow(mediator.send(new CreateAvailabilitySlotCommand(
                request.courseId(),
                request.instructorId(),
                request.startTimeUtc(),
                request.endTimeUtc(),
                request.price(),
                request.currency(),
                request.maxParticipants(),
                request.notes(),
                request.recurringPattern()
        )));
        return ResponseEntity.created(URI.create("/api/availability-slots/" + created.id())).body(created);
    }

    @PutMapping("/{slotId}")
    public ResponseEntity<AvailabilitySlotResponse> updateSlot(
            @PathVariable("slotId") UUID slotId,
            @RequestBody UpdateAvailabilitySlotRequest request
    ) {
        requireSlotOwner(slotId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new UpdateAvailabilitySlotCommand(
                slotId,
                request.startTimeUtc(),
                request.endTimeUtc(),
                request.price(),
                request.currency(),
                request.maxParticipants(),
                request.notes(),
                request.recurringPattern()
        ))));
    }

    @PostMapping("/{slotId}/activate")
    public ResponseEntity<AvailabilitySlotResponse> activate(@PathVariable("slotId") UUID slotId) {
        requireSlotOwner(slotId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new SetAvailabilitySlotActiveCommand(slotId, true))));
    }

    @PostMapping("/{slotId}/deactivate")
    public ResponseEntity<AvailabilitySlotResponse> deactivate(@PathVariable("slotId") UUID slotId) {
        requireSlotOwner(slotId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new SetAvailabilitySlotActiveCommand(slotId, false))));
    }

    @PostMapping("/{slotId}/book")
    public ResponseEntity<AvailabilitySlotResponse> book(
            @PathVariable("slotId") UUID slotId,
            @RequestBody(required = false) SlotParticipantsRequest request
    ) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new ChangeSlotParticipantsCommand(slotId, quantity(request), false))));
    }

    @PostMapping("/{slotId}/cancel-booking")
    public ResponseEntity<AvailabilitySlotResponse> cancelBooking(
            @PathVariable("slotId") UUID slotId,
            @RequestBody(required = false) SlotParticipantsRequest request
    ) {
        requireSlotOwner(slotId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new ChangeSlotParticipantsCommand(slotId, quantity(request), true))));
    }

    private static int quantity(SlotParticipantsRequest request) {
        return request == null || request.quantity() == null ? 1 : request.quantity();
    }

    private void requireSlotOwner(UUID slotId) {
        AvailabilitySlotResponse slot = ResultProblems.orThrow(mediator.send(new GetAvailabilitySlotByIdQuery(slotId)));
        SecurityUtils.requireSelfOrAdmin(slot.instructorId());
    }
}
