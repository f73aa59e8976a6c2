package com.medicaledu.backend.modules.users.presentation;

import java.net.URI;
import java.util.UUID;

import com.medicaledu.backend.global.error.ResultProblems;
import com.medicaledu.backend.global.pipeline.Mediator;
import com.medicaledu.backend.global.security.SecurityUtils;
import com.medicaledu.backend.global.web.PageRequests;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.users.application.ActivateUserCommand;
import com.medicaledu.backend.modules.users.application.ChangePasswordCommand;
import com.medicaledu.backend.modules.users.application.ConfirmEmailCommand;
import com.medicaledu.backend.modules.users.application.CreateUserCommand;
import com.medicaledu.backend.modules.users.application.DeactivateUserCommand;
import com.medicaledu.backend.modules.users.application.GetAllUsersQuery;
import com.medicaledu.backend.modules.users.application.GetUserByIdQuery;
import com.medicaledu.backend.modules.users.application.GetUsersByRoleQuery;
import com.medicaledu.backend.modules.users.application.UpdateUserProfileCommand;
import com.medicaledu.backend.modules.users.domain.UserRole;
import com.medicaledu.backend.modules.users.presentation.dto.ChangePasswordRequest;
import com.medicaledu.backend.modules.users.presentation.dto.ConfirmEmailRequest;
import com.medicaledu.backend.modules.users.presentation.dto.CreateUserRequest;
import com.medicaledu.backend.modules.users.presentation.dto.UpdateUserProfileRequest;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

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
@RequestMapping("/api/users")
public class UserController {

    private final Mediator mediator;

    public UserController(Mediator mediator) {
        this.mediator = mediator;
    }

    @Operation(summary = "Register a user", description = "Creates an account and issues an email confirmation token valid for 24 hours.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "User created"),
            @ApiResponse(responseCode = "409", description = "Email already registered"),
            @ApiResponse(responseCode = "422", description = "Validation failed")
    })
    @PostMapping
    public ResponseEntity<UserResponse> createUser(@RequestBody CreateUserRequest request) {
        UserResponse created = ResultProblems.orThrow(mediator.send(new CreateUserCommand(
                request.name(),
                request.email(),
                request.password(),
                request.role()
        )));
        return ResponseEntity.created(URI.create("/api/users/" + created.id())).body(created);
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserResponse> getUser(@PathVariable("userId") UUID userId) {
        SecurityUtils.requireSelfOrAdmin(userId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new GetUserByIdQuery(userId))));
    }

    @GetMapping
    public ResponseEntity<PageResponse<UserResponse>> getUsers(
            @RequestParam(name = "role", required = false) UserRole role,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        SecurityUtils.requireAdmin();
        int safePage = PageRequests.page(page);
        int safeSize = PageRequests.size(size);
        PageResponse<UserResponse> users = role == null
                ? ResultProblems.orThrow(mediator.send(new GetAllUsersQuery(safePage, safeSize)))
                : ResultProblems.orThrow(mediator.send(new GetUsersByRoleQuery(role, safePage, safeSize)));
        return ResponseEntity.ok(users);
    }

    @PostMapping("/{userId}/confirm-email")
    public ResponseEntity<UserResponse> confirmEmail(
            @PathVariable("userId") UUID userId,
            @RequestBody ConfirmEmailRequest request
    ) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new ConfirmEmailCommand(userId, request.token()))));
    }

    @PostMapping("/{userId}/change-password")
    public ResponseEntity<Void> changePassword(
            @PathVariable("userId") UUID userId,
            @RequestBody ChangePasswordRequest request
    ) {
        SecurityUtils.requireSelfOrAdmin(userId);
        ResultProblems.orThrow(mediator.send(new ChangePasswordCommand(userId, request.currentPassword(), request.newPassword())));
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{userId}/profile")
    public ResponseEntity<UserResponse> updateProfile(
            @PathVariable("userId") UUID userId,
            @RequestBody UpdateUserProfileRequest request
    ) {
        SecurityUtils.requireSelfOrAdmin(userId);
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new UpdateUserProfileCommand(
                userId,
                request.name(),
                request.timeZone(),
                request.phoneNumber(),
                request.profilePictureUrl()
        ))));
    }

    @PostMapping("/{userId}/activate")
    public ResponseEntity<UserResponse> activate(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new ActivateUserCommand(userId))));
    }

    @PostMapping("/{userId}/deactivate")
    public ResponseEntity<UserResponse> deactivate(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new DeactivateUserCommand(userId))));
    }
}
