package com.medicaledu.backend.modules.users.presentation;

import com.medicaledu.backend.modules.users.application.AuthService;
import com.medicaledu.backend.modules.users.presentation.dto.LoginRequest;
import com.medicaledu.backend.modules.users.presentation.dto.LoginResponse;
import com.medicaledu.backend.modules.users.presentation.dto.LogoutRequest;
import com.medicaledu.backend.modules.users.presentation.dto.PasswordResetConfirmRequest;
import com.medicaledu.backend.modules.users.presentation.dto.PasswordResetRequest;
import com.medicaledu.backend.modules.users.presentation.dto.RefreshRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/auth/refresh")
    public ResponseEntity<LoginResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody LogoutRequest request) {
        authService.logout(request);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Request a password reset", description = "Always accepted, whether or not the email is registered.")
    @PostMapping("/auth/password-reset/request")
    public ResponseEntity<Void> requestPasswordReset(@Valid @RequestBody PasswordResetRequest request) {
        authService.requestPasswordReset(request.email());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/auth/password-reset/confirm")
    public ResponseEntity<Void> confirmPasswordReset(@Valid @RequestBody PasswordResetConfirmRequest request) {
        authService.confirmPasswordReset(request);
        return ResponseEntity.noContent().build();
    }
}
