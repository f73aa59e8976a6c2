package com.medicaledu.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ResponseStatusException;

public final class SecurityUtils {

    public static final String ROLE_ADMIN = "ADMIN";

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED"));
    }

    public static Optional<JwtAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    public static Optional<UUID> findCurrentUserId() {
        return findCurrentPrincipal().map(JwtAuthenticationPrincipal::userId);
    }

    public static boolean hasRole(String roleCode) {
        return findCurrentPrincipal().map(principal -> principal.hasRole(roleCode)).orElse(false);
    }

    public static void requireAdmin() {
        if (!getCurrentPrincipal().hasRole(ROLE_ADMIN)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "FORBIDDEN");
        }
    }

    /**
     * Allows the call when the current user is {@code ownerId} or an administrator.
     */
    public static void requireSelfOrAdmin(UUID ownerId) {
        JwtAuthenticationPrincipal principal = getCurrentPrincipal();
        if (!principal.userId().equals(ownerId) && !principal.hasRole(ROLE_ADMIN)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "FORBIDDEN");
        }
    }

    public static void requireOneOfOrAdmin(UUID firstOwnerId, UUID secondOwnerId) {
        JwtAuthenticationPrincipal principal = getCurrentPrincipal();
        UUID userId = principal.userId();
        if (!userId.equals(firstOwnerId) && !userId.equals(secondOwnerId) && !principal.hasRole(ROLE_ADMIN)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "FORBIDDEN");
        }
    }
}
