package com.medicaledu.backend.modules.users.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.modules.users.domain.User;
import com.medicaledu.backend.modules.users.domain.UserRole;

public record UserResponse(
        UUID id,
        String name,
        String email,
        UserRole role,
        boolean active,
        boolean emailConfirmed,
        String timeZone,
        String phoneNumber,
        String profilePictureUrl,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserResponse from(User user) {
        return new UserResponse(
                user.getId(),
                user.getName(),
                user.getEmail().getValue(),
                user.getRole(),
                user.isActive(),
                user.isEmailConfirmed(),
                user.getTimeZone(),
                user.getPhoneNumber(),
                user.getProfilePictureUrl() != null ? user.getProfilePictureUrl().getValue() : null,
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
