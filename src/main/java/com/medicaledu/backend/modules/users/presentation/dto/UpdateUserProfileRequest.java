package com.medicaledu.backend.modules.users.presentation.dto;

public record UpdateUserProfileRequest(String name, String timeZone, String phoneNumber, String profilePictureUrl) {
}
