package com.medicaledu.backend.modules.availability.presentation.dto;

public record SlotParticipantsRequest(Integer quantity) {
}
