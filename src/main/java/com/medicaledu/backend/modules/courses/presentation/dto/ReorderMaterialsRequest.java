package com.medicaledu.backend.modules.courses.presentation.dto;

import java.util.List;
import java.util.UUID;

public record ReorderMaterialsRequest(List<UUID> materialIds) {
}
