package com.medicaledu.backend.modules.audit.application;

import java.util.UUID;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Request;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.audit.presentation.dto.AuditLogResponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Not cached: audit rows are written by nearly every command.
 */
public record GetAuditLogsQuery(
        @Size(max = 100) String entityName,
        UUID entityId,
        @Min(0) int page,
        @Min(1) @Max(100) int size
) implements Request<Result<PageResponse<AuditLogResponse>>> {
}
