package com.medicaledu.backend.modules.audit.presentation;

import java.util.UUID;

import com.medicaledu.backend.global.error.ResultProblems;
import com.medicaledu.backend.global.pipeline.Mediator;
import com.medicaledu.backend.global.web.PageRequests;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.audit.application.GetAuditLogsQuery;
import com.medicaledu.backend.modules.audit.presentation.dto.AuditLogResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/audit-logs")
public class AuditLogController {

    private final Mediator mediator;

    public AuditLogController(Mediator mediator) {
        this.mediator = mediator;
    }

    @GetMapping
    public ResponseEntity<PageResponse<AuditLogResponse>> getAuditLogs(
            @RequestParam(name = "entityName", required = false) String entityName,
            @RequestParam(name = "entityId", required = false) UUID entityId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetAuditLogsQuery(entityName, entityId, PageRequests.page(page), PageRequests.size(size)))));
    }
}
