package com.medicaledu.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;
import com.medicaledu.backend.global.security.SecurityUtils;
import com.medicaledu.backend.global.web.RequestIdFilter;
import com.medicaledu.backend.modules.audit.domain.AuditLog;
import com.medicaledu.backend.modules.audit.infrastructure.persistence.AuditLogRepository;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Writes audit records in the caller's transaction. The acting user, client address and user
 * agent come from the current request when there is one.
 */
@Service
@Transactional
public class AuditLogService {

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    public AuditLog record(
            String entityName,
            UUID entityId,
            AuditActionType action,
            UUID fallbackUserId,
            Map<String, Object> oldValues,
            Map<String, Object> newValues,
            Map<String, Object> metadata
    ) {
        Optional<HttpServletRequest> request = currentRequest();
        Map<String, Object> enrichedMetadata = new LinkedHashMap<>();
        if (metadata != null) {
            enrichedMetadata.putAll(metadata);
        }
        RequestIdFilter.currentRequestId().ifPresent(requestId -> enrichedMetadata.put("requestId", requestId));
        return auditLogRepository.save(AuditLog.record(
                entityName,
                entityId,
                action,
                SecurityUtils.findCurrentUserId().orElse(fallbackUserId),
                request.map(AuditLogService::clientAddress).orElse(null),
                request.map(value -> value.getHeader("User-Agent")).orElse(null),
                oldValues,
                newValues,
                enrichedMetadata,
                OffsetDateTime.now(clock)
        ));
    }

    private static Optional<HttpServletRequest> currentRequest() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes servletAttributes) {
            return Optional.of(servletAttributes.getRequest());
        }
        return Optional.empty();
    }

    private static String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
