package com.medicaledu.backend.modules.audit.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.medicaledu.backend.modules.audit.presentation.dto.AuditLogResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetAuditLogsHandler implements RequestHandler<GetAuditLogsQuery, Result<PageResponse<AuditLogResponse>>> {

    private final AuditLogRepository auditLogRepository;

    public GetAuditLogsHandler(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    @Override
    public Result<PageResponse<AuditLogResponse>> handle(GetAuditLogsQuery query) {
        String entityName = query.entityName() == null || query.entityName().isBlank() ? null : query.entityName().trim();
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), Sort.by(Sort.Direction.DESC, "createdAt"));
        return Result.success(PageResponse.from(
                auditLogRepository.search(entityName, query.entityId(), pageRequest), AuditLogResponse::from));
    }
}
