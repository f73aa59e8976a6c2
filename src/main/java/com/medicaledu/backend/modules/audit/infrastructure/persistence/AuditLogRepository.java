package com.medicaledu.backend.modules.audit.infrastructure.persistence;

import java.util.UUID;

import com.medicaledu.backend.modules.audit.domain.AuditLog;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    @Query("""
            select a
              from AuditLog a
             where (:entityName is null or a.entityName = :entityName)
               and (:entityId is null or a.entityId = :entityId)
            """)
    Page<AuditLog> search(@Param("entityName") String entityName, @Param("entityId") UUID entityId, Pageable pageable);
}
