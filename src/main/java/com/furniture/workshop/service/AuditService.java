package com.furniture.workshop.service;

import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.model.AuditLog;
import com.furniture.workshop.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    public void log(TenantContext ctx, String action, String details) {
        try {
            AuditLog log = new AuditLog();
            log.setTenantId(ctx.tenantId());
            log.setAction(action);
            log.setDetails(details);

            var auth = SecurityContextHolder.getContext().getAuthentication();
            if (auth != null) {
                log.setUsername(auth.getName());
            } else if (ctx.username() != null) {
                log.setUsername(ctx.username());
            } else {
                log.setUsername("SYSTEM");
            }

            auditLogRepository.save(log);
        } catch (RuntimeException e) {
            // A lost audit line must not fail a cascade that already committed
            logger.warn("Failed to write audit log {} for tenant {}: {}", action, ctx.tenantId(), e.getMessage());
        }
    }
}
