package com.furniture.workshop.controller;

import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.model.AuditLog;
import com.furniture.workshop.model.ProductionStep;
import com.furniture.workshop.repository.AuditLogRepository;
import com.furniture.workshop.service.AuditService;
import com.furniture.workshop.service.OperationRunner;
import com.furniture.workshop.service.SettingsService;
import com.furniture.workshop.util.Messages;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;
import java.util.Map;

import static com.furniture.workshop.controller.ApiResponses.TENANT_HEADER;

@RestController
@RequestMapping("/api/settings")
@PreAuthorize("hasRole('ADMIN')")
public class SettingsController {

    private final SettingsService settingsService;
    private final AuditLogRepository auditLogRepository;
    private final AuditService auditService;
    private final OperationRunner runner;
    private final Messages messages;

    public SettingsController(SettingsService settingsService, AuditLogRepository auditLogRepository,
            AuditService auditService, OperationRunner runner, Messages messages) {
        this.settingsService = settingsService;
        this.auditLogRepository = auditLogRepository;
        this.auditService = auditService;
        this.runner = runner;
        this.messages = messages;
    }

    @GetMapping("/production-steps")
    public ResponseEntity<OperationResult<List<ProductionStep>>> productionSteps(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "productionSteps",
                () -> OperationResult.ok(settingsService.getProductionSteps(ctx.tenantId()), "")));
    }

    @PostMapping
    public ResponseEntity<OperationResult<Void>> update(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @RequestBody Map<String, String> settings) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "updateSettings", () -> {
            if (settings == null || settings.isEmpty())
                throw new WorkshopException("settings.empty");
            settings.forEach((key, value) -> settingsService.updateSetting(ctx.tenantId(), key, value));
            auditService.log(ctx, "SETTINGS_UPDATED", "Keys: " + String.join(", ", settings.keySet()));
            return OperationResult.ok(null, messages.get("settings.saved"));
        }));
    }

    @GetMapping("/audit")
    public ResponseEntity<OperationResult<List<AuditLog>>> audit(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "auditTrail",
                () -> OperationResult.ok(auditLogRepository.findTop50ByTenantIdOrderByTimestampDesc(ctx.tenantId()),
                        "")));
    }
}
