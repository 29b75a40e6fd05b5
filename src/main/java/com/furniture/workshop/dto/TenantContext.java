package com.furniture.workshop.dto;

import java.security.Principal;

/**
 * Caller identity passed into every operation. All reads and writes are scoped
 * to {@code tenantId}.
 */
public record TenantContext(String tenantId, String username) {

    public static TenantContext of(String tenantId, Principal principal) {
        return new TenantContext(tenantId, principal != null ? principal.getName() : null);
    }

    public boolean hasTenant() {
        return tenantId != null && !tenantId.isBlank();
    }
}
