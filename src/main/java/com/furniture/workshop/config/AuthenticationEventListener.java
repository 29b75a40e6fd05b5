package com.furniture.workshop.config;

import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.service.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.security.authentication.event.AbstractAuthenticationFailureEvent;
import org.springframework.stereotype.Component;

/** Records failed API logins. Successful basic auth happens on every request and is not audited. */
@Component
public class AuthenticationEventListener {

    private static final Logger logger = LoggerFactory.getLogger(AuthenticationEventListener.class);

    private final AuditService auditService;

    public AuthenticationEventListener(AuditService auditService) {
        this.auditService = auditService;
    }

    @EventListener
    public void onFailure(AbstractAuthenticationFailureEvent event) {
        Object principal = event.getAuthentication().getPrincipal();
        String username = principal instanceof String ? (String) principal : "Unknown";
        String error = event.getException().getMessage();
        logger.warn("Failed login for {}: {}", username, error);
        auditService.log(new TenantContext(null, username), "LOGIN_FAILURE",
                "Failed login for: " + username + " - " + error);
    }
}
