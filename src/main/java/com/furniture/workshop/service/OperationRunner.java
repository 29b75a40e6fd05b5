package com.furniture.workshop.service;

import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.util.Messages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Boundary of every cascade operation. Checks the tenant, turns business
 * failures into failed results and hides unexpected faults behind a generic
 * message.
 */
@Component
public class OperationRunner {

    private static final Logger logger = LoggerFactory.getLogger(OperationRunner.class);

    private final Messages messages;

    public OperationRunner(Messages messages) {
        this.messages = messages;
    }

    public <T> OperationResult<T> run(TenantContext ctx, String operation, Supplier<OperationResult<T>> body) {
        if (ctx == null || !ctx.hasTenant()) {
            logger.warn("{} called without tenant", operation);
            return OperationResult.failure(messages.get("error.tenant-missing"));
        }
        try {
            return body.get();
        } catch (WorkshopException e) {
            logger.info("{} rejected for tenant {}: {}", operation, ctx.tenantId(), e.getMessageKey());
            return OperationResult.failure(messages.get(e.getMessageKey(), e.getArgs()));
        } catch (RuntimeException e) {
            logger.error("{} failed for tenant {}", operation, ctx.tenantId(), e);
            return OperationResult.failure(messages.get("error.generic"));
        }
    }
}
