package com.furniture.workshop.service;

import com.furniture.workshop.config.WorkshopProperties;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.model.CascadeStep;
import com.furniture.workshop.repository.CascadeStepRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Component
public class CascadeJournal {

    private static final Logger logger = LoggerFactory.getLogger(CascadeJournal.class);

    private final CascadeStepRepository repository;
    private final WorkshopProperties properties;
    private final Clock clock;

    public CascadeJournal(CascadeStepRepository repository, WorkshopProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Opens the unit of work for one cascade. The key is derived from the
     * operation and its arguments, so a retry of the same request within the
     * retry window resumes it.
     */
    public UnitOfWork begin(TenantContext ctx, String operation, Object... parts) {
        String raw = Arrays.stream(parts).map(String::valueOf).collect(Collectors.joining("|"));
        String key = operation + ":" + UUID.nameUUIDFromBytes(raw.getBytes(StandardCharsets.UTF_8));
        List<CascadeStep> steps = repository.findByTenantIdAndCascadeKey(ctx.tenantId(), key);
        if (isAbandoned(steps)) {
            logger.info("Discarding {} stale step(s) of {} for tenant {}", steps.size(), operation, ctx.tenantId());
            repository.deleteAll(steps);
            steps = List.of();
        }
        Map<String, CascadeStep> applied = new HashMap<>();
        for (CascadeStep step : steps) {
            applied.put(step.getStepName(), step);
        }
        if (!applied.isEmpty()) {
            logger.info("Resuming {} for tenant {}, {} step(s) already applied", operation, ctx.tenantId(),
                    applied.size());
        }
        return new UnitOfWork(repository, ctx.tenantId(), key, applied);
    }

    // A run whose latest step is older than the retry window was abandoned, not interrupted
    private boolean isAbandoned(List<CascadeStep> steps) {
        if (steps.isEmpty())
            return false;
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getCascadeRetryWindow());
        return steps.stream().map(CascadeStep::getAppliedAt)
                .allMatch(appliedAt -> appliedAt == null || appliedAt.isBefore(cutoff));
    }
}
