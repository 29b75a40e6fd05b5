package com.furniture.workshop.config;

import com.furniture.workshop.model.ProductionStep;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "workshop")
@Data
public class WorkshopProperties {

    /** Language of result messages. */
    private String locale = "hr";

    /** Upper bound (inclusive) for an edited order item quantity. */
    private BigDecimal maxOrderQuantity = new BigDecimal("99999");

    private List<ProductionStep> defaultProductionSteps = new ArrayList<>(List.of(ProductionStep.values()));

    /**
     * How long an interrupted cascade can be resumed. Older journal entries
     * belong to an abandoned run and are discarded.
     */
    private Duration cascadeRetryWindow = Duration.ofMinutes(30);

    private Graph graph = new Graph();

    @Data
    public static class Graph {
        /** Threads used to load tenant collections in parallel. */
        private int fetchThreads = 8;
    }
}
