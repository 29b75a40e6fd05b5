package com.furniture.workshop.controller;

import com.furniture.workshop.dto.ProductionGraph;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.service.ProductionGraphAssembler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;

import static com.furniture.workshop.controller.ApiResponses.TENANT_HEADER;

@RestController
public class GraphController {

    private final ProductionGraphAssembler assembler;

    public GraphController(ProductionGraphAssembler assembler) {
        this.assembler = assembler;
    }

    /** The whole tenant graph; 422 without a tenant, 503 when it could not be read. */
    @GetMapping("/api/graph")
    public ResponseEntity<ProductionGraph> graph(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        if (!ctx.hasTenant())
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ProductionGraph.empty());
        ProductionGraph graph = assembler.assemble(ctx);
        return graph.isLoaded() ? ResponseEntity.ok(graph)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(graph);
    }
}
