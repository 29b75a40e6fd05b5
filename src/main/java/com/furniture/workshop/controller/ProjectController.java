package com.furniture.workshop.controller;

import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.model.Product;
import com.furniture.workshop.model.Project;
import com.furniture.workshop.model.ProjectStatus;
import com.furniture.workshop.service.ProductService;
import com.furniture.workshop.service.ProjectService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

import static com.furniture.workshop.controller.ApiResponses.TENANT_HEADER;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final ProjectService projectService;
    private final ProductService productService;

    public ProjectController(ProjectService projectService, ProductService productService) {
        this.projectService = projectService;
        this.productService = productService;
    }

    @GetMapping
    public ResponseEntity<OperationResult<List<Project>>> list(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal) {
        return ApiResponses.of(projectService.listProjects(TenantContext.of(tenantId, principal)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<OperationResult<Project>> get(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(projectService.getProject(TenantContext.of(tenantId, principal), id));
    }

    @PostMapping
    public ResponseEntity<OperationResult<Project>> create(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @RequestBody Project project) {
        return ApiResponses.of(projectService.createProject(TenantContext.of(tenantId, principal), project));
    }

    @PutMapping("/{id}")
    public ResponseEntity<OperationResult<Project>> update(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody Project project) {
        return ApiResponses.of(projectService.updateProject(TenantContext.of(tenantId, principal), id, project));
    }

    @PostMapping("/{id}/status")
    public ResponseEntity<OperationResult<Project>> changeStatus(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestParam ProjectStatus status) {
        return ApiResponses.of(projectService.changeStatus(TenantContext.of(tenantId, principal), id, status));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<OperationResult<Void>> delete(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(projectService.deleteProject(TenantContext.of(tenantId, principal), id));
    }

    @PostMapping("/{id}/products")
    public ResponseEntity<OperationResult<Product>> addProduct(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody Product product) {
        return ApiResponses.of(productService.createProduct(TenantContext.of(tenantId, principal), id, product));
    }
}
