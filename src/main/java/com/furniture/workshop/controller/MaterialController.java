package com.furniture.workshop.controller;

import com.furniture.workshop.dto.*;
import com.furniture.workshop.lifecycle.MaterialEvent;
import com.furniture.workshop.model.ProductMaterial;
import com.furniture.workshop.service.ProductMaterialService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

import static com.furniture.workshop.controller.ApiResponses.TENANT_HEADER;

@RestController
@RequestMapping("/api/materials")
public class MaterialController {

    private final ProductMaterialService materialService;

    public MaterialController(ProductMaterialService materialService) {
        this.materialService = materialService;
    }

    @GetMapping("/unordered")
    public ResponseEntity<OperationResult<List<ProductMaterial>>> unordered(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal) {
        return ApiResponses.of(materialService.findUnordered(TenantContext.of(tenantId, principal)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<OperationResult<ProductMaterial>> update(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody MaterialRequest request) {
        return ApiResponses.of(materialService.updateMaterial(TenantContext.of(tenantId, principal), id, request));
    }

    @PutMapping("/{id}/glass")
    public ResponseEntity<OperationResult<ProductMaterial>> updateGlass(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody GlassMaterialRequest request) {
        return ApiResponses.of(materialService.saveGlass(TenantContext.of(tenantId, principal), null, id, request));
    }

    @PutMapping("/{id}/alu-door")
    public ResponseEntity<OperationResult<ProductMaterial>> updateAluDoor(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody AluDoorMaterialRequest request) {
        return ApiResponses.of(materialService.saveAluDoor(TenantContext.of(tenantId, principal), null, id,
                request));
    }

    @PostMapping("/{id}/events")
    public ResponseEntity<OperationResult<ProductMaterial>> applyEvent(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestParam MaterialEvent event) {
        return ApiResponses.of(materialService.applyEvent(TenantContext.of(tenantId, principal), id, event));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<OperationResult<Void>> delete(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(materialService.deleteMaterial(TenantContext.of(tenantId, principal), id));
    }
}
