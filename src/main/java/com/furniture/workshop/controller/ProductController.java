package com.furniture.workshop.controller;

import com.furniture.workshop.dto.*;
import com.furniture.workshop.model.Product;
import com.furniture.workshop.model.ProductMaterial;
import com.furniture.workshop.service.ProductMaterialService;
import com.furniture.workshop.service.ProductService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

import static com.furniture.workshop.controller.ApiResponses.TENANT_HEADER;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final ProductService productService;
    private final ProductMaterialService materialService;

    public ProductController(ProductService productService, ProductMaterialService materialService) {
        this.productService = productService;
        this.materialService = materialService;
    }

    @GetMapping("/{id}")
    public ResponseEntity<OperationResult<Product>> get(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(productService.getProduct(TenantContext.of(tenantId, principal), id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<OperationResult<Product>> update(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody Product product) {
        return ApiResponses.of(productService.updateProduct(TenantContext.of(tenantId, principal), id, product));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<OperationResult<Void>> delete(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(productService.deleteProduct(TenantContext.of(tenantId, principal), id));
    }

    @GetMapping("/{id}/materials")
    public ResponseEntity<OperationResult<List<ProductMaterial>>> materials(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(materialService.listMaterials(TenantContext.of(tenantId, principal), id));
    }

    @PostMapping("/{id}/materials")
    public ResponseEntity<OperationResult<ProductMaterial>> addMaterial(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody MaterialRequest request) {
        return ApiResponses.of(materialService.addMaterial(TenantContext.of(tenantId, principal), id, request));
    }

    @PostMapping("/{id}/materials/glass")
    public ResponseEntity<OperationResult<ProductMaterial>> addGlass(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody GlassMaterialRequest request) {
        return ApiResponses.of(materialService.saveGlass(TenantContext.of(tenantId, principal), id, null, request));
    }

    @PostMapping("/{id}/materials/alu-door")
    public ResponseEntity<OperationResult<ProductMaterial>> addAluDoor(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody AluDoorMaterialRequest request) {
        return ApiResponses.of(materialService.saveAluDoor(TenantContext.of(tenantId, principal), id, null,
                request));
    }
}
