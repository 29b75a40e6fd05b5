package com.furniture.workshop.controller;

import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.exception.ResourceNotFoundException;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.model.Supplier;
import com.furniture.workshop.repository.SupplierRepository;
import com.furniture.workshop.service.OperationRunner;
import com.furniture.workshop.util.Messages;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

import static com.furniture.workshop.controller.ApiResponses.TENANT_HEADER;

@RestController
@RequestMapping("/api/suppliers")
public class SupplierController {

    private final SupplierRepository supplierRepository;
    private final OperationRunner runner;
    private final Messages messages;

    public SupplierController(SupplierRepository supplierRepository, OperationRunner runner, Messages messages) {
        this.supplierRepository = supplierRepository;
        this.runner = runner;
        this.messages = messages;
    }

    @GetMapping
    public ResponseEntity<OperationResult<List<Supplier>>> list(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "listSuppliers",
                () -> OperationResult.ok(supplierRepository.findByTenantIdOrderByNameAsc(ctx.tenantId()), "")));
    }

    @PostMapping
    public ResponseEntity<OperationResult<Supplier>> create(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @RequestBody Supplier supplier) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "createSupplier", () -> {
            supplier.setId(null);
            return save(ctx, supplier);
        }));
    }

    @PutMapping("/{id}")
    public ResponseEntity<OperationResult<Supplier>> update(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody Supplier supplier) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "updateSupplier", () -> {
            supplierRepository.findByIdAndTenantId(id, ctx.tenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("supplier", id));
            supplier.setId(id);
            return save(ctx, supplier);
        }));
    }

    private OperationResult<Supplier> save(TenantContext ctx, Supplier supplier) {
        if (supplier.getName() == null || supplier.getName().isBlank())
            throw new WorkshopException("supplier.name-required");
        supplier.setTenantId(ctx.tenantId());
        Supplier saved = supplierRepository.save(supplier);
        return OperationResult.ok(saved, messages.get("supplier.saved", saved.getName()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<OperationResult<Void>> delete(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "deleteSupplier", () -> {
            Supplier supplier = supplierRepository.findByIdAndTenantId(id, ctx.tenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("supplier", id));
            supplierRepository.delete(supplier);
            return OperationResult.ok(null, messages.get("supplier.deleted", supplier.getName()));
        }));
    }
}
