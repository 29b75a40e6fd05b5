package com.furniture.workshop.controller;

import com.furniture.workshop.dto.*;
import com.furniture.workshop.model.MaterialDisposal;
import com.furniture.workshop.model.PurchaseOrder;
import com.furniture.workshop.service.PurchaseOrderService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

import static com.furniture.workshop.controller.ApiResponses.TENANT_HEADER;

@RestController
@RequestMapping("/api/orders")
public class PurchaseOrderController {

    private final PurchaseOrderService orderService;

    public PurchaseOrderController(PurchaseOrderService orderService) {
        this.orderService = orderService;
    }

    @GetMapping
    public ResponseEntity<OperationResult<List<OrderView>>> list(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal) {
        return ApiResponses.of(orderService.listOrders(TenantContext.of(tenantId, principal)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<OperationResult<OrderView>> get(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(orderService.getOrder(TenantContext.of(tenantId, principal), id));
    }

    @PostMapping
    public ResponseEntity<OperationResult<PurchaseOrder>> create(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @RequestBody CreateOrderRequest request) {
        return ApiResponses.of(orderService.createOrder(TenantContext.of(tenantId, principal), request));
    }

    @PostMapping("/{id}/send")
    public ResponseEntity<OperationResult<PurchaseOrder>> send(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(orderService.sendOrder(TenantContext.of(tenantId, principal), id));
    }

    @PostMapping("/{id}/receive")
    public ResponseEntity<OperationResult<ReceiveItemsResult>> receive(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody(required = false) ReceiveItemsRequest request) {
        List<String> itemIds = request != null ? request.itemIds() : null;
        return ApiResponses.of(orderService.receiveItems(TenantContext.of(tenantId, principal), id, itemIds));
    }

    @PostMapping("/{id}/status")
    public ResponseEntity<OperationResult<PurchaseOrder>> changeStatus(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody ChangeOrderStatusRequest request) {
        return ApiResponses.of(orderService.changeStatus(TenantContext.of(tenantId, principal), id,
                request.status(), request.confirmed()));
    }

    @PutMapping("/{id}/quantities")
    public ResponseEntity<OperationResult<PurchaseOrder>> updateQuantities(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody UpdateQuantitiesRequest request) {
        return ApiResponses.of(orderService.updateItemQuantities(TenantContext.of(tenantId, principal), id,
                request.quantities()));
    }

    @PostMapping("/{id}/items/delete")
    public ResponseEntity<OperationResult<DeleteItemsResult>> deleteItems(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody DeleteItemsRequest request) {
        return ApiResponses.of(orderService.deleteItems(TenantContext.of(tenantId, principal), id,
                request.itemIds()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<OperationResult<Void>> delete(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestParam(required = false) MaterialDisposal disposal) {
        return ApiResponses.of(orderService.deleteOrder(TenantContext.of(tenantId, principal), id, disposal));
    }
}
