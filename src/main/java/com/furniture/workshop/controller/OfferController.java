package com.furniture.workshop.controller;

import com.furniture.workshop.dto.OfferRequest;
import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.model.Offer;
import com.furniture.workshop.model.OfferStatus;
import com.furniture.workshop.service.OfferService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;

import static com.furniture.workshop.controller.ApiResponses.TENANT_HEADER;

@RestController
@RequestMapping("/api/offers")
public class OfferController {

    private final OfferService offerService;

    public OfferController(OfferService offerService) {
        this.offerService = offerService;
    }

    @GetMapping("/{id}")
    public ResponseEntity<OperationResult<Offer>> get(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(offerService.getOffer(TenantContext.of(tenantId, principal), id));
    }

    @PostMapping
    public ResponseEntity<OperationResult<Offer>> create(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @RequestBody OfferRequest request) {
        return ApiResponses.of(offerService.createOffer(TenantContext.of(tenantId, principal), request));
    }

    @PostMapping("/{id}/status")
    public ResponseEntity<OperationResult<Offer>> changeStatus(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestParam OfferStatus status) {
        return ApiResponses.of(offerService.changeStatus(TenantContext.of(tenantId, principal), id, status));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<OperationResult<Void>> delete(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(offerService.deleteOffer(TenantContext.of(tenantId, principal), id));
    }
}
