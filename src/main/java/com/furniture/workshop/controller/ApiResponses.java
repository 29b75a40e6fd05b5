package com.furniture.workshop.controller;

import com.furniture.workshop.dto.OperationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/** Maps operation results onto HTTP: success is 200, any business failure 422. */
public final class ApiResponses {

    public static final String TENANT_HEADER = "X-Tenant-ID";

    private ApiResponses() {
    }

    public static <T> ResponseEntity<OperationResult<T>> of(OperationResult<T> result) {
        return result.success() ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
    }
}
