package com.furniture.workshop.service;

import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.util.Messages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

class OperationRunnerTest {

    @Mock
    private Messages messages;

    private OperationRunner runner;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        runner = new OperationRunner(messages);
        when(messages.get("error.tenant-missing")).thenReturn("No workshop");
        when(messages.get("error.generic")).thenReturn("Something went wrong");
        when(messages.get("order.send.no-items")).thenReturn("Empty order");
    }

    @Test
    void missingTenantNeverRunsBody() {
        AtomicBoolean ran = new AtomicBoolean();

        OperationResult<String> result = runner.run(new TenantContext(null, "marko"), "op", () -> {
            ran.set(true);
            return OperationResult.ok("x", "");
        });

        assertFalse(result.success());
        assertEquals("No workshop", result.message());
        assertFalse(ran.get());
    }

    @Test
    void businessFailureIsLocalized() {
        OperationResult<String> result = runner.run(new TenantContext("t1", "marko"), "op", () -> {
            throw new WorkshopException("order.send.no-items");
        });

        assertFalse(result.success());
        assertEquals("Empty order", result.message());
    }

    @Test
    void unexpectedFaultIsHidden() {
        OperationResult<String> result = runner.run(new TenantContext("t1", "marko"), "op", () -> {
            throw new IllegalStateException("connection reset");
        });

        assertFalse(result.success());
        assertEquals("Something went wrong", result.message());
        assertNull(result.data());
    }
}
