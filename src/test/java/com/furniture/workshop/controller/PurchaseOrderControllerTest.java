package com.furniture.workshop.controller;

import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.model.MaterialDisposal;
import com.furniture.workshop.model.OrderStatus;
import com.furniture.workshop.model.PurchaseOrder;
import com.furniture.workshop.service.AuditService;
import com.furniture.workshop.service.PurchaseOrderService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class PurchaseOrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PurchaseOrderService orderService;

    @MockBean
    private AuditService auditService;

    @Test
    @WithMockUser(username = "ana")
    void send_successIsOkAndCarriesTenantAndUser() throws Exception {
        PurchaseOrder order = new PurchaseOrder();
        order.setId("o1");
        order.setOrderNumber("PO-2024-001");
        order.setStatus(OrderStatus.SENT);
        when(orderService.sendOrder(any(TenantContext.class), eq("o1")))
                .thenReturn(OperationResult.ok(order, "Order sent"));

        mockMvc.perform(post("/api/orders/o1/send").with(csrf()).header("X-Tenant-ID", "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Order sent"))
                .andExpect(jsonPath("$.data.orderNumber").value("PO-2024-001"));

        verify(orderService).sendOrder(new TenantContext("t1", "ana"), "o1");
    }

    @Test
    @WithMockUser
    void send_failureIsUnprocessable() throws Exception {
        when(orderService.sendOrder(any(TenantContext.class), eq("o1")))
                .thenReturn(OperationResult.failure("Order has no items"));

        mockMvc.perform(post("/api/orders/o1/send").with(csrf()).header("X-Tenant-ID", "t1"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Order has no items"));
    }

    @Test
    @WithMockUser
    void receive_passesItemIds() throws Exception {
        when(orderService.receiveItems(any(TenantContext.class), eq("o1"), anyList()))
                .thenReturn(OperationResult.ok(null, "Received"));

        mockMvc.perform(post("/api/orders/o1/receive").with(csrf()).header("X-Tenant-ID", "t1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"itemIds\":[\"i1\",\"i2\"]}"))
                .andExpect(status().isOk());

        verify(orderService).receiveItems(any(TenantContext.class), eq("o1"), eq(List.of("i1", "i2")));
    }

    @Test
    @WithMockUser
    void changeStatus_forwardsConfirmation() throws Exception {
        when(orderService.changeStatus(any(TenantContext.class), eq("o1"), eq(OrderStatus.DRAFT), eq(true)))
                .thenReturn(OperationResult.ok(new PurchaseOrder(), "Reverted"));

        mockMvc.perform(post("/api/orders/o1/status").with(csrf()).header("X-Tenant-ID", "t1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"DRAFT\",\"confirmed\":true}"))
                .andExpect(status().isOk());
    }

    @Test
    @WithMockUser
    void changeStatus_unknownStatusIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/orders/o1/status").with(csrf()).header("X-Tenant-ID", "t1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"LOST\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verifyNoInteractions(orderService);
    }

    @Test
    @WithMockUser
    void updateQuantities_passesMap() throws Exception {
        when(orderService.updateItemQuantities(any(TenantContext.class), eq("o1"), anyMap()))
                .thenReturn(OperationResult.ok(new PurchaseOrder(), "Updated"));

        mockMvc.perform(put("/api/orders/o1/quantities").with(csrf()).header("X-Tenant-ID", "t1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"quantities\":{\"i1\":6}}"))
                .andExpect(status().isOk());

        verify(orderService).updateItemQuantities(any(TenantContext.class), eq("o1"),
                argThat((Map<String, BigDecimal> m) -> m.get("i1").compareTo(new BigDecimal("6")) == 0));
    }

    @Test
    @WithMockUser
    void delete_bindsDisposal() throws Exception {
        when(orderService.deleteOrder(any(TenantContext.class), eq("o1"), eq(MaterialDisposal.RESET)))
                .thenReturn(OperationResult.ok(null, "Deleted"));

        mockMvc.perform(delete("/api/orders/o1").param("disposal", "RESET").with(csrf())
                .header("X-Tenant-ID", "t1"))
                .andExpect(status().isOk());
    }

    @Test
    @WithMockUser
    void missingTenantHeaderReachesServiceWithoutTenant() throws Exception {
        when(orderService.listOrders(any(TenantContext.class)))
                .thenReturn(OperationResult.failure("No workshop selected"));

        mockMvc.perform(get("/api/orders"))
                .andExpect(status().isUnprocessableEntity());

        verify(orderService).listOrders(argThat(ctx -> !ctx.hasTenant()));
    }

    @Test
    void unauthenticatedIsRejected() throws Exception {
        mockMvc.perform(get("/api/orders").header("X-Tenant-ID", "t1"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(orderService);
    }
}
