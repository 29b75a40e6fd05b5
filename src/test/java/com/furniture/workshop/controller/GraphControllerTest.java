package com.furniture.workshop.controller;

import com.furniture.workshop.dto.ProductionGraph;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.service.AuditService;
import com.furniture.workshop.service.ProductionGraphAssembler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class GraphControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProductionGraphAssembler assembler;

    @MockBean
    private AuditService auditService;

    @Test
    @WithMockUser
    void loadedGraphIsOk() throws Exception {
        when(assembler.assemble(any(TenantContext.class)))
                .thenReturn(ProductionGraph.builder().loaded(true).build());

        mockMvc.perform(get("/api/graph").header("X-Tenant-ID", "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loaded").value(true));
    }

    @Test
    @WithMockUser
    void unreadableGraphIsServiceUnavailable() throws Exception {
        when(assembler.assemble(any(TenantContext.class))).thenReturn(ProductionGraph.empty());

        mockMvc.perform(get("/api/graph").header("X-Tenant-ID", "t1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.loaded").value(false));
    }

    @Test
    @WithMockUser
    void missingTenantNeverAssembles() throws Exception {
        mockMvc.perform(get("/api/graph"))
                .andExpect(status().isUnprocessableEntity());

        verifyNoInteractions(assembler);
    }
}
