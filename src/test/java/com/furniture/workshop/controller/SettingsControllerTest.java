package com.furniture.workshop.controller;

import com.furniture.workshop.service.AuditService;
import com.furniture.workshop.service.SettingsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.furniture.workshop.model.ProductionStep.ASSEMBLY;
import static com.furniture.workshop.model.ProductionStep.CUTTING;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class SettingsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SettingsService settingsService;

    @MockBean
    private AuditService auditService;

    @Test
    @WithMockUser(roles = "ADMIN")
    void adminReadsProductionSteps() throws Exception {
        when(settingsService.getProductionSteps("t1")).thenReturn(List.of(CUTTING, ASSEMBLY));

        mockMvc.perform(get("/api/settings/production-steps").header("X-Tenant-ID", "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0]").value("CUTTING"))
                .andExpect(jsonPath("$.data[1]").value("ASSEMBLY"));
    }

    @Test
    @WithMockUser(roles = "USER")
    void nonAdminIsForbidden() throws Exception {
        mockMvc.perform(post("/api/settings").with(csrf()).header("X-Tenant-ID", "t1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"production.steps\":\"CUTTING\"}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(settingsService);
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void emptySettingsAreRejected() throws Exception {
        mockMvc.perform(post("/api/settings").with(csrf()).header("X-Tenant-ID", "t1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false));

        verify(settingsService, never()).updateSetting(anyString(), anyString(), anyString());
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void settingsAreSavedAndAudited() throws Exception {
        mockMvc.perform(post("/api/settings").with(csrf()).header("X-Tenant-ID", "t1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"production.steps\":\"CUTTING,ASSEMBLY\"}"))
                .andExpect(status().isOk());

        verify(settingsService).updateSetting("t1", "production.steps", "CUTTING,ASSEMBLY");
        verify(auditService).log(any(), eq("SETTINGS_UPDATED"), anyString());
    }
}
