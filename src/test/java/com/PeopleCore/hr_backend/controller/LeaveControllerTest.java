package com.PeopleCore.hr_backend.controller;

import com.PeopleCore.hr_backend.config.SecurityConfig;
import com.PeopleCore.hr_backend.dto.request.LeaveDecisionRequest;
import com.PeopleCore.hr_backend.dto.response.LeaveDecisionResponse;
import com.PeopleCore.hr_backend.enums.LeaveStatus;
import com.PeopleCore.hr_backend.exception.InvalidStateException;
import com.PeopleCore.hr_backend.service.CurrentUserService;
import com.PeopleCore.hr_backend.service.LeaveService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LeaveController.class)
@Import(SecurityConfig.class)
@DisplayName("Leave decision endpoint")
class LeaveControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LeaveService leaveService;

    @MockBean
    private CurrentUserService currentUserService;

    @Test
    @WithMockUser(roles = "HR")
    @DisplayName("HR can approve a request")
    void approve() throws Exception {
        when(currentUserService.currentUserId()).thenReturn(7L);
        when(leaveService.decide(eq(42L), any(LeaveDecisionRequest.class), eq(7L)))
                .thenReturn(LeaveDecisionResponse.builder()
                        .id(42L)
                        .status(LeaveStatus.APPROVED)
                        .message("Request approved")
                        .usedDays(new BigDecimal("3.00"))
                        .build());

        mockMvc.perform(post("/api/leave/requests/42/decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"approve\",\"note\":\"ok\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Request approved"))
                .andExpect(jsonPath("$.data.id").value(42));
    }

    @Test
    @WithMockUser(roles = "EMPLOYEE")
    @DisplayName("Employees cannot decide requests")
    void employeeForbidden() throws Exception {
        mockMvc.perform(post("/api/leave/requests/42/decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"APPROVE\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("ACCESS_DENIED"));

        verify(leaveService, never()).decide(any(), any(), any());
    }

    @Test
    @DisplayName("Anonymous callers are rejected")
    void anonymousUnauthorized() throws Exception {
        mockMvc.perform(post("/api/leave/requests/42/decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"APPROVE\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    @DisplayName("Deciding an already decided request is an invalid state")
    void alreadyDecided() throws Exception {
        when(leaveService.decide(eq(42L), any(LeaveDecisionRequest.class), any()))
                .thenThrow(new InvalidStateException("Leave request 42 has already been approved"));

        mockMvc.perform(post("/api/leave/requests/42/decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"REJECT\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_STATE"));
    }

    @Test
    @WithMockUser(roles = "HR")
    @DisplayName("Unknown or missing action fails validation")
    void invalidAction() throws Exception {
        mockMvc.perform(post("/api/leave/requests/42/decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"escalate\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/api/leave/requests/42/decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verify(leaveService, never()).decide(any(), any(), any());
    }

    @Test
    @WithMockUser(roles = "HR")
    @DisplayName("Respond keeps the request pending")
    void respond() throws Exception {
        when(leaveService.decide(eq(5L), any(LeaveDecisionRequest.class), any()))
                .thenReturn(LeaveDecisionResponse.builder()
                        .id(5L)
                        .status(LeaveStatus.PENDING)
                        .message("Response recorded")
                        .build());

        mockMvc.perform(post("/api/leave/requests/5/decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"RESPOND\",\"note\":\"Please attach a medical certificate\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("PENDING"));
    }
}
