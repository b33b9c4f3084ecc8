package com.ai.tutoring.controller;

import com.ai.tutoring.dto.AutoCompleteResponse;
import com.ai.tutoring.service.SessionLifecycleService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminSessionController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("AdminSessionController")
class AdminSessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionLifecycleService lifecycleService;

    @Test
    @DisplayName("POST auto-complete-sessions uses the given cutoff")
    void autoComplete_withNow() throws Exception {
        LocalDateTime cutoff = LocalDateTime.of(2026, 3, 2, 18, 0);
        when(lifecycleService.autoCompleteEndedSessions(cutoff)).thenReturn(AutoCompleteResponse.builder()
                .checked(3)
                .completed(2)
                .cutoff(cutoff)
                .build());

        mockMvc.perform(post("/api/admin/cron/auto-complete-sessions").param("now", "2026-03-02T18:00:00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checked").value(3))
                .andExpect(jsonPath("$.completed").value(2));
    }

    @Test
    @DisplayName("POST auto-complete-sessions with an unparsable cutoff returns 400")
    void autoComplete_badNow_returns400() throws Exception {
        mockMvc.perform(post("/api/admin/cron/auto-complete-sessions").param("now", "yesterday"))
                .andExpect(status().isBadRequest());
        verify(lifecycleService, never()).autoCompleteEndedSessions(any());
    }
}
