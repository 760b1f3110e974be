package com.defiguard.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.defiguard.api.controller.EvaluationController;
import com.defiguard.auth.InvocationGrant;
import com.defiguard.auth.InvocationTokenService;
import com.defiguard.exception.GlobalExceptionHandler;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class EvaluationControllerTest {

    private MockMvc mockMvc;

    @Mock
    private InvocationTokenService invocationTokenService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new EvaluationController(invocationTokenService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void start_returns201WithToken() throws Exception {
        when(invocationTokenService.issue()).thenReturn(InvocationGrant.builder()
                .evaluationId("eval-1")
                .invocationToken("jwt-token")
                .expiresAt(Instant.parse("2026-03-10T12:15:00Z"))
                .build());

        mockMvc.perform(post("/api/evaluations"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.evaluation_id").value("eval-1"))
                .andExpect(jsonPath("$.invocation_token").value("jwt-token"));
    }

    @Test
    void cancel_activeEvaluation_returns204() throws Exception {
        when(invocationTokenService.revoke("eval-1")).thenReturn(true);

        mockMvc.perform(delete("/api/evaluations/eval-1")).andExpect(status().isNoContent());
    }

    @Test
    void cancel_unknownEvaluation_returns404() throws Exception {
        when(invocationTokenService.revoke("eval-9")).thenReturn(false);

        mockMvc.perform(delete("/api/evaluations/eval-9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.message").value("Evaluation eval-9 is not active or does not exist"));
    }
}
