package com.simpla.reconciliation.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.util.StreamUtils;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ReconciliationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void reconcileReturnsReconciledView() throws Exception {
        String request = StreamUtils.copyToString(
                new ClassPathResource("fixtures/reconcile-request.json").getInputStream(), StandardCharsets.UTF_8);

        mockMvc.perform(post("/api/v1/reconciliation/reconcile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value(containsString("20744")))
                .andExpect(jsonPath("$.resultJson").value(containsString("\"capitulos_derogados\":[\"VIII\"]")))
                .andExpect(jsonPath("$.malformedInput").doesNotExist());
    }

    @Test
    void malformedRequestIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/reconciliation/reconcile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dictamen\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value(containsString("'ley'")));
    }

    @Test
    void healthCheck() throws Exception {
        mockMvc.perform(get("/api/v1/reconciliation/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("Reconciliation service is healthy"));
    }
}
