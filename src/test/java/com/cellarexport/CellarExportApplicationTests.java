package com.cellarexport;

import com.cellarexport.security.ApiKeyAuthenticationFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CellarExportApplicationTests {

    private static final String API_KEY = "test-api-key-must-be-at-least-32-characters";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void contextLoads() {
    }

    @Test
    void healthIsOpen() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
        mockMvc.perform(get("/api/ping"))
                .andExpect(status().isOk())
                .andExpect(content().string("pong"));
    }

    @Test
    void startRequiresApiKey() throws Exception {
        mockMvc.perform(post("/api/exports/export-1/start"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/exports/export-1/start")
                        .header(ApiKeyAuthenticationFilter.API_KEY_HEADER, "wrong-key"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void startRequiresTriggerRole() throws Exception {
        mockMvc.perform(post("/api/exports/export-1/start").with(user("someone").roles("USER")))
                .andExpect(status().isForbidden());
    }

    @Test
    void startOfUnknownExportWithKeyIsNotFound() throws Exception {
        mockMvc.perform(post("/api/exports/unknown-export/start")
                        .header(ApiKeyAuthenticationFilter.API_KEY_HEADER, API_KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Export unknown-export not found"));
    }
}
