package com.surveygateway.api;

import com.surveygateway.shared.repository.CallerCounterRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "gateway.endpoint-key-enabled=true",
        "gateway.endpoint-key=s3cret-key"
})
class EndpointKeyTest {

    private static final String ORIGIN = "https://survey.example.com";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CallerCounterRepository callerCounterRepository;

    @Test
    void missingKeyIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Origin", ORIGIN)
                        .header("X-Forwarded-For", "198.51.100.20")
                        .content("{\"prompt\":\"hi\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Unauthorized Access"));

        assertThat(callerCounterRepository.findById("198.51.100.20")).isEmpty();
    }

    @Test
    void wrongKeyIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Origin", ORIGIN)
                        .header("X-Survey-Token", "s3cret-kez")
                        .content("{\"prompt\":\"hi\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void correctKeyIsAccepted() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Origin", ORIGIN)
                        .header("X-Forwarded-For", "198.51.100.21")
                        .header("X-Survey-Token", "s3cret-key")
                        .content("{\"prompt\":\"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value("[stub] hi"));
    }

    @Test
    void preflightAllowsTheKeyHeader() throws Exception {
        mockMvc.perform(options("/api/chat")
                        .header("Origin", ORIGIN)
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isNoContent())
                .andExpect(header().string("Access-Control-Allow-Headers", "Content-Type, X-Survey-Token"));
    }
}
