package com.clapgrow.tempmail.api.controller;

import com.clapgrow.tempmail.api.config.TempMailProperties;
import com.clapgrow.tempmail.api.dto.ApiResponse;
import com.clapgrow.tempmail.api.service.MailService;
import com.clapgrow.tempmail.common.provider.ProviderHealth;
import com.clapgrow.tempmail.common.provider.ProviderStatistics;
import com.clapgrow.tempmail.common.provider.ProviderStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProviderController.class)
@EnableConfigurationProperties(TempMailProperties.class)
@TestPropertySource(properties = "tempmail.security.api-key=test-key")
class ProviderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MailService mailService;

    @Test
    void testHealthIsPublic() throws Exception {
        ProviderHealth health = new ProviderHealth(ProviderStatus.RATE_LIMITED, Instant.parse("2024-01-01T00:00:00Z"),
                120L, 2, 50.0, "Too many requests", 50.0);
        when(mailService.providersHealth()).thenReturn(Mono.just(ApiResponse.success(Map.of("mailtm", health))));

        MvcResult result = mockMvc.perform(get("/api/mail/providers/health"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.mailtm.status").value("rate_limited"))
                .andExpect(jsonPath("$.data.mailtm.lastError").value("Too many requests"));
    }

    @Test
    void testRefreshRequiresApiKey() throws Exception {
        mockMvc.perform(post("/api/mail/providers/health/refresh"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(mailService);
    }

    @Test
    void testStats() throws Exception {
        ProviderStatistics statistics = new ProviderStatistics(5, 3, 2, 40.0, null, 2, 5);
        when(mailService.providersStatistics()).thenReturn(ApiResponse.success(Map.of("minmail", statistics)));

        mockMvc.perform(get("/api/mail/providers/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.minmail.totalRequests").value(5))
                .andExpect(jsonPath("$.data.minmail.failedRequests").value(2));
    }
}
