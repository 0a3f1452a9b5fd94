package com.clapgrow.tempmail.api.controller;

import com.clapgrow.tempmail.api.config.TempMailProperties;
import com.clapgrow.tempmail.api.dto.ApiResponse;
import com.clapgrow.tempmail.api.service.MailService;
import com.clapgrow.tempmail.common.model.CreatedEmail;
import com.clapgrow.tempmail.common.model.EmailListQuery;
import com.clapgrow.tempmail.common.model.EmailMessage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MailController.class)
@EnableConfigurationProperties(TempMailProperties.class)
@TestPropertySource(properties = "tempmail.security.api-key=test-key")
class MailControllerTest {

    private static final String BEARER = "Bearer test-key";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MailService mailService;

    @Test
    void testCreateEmail_Success() throws Exception {
        CreatedEmail created = CreatedEmail.builder()
                .address("bob@mailto.plus").domain("mailto.plus").username("bob").provider("tempmailplus").build();
        when(mailService.createEmail(any())).thenReturn(Mono.just(ApiResponse.success(created, "tempmailplus")));

        MvcResult result = mockMvc.perform(post("/api/mail/create")
                        .header("Authorization", BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prefix\":\"bob\",\"domain\":\"mailto.plus\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.address").value("bob@mailto.plus"))
                .andExpect(jsonPath("$.provider").value("tempmailplus"));
    }

    @Test
    void testCreateEmail_NoProvider_ReturnsBadRequest() throws Exception {
        when(mailService.createEmail(isNull()))
                .thenReturn(Mono.just(ApiResponse.error("No available email provider found")));

        MvcResult result = mockMvc.perform(post("/api/mail/create").header("Authorization", BEARER))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No available email provider found"));
    }

    @Test
    void testCreateEmail_MissingApiKey_ReturnsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/mail/create").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value(
                        "Missing API key. Please provide Authorization header with Bearer token."));

        verifyNoInteractions(mailService);
    }

    @Test
    void testCreateEmail_InvalidApiKey_ReturnsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/mail/create")
                        .header("Authorization", "Bearer wrong")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid API key. Please provide a valid Bearer token."));
    }

    @Test
    void testListMessages_MissingAddress_ReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/mail/list")
                        .header("Authorization", BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"limit\":5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.errors.address").value("Email address is required"));
    }

    @Test
    void testListMessages_PassesQuery() throws Exception {
        EmailMessage message = EmailMessage.builder().id("m1").subject("Hi").provider("mailtm").build();
        when(mailService.listMessages(any())).thenReturn(Mono.just(ApiResponse.success(List.of(message), "mailtm")));

        MvcResult result = mockMvc.perform(post("/api/mail/list")
                        .header("Authorization", BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\"x@somoj.com\",\"limit\":5,\"offset\":2,\"unreadOnly\":true,"
                                + "\"accessToken\":\"tok\",\"since\":\"2024-01-01T00:00:00Z\"}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("m1"))
                .andExpect(jsonPath("$.data[0].isRead").value(false));

        verify(mailService).listMessages(argThat((EmailListQuery query) ->
                query.address().equals("x@somoj.com")
                        && query.limit() == 5
                        && query.offset() == 2
                        && query.unreadOnly()
                        && "tok".equals(query.accessToken())
                        && query.since() != null));
    }

    @Test
    void testFetchMessage_NotFound() throws Exception {
        when(mailService.fetchMessage(eq("x@somoj.com"), eq("m9"), isNull(), isNull()))
                .thenReturn(Mono.just(ApiResponse.error("Email with ID m9 not found")));

        MvcResult result = mockMvc.perform(post("/api/mail/content")
                        .header("Authorization", BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\"x@somoj.com\",\"id\":\"m9\"}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void testMalformedBody_ReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/mail/list")
                        .header("Authorization", BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid request body"));
    }
}
