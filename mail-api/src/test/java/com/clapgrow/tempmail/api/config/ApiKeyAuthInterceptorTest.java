package com.clapgrow.tempmail.api.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

class ApiKeyAuthInterceptorTest {

    private final MockHttpServletResponse response = new MockHttpServletResponse();

    private ApiKeyAuthInterceptor interceptor(String apiKey) {
        TempMailProperties properties = new TempMailProperties();
        properties.getSecurity().setApiKey(apiKey);
        return new ApiKeyAuthInterceptor(properties);
    }

    private MockHttpServletRequest request(String method, String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, "/api/mail/list");
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        return request;
    }

    @Test
    void testBlankKeyDisablesAuthentication() {
        assertTrue(interceptor("").preHandle(request("POST", null), response, new Object()));
        assertTrue(interceptor(null).preHandle(request("POST", null), response, new Object()));
    }

    @Test
    void testPreflightPassesThrough() {
        assertTrue(interceptor("secret").preHandle(request("OPTIONS", null), response, new Object()));
    }

    @Test
    void testMissingKeyIsRejected() {
        SecurityException missing = assertThrows(SecurityException.class,
            () -> interceptor("secret").preHandle(request("POST", null), response, new Object()));
        assertEquals(ApiKeyAuthInterceptor.MISSING_KEY_MESSAGE, missing.getMessage());

        assertThrows(SecurityException.class,
            () -> interceptor("secret").preHandle(request("POST", "Basic abc"), response, new Object()));
    }

    @Test
    void testWrongKeyIsRejected() {
        SecurityException invalid = assertThrows(SecurityException.class,
            () -> interceptor("secret").preHandle(request("POST", "Bearer nope"), response, new Object()));
        assertEquals(ApiKeyAuthInterceptor.INVALID_KEY_MESSAGE, invalid.getMessage());
    }

    @Test
    void testCorrectKeyIsAccepted() {
        assertTrue(interceptor("secret").preHandle(request("POST", "Bearer secret"), response, new Object()));
    }
}
