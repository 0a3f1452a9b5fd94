package com.clapgrow.tempmail.api.controller;

import com.clapgrow.tempmail.api.config.TempMailProperties;
import com.clapgrow.tempmail.common.provider.MailProvider;
import com.clapgrow.tempmail.common.routing.ProviderDomainTable;
import com.clapgrow.tempmail.common.routing.ProviderRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Health check endpoints")
public class HealthController {

    static final String SERVICE_NAME = "tempmail-gateway";
    static final String VERSION = "1.0.0";

    private final ProviderRegistry providerRegistry;
    private final TempMailProperties properties;

    @GetMapping("/health")
    @Operation(
            summary = "Health check",
            description = "Returns the liveness of the gateway itself, not of the providers."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Service is healthy")
    })
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> response = new HashMap<>();
        response.put("status", "UP");
        response.put("service", SERVICE_NAME);
        response.put("version", VERSION);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/api/info")
    @Operation(summary = "Service information", description = "Registered providers, authentication mode and routes.")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, List<String>> domainsByProvider = new LinkedHashMap<>();
        ProviderDomainTable.asMap().forEach((domain, provider) ->
                domainsByProvider.computeIfAbsent(provider, name -> new ArrayList<>()).add(domain));

        List<Map<String, Object>> providers = new ArrayList<>();
        for (MailProvider provider : providerRegistry.allProviders()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", provider.getName());
            entry.put("enabled", provider.isEnabled());
            entry.put("priority", provider.getConfiguration().getPriority());
            entry.put("domains", domainsByProvider.getOrDefault(provider.getName(), List.of()));
            entry.put("capabilities", provider.getCapabilities());
            providers.add(entry);
        }

        Map<String, Object> authentication = new LinkedHashMap<>();
        authentication.put("enabled", properties.isAuthenticationEnabled());
        authentication.put("method", "Bearer Token");
        authentication.put("header", "Authorization: Bearer <api-key>");

        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("createEmail", "POST /api/mail/create");
        endpoints.put("listMessages", "POST /api/mail/list");
        endpoints.put("fetchMessage", "POST /api/mail/content");
        endpoints.put("providersHealth", "GET /api/mail/providers/health");
        endpoints.put("refreshHealth", "POST /api/mail/providers/health/refresh");
        endpoints.put("testConnections", "POST /api/mail/providers/test-connections");
        endpoints.put("providersStats", "GET /api/mail/providers/stats");

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", SERVICE_NAME);
        data.put("version", VERSION);
        data.put("description", "Temporary email gateway aggregating third-party providers");
        data.put("providers", providers);
        data.put("authentication", authentication);
        data.put("endpoints", endpoints);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("data", data);
        return ResponseEntity.ok(response);
    }
}
