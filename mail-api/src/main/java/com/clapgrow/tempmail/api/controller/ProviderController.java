package com.clapgrow.tempmail.api.controller;

import com.clapgrow.tempmail.api.dto.ApiResponse;
import com.clapgrow.tempmail.api.service.MailService;
import com.clapgrow.tempmail.common.provider.OperationEnvelope;
import com.clapgrow.tempmail.common.provider.ProviderHealth;
import com.clapgrow.tempmail.common.provider.ProviderStatistics;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/mail/providers")
@RequiredArgsConstructor
@Tag(name = "Providers", description = "Provider health, statistics and connectivity")
public class ProviderController {

    private final MailService mailService;

    @GetMapping("/health")
    @Operation(summary = "Cached health of every provider",
            description = "The first call per provider runs its connectivity probe; later calls reuse the result.")
    public Mono<ResponseEntity<ApiResponse<Map<String, ProviderHealth>>>> health() {
        return mailService.providersHealth().map(ResponseEntity::ok);
    }

    @PostMapping("/health/refresh")
    @Operation(summary = "Re-probe every provider")
    @SecurityRequirement(name = "bearerAuth")
    public Mono<ResponseEntity<ApiResponse<Map<String, ProviderHealth>>>> refreshHealth() {
        return mailService.refreshHealth().map(ResponseEntity::ok);
    }

    @PostMapping("/test-connections")
    @Operation(summary = "Run a connectivity test against every provider")
    public Mono<ResponseEntity<ApiResponse<Map<String, OperationEnvelope<Boolean>>>>> testConnections() {
        return mailService.testConnections().map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    @Operation(summary = "Request statistics of every provider")
    public ResponseEntity<ApiResponse<Map<String, ProviderStatistics>>> statistics() {
        return ResponseEntity.ok(mailService.providersStatistics());
    }
}
