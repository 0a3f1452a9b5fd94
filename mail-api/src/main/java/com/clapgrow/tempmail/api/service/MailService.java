package com.clapgrow.tempmail.api.service;

import com.clapgrow.tempmail.api.dto.ApiResponse;
import com.clapgrow.tempmail.common.model.CreateEmailRequest;
import com.clapgrow.tempmail.common.model.CreatedEmail;
import com.clapgrow.tempmail.common.model.EmailListQuery;
import com.clapgrow.tempmail.common.model.EmailMessage;
import com.clapgrow.tempmail.common.provider.MailProvider;
import com.clapgrow.tempmail.common.provider.OperationEnvelope;
import com.clapgrow.tempmail.common.provider.ProviderCapabilities;
import com.clapgrow.tempmail.common.provider.ProviderHealth;
import com.clapgrow.tempmail.common.provider.ProviderStatistics;
import com.clapgrow.tempmail.common.routing.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the provider for each request and converts its envelope into an API response.
 *
 * Routing rules:
 * - An explicit provider name always wins
 * - Creation otherwise goes to the best enabled provider offering the requested features
 * - Reads otherwise go to the provider that owns the address's domain
 *
 * "No provider" is returned as a failed response, never thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MailService {

    static final String NO_PROVIDER_FOR_CREATE = "No available email provider found";
    static final String NO_PROVIDER_FOR_ADDRESS = "No provider found for the email address";

    private final ProviderRegistry providerRegistry;

    public Mono<ApiResponse<CreatedEmail>> createEmail(CreateEmailRequest request) {
        CreateEmailRequest effective = request != null ? request : CreateEmailRequest.empty();
        Optional<MailProvider> provider = hasText(effective.provider())
            ? providerRegistry.getProvider(effective.provider().trim())
            : providerRegistry.selectBest(requiredCapabilities(effective));

        if (provider.isEmpty()) {
            log.warn("No provider available for create request (provider={}, domain={}, prefix={})",
                effective.provider(), effective.domain(), effective.hasPrefix());
            return Mono.just(ApiResponse.error(NO_PROVIDER_FOR_CREATE));
        }
        log.debug("Creating address with provider {}", provider.get().getName());
        return provider.get().createEmailAddress(effective).map(ApiResponse::fromEnvelope);
    }

    public Mono<ApiResponse<List<EmailMessage>>> listMessages(EmailListQuery query) {
        Optional<MailProvider> provider = route(query.provider(), query.address());
        if (provider.isEmpty()) {
            return Mono.just(ApiResponse.error(NO_PROVIDER_FOR_ADDRESS));
        }
        return provider.get().listMessages(query).map(ApiResponse::fromEnvelope);
    }

    public Mono<ApiResponse<EmailMessage>> fetchMessage(String address, String messageId,
                                                        String providerName, String accessToken) {
        Optional<MailProvider> provider = route(providerName, address);
        if (provider.isEmpty()) {
            return Mono.just(ApiResponse.error(NO_PROVIDER_FOR_ADDRESS));
        }
        return provider.get().fetchMessage(address, messageId, accessToken).map(ApiResponse::fromEnvelope);
    }

    public Mono<ApiResponse<Map<String, ProviderHealth>>> providersHealth() {
        return providerRegistry.allHealth().map(ApiResponse::success);
    }

    public Mono<ApiResponse<Map<String, ProviderHealth>>> refreshHealth() {
        log.info("Refreshing health of all providers");
        return providerRegistry.refreshAllHealth().map(ApiResponse::success);
    }

    public Mono<ApiResponse<Map<String, OperationEnvelope<Boolean>>>> testConnections() {
        return providerRegistry.testAllConnections().map(ApiResponse::success);
    }

    public ApiResponse<Map<String, ProviderStatistics>> providersStatistics() {
        return ApiResponse.success(providerRegistry.allStatistics());
    }

    /**
     * Features a create request needs: always creation, plus whatever hints it carries.
     */
    static ProviderCapabilities requiredCapabilities(CreateEmailRequest request) {
        return ProviderCapabilities.builder()
            .createEmail(true)
            .customDomains(request.hasDomain())
            .customPrefix(request.hasPrefix())
            .emailExpiration(request.hasExpiration())
            .build();
    }

    private Optional<MailProvider> route(String providerName, String address) {
        if (hasText(providerName)) {
            return providerRegistry.getProvider(providerName.trim());
        }
        return providerRegistry.resolveByAddress(address);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
