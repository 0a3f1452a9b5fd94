package com.clapgrow.tempmail.api.config;

import com.clapgrow.tempmail.common.error.ProviderErrorClassifier;
import com.clapgrow.tempmail.common.http.ResilientHttpInvoker;
import com.clapgrow.tempmail.common.provider.MailProvider;
import com.clapgrow.tempmail.common.routing.ProviderRegistry;
import com.clapgrow.tempmail.provider.adapter.ChatTempMailProvider;
import com.clapgrow.tempmail.provider.adapter.EtempMailProvider;
import com.clapgrow.tempmail.provider.adapter.MailTmProvider;
import com.clapgrow.tempmail.provider.adapter.MinMailProvider;
import com.clapgrow.tempmail.provider.adapter.TempMailPlusProvider;
import com.clapgrow.tempmail.provider.adapter.VanishPostProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.List;

/**
 * Builds every adapter, applies its configuration and registers it.
 * Initialization performs no network I/O; each adapter probes its vendor on first use.
 */
@Configuration
@Slf4j
public class ProviderRegistryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderErrorClassifier providerErrorClassifier(Clock clock) {
        return new ProviderErrorClassifier(clock);
    }

    @Bean
    public ResilientHttpInvoker resilientHttpInvoker(WebClient.Builder webClientBuilder,
                                                     ObjectMapper objectMapper,
                                                     TempMailProperties properties) {
        return new ResilientHttpInvoker(webClientBuilder.build(), objectMapper,
                properties.getHttp().getRetryBaseDelay());
    }

    @Bean
    public ProviderRegistry providerRegistry(ResilientHttpInvoker httpInvoker,
                                             ProviderErrorClassifier errorClassifier,
                                             TempMailProperties properties,
                                             Clock clock) {
        ProviderRegistry registry = new ProviderRegistry(properties.getPerformanceOrder(), errorClassifier, clock);

        List<MailProvider> providers = List.of(
                new MinMailProvider(httpInvoker, errorClassifier, clock),
                new TempMailPlusProvider(httpInvoker, errorClassifier, clock),
                new MailTmProvider(httpInvoker, errorClassifier, clock),
                new EtempMailProvider(httpInvoker, errorClassifier, clock),
                new VanishPostProvider(httpInvoker, errorClassifier, clock),
                new ChatTempMailProvider(httpInvoker, errorClassifier, clock)
        );
        for (MailProvider provider : providers) {
            provider.initialize(properties.provider(provider.getName()).toConfiguration(provider.getName()));
            registry.register(provider);
        }

        log.info("Provider registry ready: {} registered, {} enabled",
                registry.allProviders().size(), registry.enabledProviders().size());
        return registry;
    }
}
