package com.clapgrow.tempmail.common.routing;

import com.clapgrow.tempmail.common.error.ProviderErrorClassifier;
import com.clapgrow.tempmail.common.provider.MailProvider;
import com.clapgrow.tempmail.common.provider.OperationEnvelope;
import com.clapgrow.tempmail.common.provider.ProviderCapabilities;
import com.clapgrow.tempmail.common.provider.ProviderHealth;
import com.clapgrow.tempmail.common.provider.ProviderStatistics;
import com.clapgrow.tempmail.common.provider.ResponseMetadata;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuples;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Registered providers and the routing decisions made over them.
 *
 * Absence is part of the contract: lookups return an empty {@link Optional}
 * instead of throwing. The provider map is written during startup and read
 * afterwards; registration replaces the map as a whole.
 */
@Slf4j
public class ProviderRegistry {

    /**
     * Observed reliability ranking used by {@link #selectBest(ProviderCapabilities)}.
     */
    public static final List<String> DEFAULT_PERFORMANCE_ORDER = List.of(
        "chattempmail", "tempmailplus", "minmail", "vanishpost", "mailtm", "etempmail");

    private final List<String> performanceOrder;
    private final ProviderErrorClassifier errorClassifier;
    private final Clock clock;

    private volatile Map<String, MailProvider> providers = Map.of();

    public ProviderRegistry() {
        this(DEFAULT_PERFORMANCE_ORDER, new ProviderErrorClassifier(), Clock.systemUTC());
    }

    public ProviderRegistry(List<String> performanceOrder, ProviderErrorClassifier errorClassifier, Clock clock) {
        this.performanceOrder = List.copyOf(performanceOrder);
        this.errorClassifier = errorClassifier;
        this.clock = clock;
    }

    /**
     * Register a provider under its name. A later registration with the same name wins.
     */
    public synchronized void register(MailProvider provider) {
        Map<String, MailProvider> updated = new LinkedHashMap<>(providers);
        MailProvider previous = updated.put(provider.getName(), provider);
        if (previous != null && previous != provider) {
            log.warn("Provider {} registered twice, replacing previous instance", provider.getName());
        }
        providers = updated;
        log.info("Registered provider {} (enabled={}, priority={})", provider.getName(),
            provider.isEnabled(), provider.getConfiguration() != null ? provider.getConfiguration().getPriority() : null);
    }

    public Optional<MailProvider> getProvider(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(name));
    }

    public Collection<MailProvider> allProviders() {
        return providers.values();
    }

    /**
     * Enabled providers ordered by ascending priority; ties keep registration order.
     */
    public List<MailProvider> enabledProviders() {
        return providers.values().stream()
            .filter(MailProvider::isEnabled)
            .sorted(Comparator.comparingInt(provider -> provider.getConfiguration().getPriority()))
            .toList();
    }

    /**
     * Best enabled provider covering the required capabilities.
     *
     * Candidates are ranked by the performance order; providers missing from it
     * follow the listed ones in priority order.
     *
     * @param required Requested capabilities, null for none
     * @return Selected provider, empty when nothing qualifies
     */
    public Optional<MailProvider> selectBest(ProviderCapabilities required) {
        return enabledProviders().stream()
            .filter(provider -> provider.getCapabilities().satisfies(required))
            .sorted(Comparator.comparingInt(this::performanceRank))
            .findFirst();
    }

    private int performanceRank(MailProvider provider) {
        int index = performanceOrder.indexOf(provider.getName());
        return index >= 0 ? index : Integer.MAX_VALUE;
    }

    /**
     * Provider that issued an address, inferred from its domain.
     *
     * @param address Full mailbox address
     * @return Registered provider, empty for unknown domains or unregistered providers
     */
    public Optional<MailProvider> resolveByAddress(String address) {
        return ProviderDomainTable.providerForAddress(address).flatMap(this::getProvider);
    }

    /**
     * Health of every registered provider. A provider whose health cannot be
     * collected is reported with a synthetic ERROR snapshot.
     */
    public Mono<Map<String, ProviderHealth>> allHealth() {
        return collectHealth(MailProvider::getHealth);
    }

    /**
     * Re-probe every registered provider and return the fresh health.
     */
    public Mono<Map<String, ProviderHealth>> refreshAllHealth() {
        return collectHealth(MailProvider::refreshHealth);
    }

    private Mono<Map<String, ProviderHealth>> collectHealth(Function<MailProvider, Mono<ProviderHealth>> healthCall) {
        return Flux.fromIterable(providers.values())
            .flatMapSequential(provider -> Mono.defer(() -> healthCall.apply(provider))
                .onErrorResume(e -> {
                    log.warn("Health check failed for provider {}: {}", provider.getName(), e.toString());
                    return Mono.just(ProviderHealth.unavailable(e.getMessage(), clock.instant()));
                })
                .map(health -> Tuples.of(provider.getName(), health)))
            .collect(LinkedHashMap::new, (map, entry) -> map.put(entry.getT1(), entry.getT2()));
    }

    public Map<String, ProviderStatistics> allStatistics() {
        Map<String, ProviderStatistics> statistics = new LinkedHashMap<>();
        providers.forEach((name, provider) -> statistics.put(name, provider.getStatistics()));
        return statistics;
    }

    /**
     * Force a connectivity test of every registered provider.
     */
    public Mono<Map<String, OperationEnvelope<Boolean>>> testAllConnections() {
        return Flux.fromIterable(providers.values())
            .flatMapSequential(provider -> Mono.defer(provider::testConnectivity)
                .onErrorResume(e -> Mono.just(OperationEnvelope.<Boolean>failure(
                    errorClassifier.fromThrowable(e, provider.getName()),
                    ResponseMetadata.of(provider.getName(), 0, null))))
                .map(result -> Tuples.of(provider.getName(), result)))
            .collect(LinkedHashMap::new, (map, entry) -> map.put(entry.getT1(), entry.getT2()));
    }
}
