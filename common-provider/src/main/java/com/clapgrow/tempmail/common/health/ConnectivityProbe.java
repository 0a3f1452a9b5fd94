package com.clapgrow.tempmail.common.health;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Lazily executed, shared connectivity probe.
 *
 * The first subscriber triggers the probe; every concurrent or later subscriber
 * receives the same cached result until {@link #invalidate()} is called.
 */
@Slf4j
public class ConnectivityProbe {

    private final Supplier<Mono<ProbeResult>> probe;
    private final Clock clock;
    private final AtomicReference<Mono<ProbeResult>> cached = new AtomicReference<>();

    public ConnectivityProbe(Supplier<Mono<ProbeResult>> probe, Clock clock) {
        this.probe = probe;
        this.clock = clock;
    }

    /**
     * Cached probe result, probing on first use.
     */
    public Mono<ProbeResult> result() {
        while (true) {
            Mono<ProbeResult> current = cached.get();
            if (current != null) {
                return current;
            }
            Mono<ProbeResult> created = Mono.defer(probe)
                .onErrorResume(e -> {
                    log.warn("Connectivity probe failed unexpectedly: {}", e.toString());
                    return Mono.just(ProbeResult.failed(clock.instant(), null, e.getMessage()));
                })
                .cache();
            if (cached.compareAndSet(null, created)) {
                return created;
            }
        }
    }

    /**
     * Drop the cached result so the next {@link #result()} probes again.
     */
    public void invalidate() {
        cached.set(null);
    }

    public boolean isProbed() {
        return cached.get() != null;
    }
}
