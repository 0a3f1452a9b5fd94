package com.clapgrow.tempmail.common.provider;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Operational status reported in a {@link ProviderHealth} snapshot.
 *
 * ACTIVE and ERROR are derived from the connectivity probe.
 * RATE_LIMITED and MAINTENANCE are only ever set explicitly by an adapter
 * that detected a vendor-specific signal.
 */
public enum ProviderStatus {
    ACTIVE,
    INACTIVE,
    ERROR,
    RATE_LIMITED,
    MAINTENANCE;

    @JsonValue
    public String toWireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
