package com.clapgrow.tempmail.common.health;

import java.time.Instant;

/**
 * Outcome of one connectivity probe.
 *
 * @param success Whether the vendor answered
 * @param checkedAt When the probe ran
 * @param responseTime Probe latency in milliseconds
 * @param error Failure message, null on success
 */
public record ProbeResult(boolean success, Instant checkedAt, Long responseTime, String error) {

    public static ProbeResult succeeded(Instant checkedAt, long responseTime) {
        return new ProbeResult(true, checkedAt, responseTime, null);
    }

    public static ProbeResult failed(Instant checkedAt, Long responseTime, String error) {
        return new ProbeResult(false, checkedAt, responseTime, error);
    }
}
