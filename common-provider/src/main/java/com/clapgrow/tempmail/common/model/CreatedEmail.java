package com.clapgrow.tempmail.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;

/**
 * A freshly created disposable address.
 *
 * {@code accessToken} and {@code recoveryKey} are only set by vendors that issue them;
 * callers pass the token back on later list and fetch calls.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreatedEmail(
    String address,
    String domain,
    String username,
    Instant expiresAt,
    String provider,
    String accessToken,
    String recoveryKey
) {
}
