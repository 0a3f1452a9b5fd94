package com.clapgrow.tempmail.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Parameters for creating a disposable address. Every field is optional.
 *
 * @param provider Explicit provider name, bypassing selection
 * @param domain Requested domain
 * @param prefix Requested local part
 * @param expirationMinutes Requested lifetime; 0 or less means the vendor default
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateEmailRequest(
    String provider,
    String domain,
    String prefix,
    Integer expirationMinutes
) {

    public static CreateEmailRequest empty() {
        return new CreateEmailRequest(null, null, null, null);
    }

    public boolean hasDomain() {
        return domain != null && !domain.isBlank();
    }

    public boolean hasPrefix() {
        return prefix != null && !prefix.isBlank();
    }

    public boolean hasExpiration() {
        return expirationMinutes != null && expirationMinutes > 0;
    }
}
