package com.clapgrow.tempmail.common.provider;

import lombok.Builder;

/**
 * Static feature flags of a provider.
 *
 * Declared once when an adapter is constructed and never mutated.
 * The same type doubles as a capability requirement: flags left {@code false}
 * mean "not requested" and are ignored during matching.
 *
 * Example usage:
 * <pre>
 * ProviderCapabilities required = ProviderCapabilities.builder()
 *     .createEmail(true)
 *     .customDomains(true)
 *     .build();
 * boolean usable = provider.getCapabilities().satisfies(required);
 * </pre>
 */
@Builder(toBuilder = true)
public record ProviderCapabilities(
    boolean createEmail,
    boolean listEmails,
    boolean getEmailContent,
    boolean customDomains,
    boolean customPrefix,
    boolean emailExpiration,
    boolean realTimeUpdates,
    boolean attachmentSupport
) {

    private static final ProviderCapabilities NONE = ProviderCapabilities.builder().build();

    /**
     * Requirement that every provider satisfies.
     *
     * @return All flags false
     */
    public static ProviderCapabilities none() {
        return NONE;
    }

    /**
     * Check whether this capability set covers every flag requested by {@code required}.
     *
     * @param required Requested capabilities (null means nothing requested)
     * @return true if each {@code true} flag in {@code required} is also {@code true} here
     */
    public boolean satisfies(ProviderCapabilities required) {
        if (required == null) {
            return true;
        }
        return covers(createEmail, required.createEmail)
            && covers(listEmails, required.listEmails)
            && covers(getEmailContent, required.getEmailContent)
            && covers(customDomains, required.customDomains)
            && covers(customPrefix, required.customPrefix)
            && covers(emailExpiration, required.emailExpiration)
            && covers(realTimeUpdates, required.realTimeUpdates)
            && covers(attachmentSupport, required.attachmentSupport);
    }

    private static boolean covers(boolean offered, boolean requested) {
        return offered || !requested;
    }
}
