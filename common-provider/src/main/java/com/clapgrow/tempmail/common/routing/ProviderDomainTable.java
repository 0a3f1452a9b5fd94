package com.clapgrow.tempmail.common.routing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static mapping from mailbox domain to the provider that issued it.
 */
public final class ProviderDomainTable {

    private static final Map<String, String> DOMAIN_TO_PROVIDER;

    static {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("atminmail.com", "minmail");
        for (String domain : List.of("mailto.plus", "fexpost.com", "fexbox.org", "mailbox.in.ua",
                "rover.info", "chitthi.in", "fextemp.com", "any.pink", "merepost.com")) {
            table.put(domain, "tempmailplus");
        }
        table.put("somoj.com", "mailtm");
        for (String domain : List.of("ohm.edu.pl", "cross.edu.pl", "usa.edu.pl", "beta.edu.pl")) {
            table.put(domain, "etempmail");
        }
        for (String domain : List.of("genmacos.com", "vexdren.org", "bouldermac.com")) {
            table.put(domain, "vanishpost");
        }
        DOMAIN_TO_PROVIDER = Map.copyOf(table);
    }

    private ProviderDomainTable() {
    }

    /**
     * Provider name for the domain part of an address.
     *
     * @param address Full address, e.g. {@code abc@mailto.plus}
     * @return Provider name, empty for malformed addresses and unknown domains
     */
    public static Optional<String> providerForAddress(String address) {
        if (address == null) {
            return Optional.empty();
        }
        int at = address.lastIndexOf('@');
        if (at < 0 || at == address.length() - 1) {
            return Optional.empty();
        }
        return providerForDomain(address.substring(at + 1));
    }

    public static Optional<String> providerForDomain(String domain) {
        if (domain == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(DOMAIN_TO_PROVIDER.get(domain.trim().toLowerCase(Locale.ROOT)));
    }

    public static Map<String, String> asMap() {
        return DOMAIN_TO_PROVIDER;
    }
}
