package com.clapgrow.tempmail.provider.support;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Random;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Helpers shared by the vendor adapters: random identifiers, lenient date parsing
 * and HTML stripping.
 */
public final class MailContentSupport {

    public static final String LOWER_ALPHANUMERIC = "abcdefghijklmnopqrstuvwxyz0123456789";

    private static final Random RANDOM = new SecureRandom();
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
        value -> OffsetDateTime.parse(value).toInstant(),
        value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
        value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
        localPattern("yyyy-MM-dd HH:mm:ss"),
        localPattern("yyyy/MM/dd HH:mm:ss"),
        localPattern("dd/MM/yyyy HH:mm:ss")
    );

    private MailContentSupport() {
    }

    private static Function<String, Instant> localPattern(String pattern) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern);
        return value -> LocalDateTime.parse(value, formatter).toInstant(ZoneOffset.UTC);
    }

    public static String randomString(int length) {
        return randomString(length, LOWER_ALPHANUMERIC);
    }

    public static String randomString(int length, String charset) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append(charset.charAt(RANDOM.nextInt(charset.length())));
        }
        return builder.toString();
    }

    public static <T> T randomElement(List<T> values) {
        return values.get(RANDOM.nextInt(values.size()));
    }

    /**
     * Remove markup tags and trim. Null stays null.
     */
    public static String stripHtml(String html) {
        if (html == null) {
            return null;
        }
        return HTML_TAG.matcher(html).replaceAll("").trim();
    }

    /**
     * Parse the date formats seen across vendors: ISO-8601 with or without offset,
     * RFC 1123, epoch seconds or milliseconds, and a few local patterns read as UTC.
     * Unparseable or missing values fall back to the current time.
     *
     * @param value Vendor date string
     * @param clock Clock for the fallback
     * @return Parsed instant
     */
    public static Instant parseDate(String value, Clock clock) {
        if (value == null || value.isBlank()) {
            return clock.instant();
        }
        String trimmed = value.trim();
        if (DIGITS.matcher(trimmed).matches()) {
            long epoch = Long.parseLong(trimmed);
            return trimmed.length() >= 13 ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
        }
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return parser.apply(trimmed);
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return clock.instant();
    }

    /**
     * Local part of an address, the whole string when it has no {@code @}.
     */
    public static String username(String address) {
        int at = address.lastIndexOf('@');
        return at < 0 ? address : address.substring(0, at);
    }

    /**
     * Domain part of an address, empty when it has no {@code @}.
     */
    public static String domain(String address) {
        int at = address.lastIndexOf('@');
        return at < 0 ? "" : address.substring(at + 1);
    }
}
