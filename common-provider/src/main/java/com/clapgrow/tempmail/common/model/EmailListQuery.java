package com.clapgrow.tempmail.common.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Mailbox listing request.
 *
 * Filtering (unreadOnly, since) is applied before pagination (offset, limit).
 */
@Builder(toBuilder = true)
public record EmailListQuery(
    String address,
    String provider,
    String accessToken,
    Integer limit,
    Integer offset,
    boolean unreadOnly,
    Instant since
) {

    public static final int DEFAULT_LIMIT = 20;

    public int effectiveLimit() {
        return limit == null || limit < 0 ? DEFAULT_LIMIT : limit;
    }

    public int effectiveOffset() {
        return offset == null || offset < 0 ? 0 : offset;
    }
}
