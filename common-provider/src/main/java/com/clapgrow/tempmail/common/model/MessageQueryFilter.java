package com.clapgrow.tempmail.common.model;

import java.util.List;
import java.util.stream.Stream;

/**
 * Applies {@link EmailListQuery} filtering and pagination to a vendor's full message list.
 */
public final class MessageQueryFilter {

    private MessageQueryFilter() {
    }

    public static List<EmailMessage> apply(List<EmailMessage> messages, EmailListQuery query) {
        Stream<EmailMessage> stream = messages.stream();
        if (query.unreadOnly()) {
            stream = stream.filter(message -> !message.isRead());
        }
        if (query.since() != null) {
            stream = stream.filter(message -> message.getReceivedAt() != null
                && !message.getReceivedAt().isBefore(query.since()));
        }
        return stream
            .skip(query.effectiveOffset())
            .limit(query.effectiveLimit())
            .toList();
    }
}
