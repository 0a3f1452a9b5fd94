package com.clapgrow.tempmail.common.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageQueryFilterTest {

    private static final Instant BASE = Instant.parse("2024-05-01T10:00:00Z");

    private final List<EmailMessage> inbox = List.of(
        message("1", true, 0),
        message("2", false, 60),
        message("3", true, 120),
        message("4", false, 180),
        message("5", true, 240)
    );

    @Test
    void testUnreadFilterAppliedBeforePagination() {
        EmailListQuery query = EmailListQuery.builder()
            .address("abc@mailto.plus")
            .unreadOnly(true)
            .offset(1)
            .limit(1)
            .build();

        List<EmailMessage> page = MessageQueryFilter.apply(inbox, query);

        assertEquals(1, page.size());
        assertEquals("4", page.get(0).getId());
    }

    @Test
    void testSinceFilterIsInclusive() {
        EmailListQuery query = EmailListQuery.builder()
            .address("abc@mailto.plus")
            .since(BASE.plusSeconds(120))
            .build();

        List<EmailMessage> page = MessageQueryFilter.apply(inbox, query);

        assertEquals(List.of("3", "4", "5"), page.stream().map(EmailMessage::getId).toList());
    }

    @Test
    void testDefaultsApplyWhenPaginationMissing() {
        EmailListQuery query = EmailListQuery.builder().address("abc@mailto.plus").build();

        assertEquals(20, query.effectiveLimit());
        assertEquals(0, query.effectiveOffset());
        assertEquals(5, MessageQueryFilter.apply(inbox, query).size());
    }

    private static EmailMessage message(String id, boolean read, long secondsAfterBase) {
        return EmailMessage.builder()
            .id(id)
            .from(EmailContact.of("sender@example.com"))
            .to(List.of(EmailContact.of("abc@mailto.plus")))
            .subject("Subject " + id)
            .receivedAt(BASE.plusSeconds(secondsAfterBase))
            .read(read)
            .provider("tempmailplus")
            .build();
    }
}
