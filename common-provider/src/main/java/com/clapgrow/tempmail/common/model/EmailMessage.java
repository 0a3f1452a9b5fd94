package com.clapgrow.tempmail.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Normalized mail message, whatever vendor it came from.
 *
 * List operations fill the summary fields; content operations also fill
 * text and HTML bodies where the vendor provides them.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmailMessage {

    String id;

    EmailContact from;

    List<EmailContact> to;

    List<EmailContact> cc;

    List<EmailContact> bcc;

    String subject;

    String textContent;

    String htmlContent;

    List<EmailAttachment> attachments;

    Instant receivedAt;

    @JsonProperty("isRead")
    boolean read;

    Long size;

    String provider;

    String messageId;

    String inReplyTo;

    List<String> references;

    Map<String, String> headers;
}
