package com.clapgrow.tempmail.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmailAttachment(
    String id,
    String filename,
    String contentType,
    long size,
    String downloadUrl,
    Boolean inline,
    String contentId
) {
}
