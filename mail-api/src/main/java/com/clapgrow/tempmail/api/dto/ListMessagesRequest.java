package com.clapgrow.tempmail.api.dto;

import com.clapgrow.tempmail.common.model.EmailListQuery;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.Instant;

@Data
public class ListMessagesRequest {

    @NotBlank(message = "Email address is required")
    private String address;

    private String provider;

    private String accessToken;

    @Min(1)
    @Max(100)
    private Integer limit;

    @Min(0)
    private Integer offset;

    private boolean unreadOnly;

    private Instant since;

    public EmailListQuery toQuery() {
        return EmailListQuery.builder()
            .address(address.trim())
            .provider(provider)
            .accessToken(accessToken)
            .limit(limit)
            .offset(offset)
            .unreadOnly(unreadOnly)
            .since(since)
            .build();
    }
}
