package com.clapgrow.tempmail.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class FetchMessageRequest {

    @NotBlank(message = "Email address is required")
    private String address;

    @NotBlank(message = "Email ID is required")
    @JsonAlias("id")
    private String emailId;

    private String provider;

    private String accessToken;
}
