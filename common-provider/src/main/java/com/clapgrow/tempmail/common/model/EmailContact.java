package com.clapgrow.tempmail.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmailContact(String email, String name) {

    public static EmailContact of(String email) {
        return new EmailContact(email, null);
    }
}
