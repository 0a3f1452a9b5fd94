package com.clapgrow.tempmail.provider.support;

import java.time.Clock;

/**
 * Request ids of the form {@code <epochMillis>-<6 random [a-z0-9]>}.
 */
public final class RequestIds {

    private RequestIds() {
    }

    public static String next(Clock clock) {
        return clock.millis() + "-" + MailContentSupport.randomString(6);
    }
}
