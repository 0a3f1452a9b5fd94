package com.clapgrow.tempmail.common.http;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpMethod;
import org.springframework.util.MultiValueMap;

import java.time.Duration;
import java.util.Map;

/**
 * One outbound vendor request.
 *
 * At most one of {@code body} (serialized as JSON) and {@code formData}
 * (sent as application/x-www-form-urlencoded) is set.
 */
@Value
@Builder(toBuilder = true)
public class HttpInvocation {

    /**
     * Fully encoded absolute URL.
     */
    String url;

    @Builder.Default
    HttpMethod method = HttpMethod.GET;

    @Singular
    Map<String, String> headers;

    Object body;

    MultiValueMap<String, String> formData;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(10);

    /**
     * Additional attempts after the first one.
     */
    @Builder.Default
    int maxRetries = 0;
}
