package com.clapgrow.tempmail.common.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw vendor response, returned for every status code.
 *
 * The body is decoded by content type: a {@link JsonNode} for JSON, a {@link String}
 * for {@code text/*}, a {@code byte[]} otherwise.
 *
 * @param status HTTP status code
 * @param statusText Reason phrase, empty when unknown
 * @param headers Response headers, {@code Set-Cookie} included
 * @param body Decoded body
 * @param attempts Attempts spent, 1 when the first one succeeded
 */
public record HttpResult(
    int status,
    String statusText,
    HttpHeaders headers,
    Object body,
    int attempts
) {

    public boolean ok() {
        return status >= 200 && status < 300;
    }

    /**
     * JSON body, or a missing node when the body was not JSON.
     */
    public JsonNode json() {
        return body instanceof JsonNode node ? node : MissingNode.getInstance();
    }

    public String text() {
        if (body instanceof String string) {
            return string;
        }
        if (body instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return body == null ? "" : body.toString();
    }

    public byte[] bytes() {
        return body instanceof byte[] bytes ? bytes : text().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Value of a cookie set by this response.
     *
     * @param name Cookie name
     * @return Cookie value if a {@code Set-Cookie} header carries it
     */
    public Optional<String> cookie(String name) {
        List<String> setCookies = headers == null ? null : headers.get(HttpHeaders.SET_COOKIE);
        if (setCookies == null) {
            return Optional.empty();
        }
        Pattern pattern = Pattern.compile(Pattern.quote(name) + "=([^;]+)");
        for (String header : setCookies) {
            Matcher matcher = pattern.matcher(header);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }
}
