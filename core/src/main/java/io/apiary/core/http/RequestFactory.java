package io.apiary.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.apiary.core.error.ValidationException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Turns a {@link RequestSpec} into a JDK {@link HttpRequest}. Shared by the sync and async
 * brokers; holds no mutable state.
 */
final class RequestFactory {

    static final String CONTENT_TYPE = "Content-Type";
    static final String AUTHORIZATION = "Authorization";
    static final String APPLICATION_JSON = "application/json";
    static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

    private static final ObjectMapper JSON = new ObjectMapper();

    /** Headers the JDK client sets itself and rejects when set manually. */
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final String baseUrl;
    private final Duration timeout;

    RequestFactory(String baseUrl, Duration timeout) {
        this.baseUrl = stripTrailingSlashes(baseUrl);
        this.timeout = timeout;
    }

    String baseUrl() {
        return baseUrl;
    }

    /**
     * Joins a base URL and an endpoint with exactly one slash, however many slashes either
     * side carried.
     */
    static String join(String baseUrl, String endpoint) {
        return stripTrailingSlashes(baseUrl) + "/" + stripLeadingSlashes(endpoint);
    }

    HttpRequest build(HttpMethod method, RequestSpec spec, Map<String, String> defaultHeaders) {
        URI uri = uri(spec);
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri).timeout(timeout);

        Map<String, String> headers = spec.hasHeaders() ? spec.headers() : defaultHeaders;
        boolean contentTypeSet = false;
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            String name = entry.getKey();
            if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (spec.auth() != null && AUTHORIZATION.equalsIgnoreCase(name)) {
                continue;
            }
            contentTypeSet |= CONTENT_TYPE.equalsIgnoreCase(name);
            builder.header(name, entry.getValue());
        }
        if (spec.auth() != null) {
            builder.header(AUTHORIZATION, spec.auth().headerValue());
        }

        HttpRequest.BodyPublisher body;
        if (spec.jsonBody() != null) {
            body = HttpRequest.BodyPublishers.ofString(toJson(spec.jsonBody()), StandardCharsets.UTF_8);
            if (!contentTypeSet) {
                builder.header(CONTENT_TYPE, APPLICATION_JSON);
            }
        } else if (spec.formBody() != null) {
            body = HttpRequest.BodyPublishers.ofString(encode(spec.formBody()), StandardCharsets.UTF_8);
            if (!contentTypeSet) {
                builder.header(CONTENT_TYPE, FORM_URLENCODED);
            }
        } else {
            body = HttpRequest.BodyPublishers.noBody();
        }

        return builder.method(method.name(), body).build();
    }

    URI uri(RequestSpec spec) {
        String url = join(baseUrl, spec.endpoint());
        if (!spec.params().isEmpty()) {
            url = url + (url.contains("?") ? "&" : "?") + encode(spec.params());
        }
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid request URL '" + url + "': " + e.getMessage());
        }
    }

    /**
     * URL-encodes {@code values} as {@code k=v} pairs. Collections repeat the key, {@code null}
     * becomes an empty value.
     */
    static String encode(Map<String, ?> values) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String name = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            if (entry.getValue() instanceof Collection<?> many) {
                for (Object value : many) {
                    joiner.add(name + "=" + encodeValue(value));
                }
            } else {
                joiner.add(name + "=" + encodeValue(entry.getValue()));
            }
        }
        return joiner.toString();
    }

    private static String encodeValue(Object value) {
        return value == null ? "" : URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8);
    }

    private static String toJson(Object payload) {
        if (payload instanceof String text) {
            return text;
        }
        try {
            return JSON.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Request body cannot be serialized as JSON: " + e.getOriginalMessage());
        }
    }

    private static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    private static String stripLeadingSlashes(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }
}
