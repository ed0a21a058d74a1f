package io.apiary.core.http;

import io.apiary.core.retry.RetryOptions;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One request as described by a caller, before URL joining and header merging.
 *
 * <p>
 * Map values are stringified when encoded; collection values repeat the key. A request carries
 * at most one body, either JSON or form-encoded.
 *
 * @param endpoint path relative to the broker's base URL
 * @param params   query parameters, never {@code null}
 * @param jsonBody payload serialized as JSON, or {@code null}
 * @param formBody fields sent as {@code application/x-www-form-urlencoded}, or {@code null}
 * @param headers  headers replacing the broker defaults for this call; {@code null} or empty
 *                 means the defaults
 * @param auth     basic credentials, or {@code null}
 * @param retry    retry overrides for this call, or {@code null}
 */
public record RequestSpec(
        String endpoint,
        Map<String, Object> params,
        Object jsonBody,
        Map<String, Object> formBody,
        Map<String, String> headers,
        BasicAuth auth,
        RetryOptions retry) {

    public RequestSpec {
        Objects.requireNonNull(endpoint, "endpoint");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        formBody = formBody == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(formBody));
        headers = headers == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        if (jsonBody != null && formBody != null) {
            throw new IllegalArgumentException("A request carries either a JSON body or a form body, not both");
        }
    }

    /** Starts a builder for {@code endpoint}. */
    public static Builder to(String endpoint) {
        return new Builder(endpoint);
    }

    /** Whether this call overrides the broker's default headers. */
    boolean hasHeaders() {
        return headers != null && !headers.isEmpty();
    }

    /** Builder for {@link RequestSpec}. */
    public static final class Builder {
        private final String endpoint;
        private final Map<String, Object> params = new LinkedHashMap<>();
        private Object jsonBody;
        private Map<String, Object> formBody;
        private Map<String, String> headers;
        private BasicAuth auth;
        private RetryOptions retry;

        Builder(String endpoint) {
            this.endpoint = endpoint;
        }

        public Builder param(String name, Object value) {
            params.put(name, value);
            return this;
        }

        public Builder params(Map<String, ?> params) {
            if (params != null) {
                this.params.putAll(params);
            }
            return this;
        }

        public Builder json(Object jsonBody) {
            this.jsonBody = jsonBody;
            return this;
        }

        public Builder form(Map<String, ?> formBody) {
            this.formBody = formBody == null ? null : new LinkedHashMap<>(formBody);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder auth(BasicAuth auth) {
            this.auth = auth;
            return this;
        }

        public Builder retry(RetryOptions retry) {
            this.retry = retry;
            return this;
        }

        public RequestSpec build() {
            return new RequestSpec(endpoint, params, jsonBody, formBody, headers, auth, retry);
        }
    }
}
