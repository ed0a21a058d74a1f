package io.apiary.core.config;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Construction settings for a {@code Broker} or {@code AsyncBroker}.
 *
 * <p>
 * Use {@link #builder()} to construct instances. Connectors supply their own
 * {@code baseUrl} through {@link #withDefaultBaseUrl(String)}, so callers only set it to point
 * a connector at a different host.
 *
 * @param baseUrl          API root; trailing slashes are ignored when joining endpoints
 * @param headers          default headers sent with every request
 * @param timeout          connect and per-request timeout
 * @param trustEnv         whether proxy settings may be read from the process environment
 * @param proxy            explicit proxy URL for all traffic, or {@code null}
 * @param mounts           explicit per-scheme proxies keyed by {@code http://} or
 *                         {@code https://}, or {@code null}
 * @param enableBackoff    retry transient failures with exponential backoff
 * @param enableLogging    emit call and error log lines at INFO
 * @param loadEnvVars      merge the environment and settings file into an
 *                         {@link EnvConfig}
 * @param clientCustomizer extra tuning applied to the JDK client builder last
 */
public record BrokerConfig(
        String baseUrl,
        Map<String, String> headers,
        Duration timeout,
        boolean trustEnv,
        String proxy,
        Map<String, String> mounts,
        boolean enableBackoff,
        boolean enableLogging,
        boolean loadEnvVars,
        Consumer<HttpClient.Builder> clientCustomizer) {

    /** Default connect and request timeout. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public BrokerConfig {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        mounts = mounts == null || mounts.isEmpty() ? null : Map.copyOf(mounts);
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        clientCustomizer = clientCustomizer == null ? builder -> {} : clientCustomizer;
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this configuration. */
    public Builder toBuilder() {
        return new Builder()
                .baseUrl(baseUrl)
                .headers(headers)
                .timeout(timeout)
                .trustEnv(trustEnv)
                .proxy(proxy)
                .mounts(mounts)
                .enableBackoff(enableBackoff)
                .enableLogging(enableLogging)
                .loadEnvVars(loadEnvVars)
                .clientCustomizer(clientCustomizer);
    }

    /** Returns this configuration, or a copy with {@code defaultBaseUrl} if none was set. */
    public BrokerConfig withDefaultBaseUrl(String defaultBaseUrl) {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return this;
        }
        return toBuilder().baseUrl(defaultBaseUrl).build();
    }

    /** Builder for {@link BrokerConfig}. Everything is optional except where a broker needs a base URL. */
    public static final class Builder {
        private String baseUrl;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean trustEnv = true;
        private String proxy;
        private Map<String, String> mounts;
        private boolean enableBackoff;
        private boolean enableLogging;
        private boolean loadEnvVars;
        private Consumer<HttpClient.Builder> clientCustomizer;

        Builder() {}

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.clear();
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder trustEnv(boolean trustEnv) {
            this.trustEnv = trustEnv;
            return this;
        }

        public Builder proxy(String proxy) {
            this.proxy = proxy;
            return this;
        }

        public Builder mounts(Map<String, String> mounts) {
            this.mounts = mounts;
            return this;
        }

        public Builder enableBackoff(boolean enableBackoff) {
            this.enableBackoff = enableBackoff;
            return this;
        }

        public Builder enableLogging(boolean enableLogging) {
            this.enableLogging = enableLogging;
            return this;
        }

        public Builder loadEnvVars(boolean loadEnvVars) {
            this.loadEnvVars = loadEnvVars;
            return this;
        }

        public Builder clientCustomizer(Consumer<HttpClient.Builder> clientCustomizer) {
            this.clientCustomizer = clientCustomizer;
            return this;
        }

        public BrokerConfig build() {
            return new BrokerConfig(
                    baseUrl,
                    headers,
                    timeout,
                    trustEnv,
                    proxy,
                    mounts,
                    enableBackoff,
                    enableLogging,
                    loadEnvVars,
                    clientCustomizer);
        }
    }
}
