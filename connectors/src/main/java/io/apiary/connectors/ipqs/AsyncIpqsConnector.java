package io.apiary.connectors.ipqs;

import io.apiary.connectors.ConnectorSupport;
import io.apiary.core.config.BrokerConfig;
import io.apiary.core.config.EnvConfig;
import io.apiary.core.config.EnvConfigResolver;
import io.apiary.core.http.AsyncBroker;
import io.apiary.core.log.CallLogger;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Non-blocking counterpart of {@link IpqsConnector}. */
public final class AsyncIpqsConnector implements AutoCloseable {

    static final String MISSING_KEY_MESSAGE = "API key is required for AsyncIPQSConnector";

    private final AsyncBroker broker;
    private final CallLogger calls;
    private final String apiKey;

    public AsyncIpqsConnector(String apiKey) {
        this(apiKey, BrokerConfig.builder().build());
    }

    /**
     * @throws io.apiary.core.error.ConfigurationException if no API key is available or
     *                                                     {@code mounts} are set
     */
    public AsyncIpqsConnector(String apiKey, BrokerConfig config) {
        this(apiKey, config, EnvConfigResolver.resolve(config.loadEnvVars()));
    }

    AsyncIpqsConnector(String apiKey, BrokerConfig config, EnvConfig env) {
        this.apiKey = ConnectorSupport.requireApiKey(apiKey, env, Ipqs.API_KEY_VARIABLE, MISSING_KEY_MESSAGE);
        BrokerConfig effective = config.withDefaultBaseUrl(Ipqs.BASE_URL)
                .toBuilder()
                .header(Ipqs.CONTENT_TYPE, Ipqs.FORM_URLENCODED)
                .build();
        this.broker = new AsyncBroker(effective, env, AsyncIpqsConnector.class);
        this.calls = new CallLogger(AsyncIpqsConnector.class, config.enableLogging());
    }

    AsyncIpqsConnector(AsyncBroker broker, CallLogger calls, String apiKey) {
        this.broker = broker;
        this.calls = calls;
        this.apiKey = apiKey;
    }

    public CompletableFuture<HttpResponse<String>> maliciousUrl(String query) {
        return maliciousUrl(query, Map.of());
    }

    /**
     * @param extra optional scan fields such as {@code strictness} or {@code fast}
     */
    public CompletableFuture<HttpResponse<String>> maliciousUrl(String query, Map<String, ?> extra) {
        calls.query("maliciousUrl", query);
        Map<String, Object> form;
        try {
            form = Ipqs.maliciousUrlForm(query, apiKey, extra);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return broker.postForm(Ipqs.MALICIOUS_URL_PATH, form);
    }

    public AsyncBroker broker() {
        return broker;
    }

    public CompletableFuture<Void> closeAsync() {
        return broker.closeAsync();
    }

    @Override
    public void close() {
        broker.close();
    }
}
