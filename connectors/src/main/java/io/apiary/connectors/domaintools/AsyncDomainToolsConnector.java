package io.apiary.connectors.domaintools;

import io.apiary.connectors.ConnectorSupport;
import io.apiary.core.config.BrokerConfig;
import io.apiary.core.config.EnvConfig;
import io.apiary.core.config.EnvConfigResolver;
import io.apiary.core.http.AsyncBroker;
import io.apiary.core.log.CallLogger;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking client for the DomainTools API, with the same operations as
 * {@link DomainToolsConnector}. Validation failures complete the returned future exceptionally
 * instead of throwing.
 */
public final class AsyncDomainToolsConnector implements AutoCloseable {

    private final AsyncBroker broker;
    private final CallLogger calls;

    public AsyncDomainToolsConnector(String apiKey) {
        this(apiKey, BrokerConfig.builder().build());
    }

    /**
     * @throws io.apiary.core.error.ConfigurationException if no API key is available or
     *                                                     {@code mounts} are set
     */
    public AsyncDomainToolsConnector(String apiKey, BrokerConfig config) {
        this(apiKey, config, EnvConfigResolver.resolve(config.loadEnvVars()));
    }

    AsyncDomainToolsConnector(String apiKey, BrokerConfig config, EnvConfig env) {
        String key = ConnectorSupport.requireApiKey(
                apiKey, env, DomainTools.API_KEY_VARIABLE, DomainTools.MISSING_KEY_MESSAGE);
        BrokerConfig effective = config.withDefaultBaseUrl(DomainTools.BASE_URL)
                .toBuilder()
                .header(DomainTools.API_KEY_HEADER, key)
                .build();
        this.broker = new AsyncBroker(effective, env, AsyncDomainToolsConnector.class);
        this.calls = new CallLogger(AsyncDomainToolsConnector.class, config.enableLogging());
    }

    AsyncDomainToolsConnector(AsyncBroker broker, CallLogger calls) {
        this.broker = broker;
        this.calls = calls;
    }

    public CompletableFuture<HttpResponse<String>> irisInvestigate(Map<String, ?> params) {
        Map<String, ?> logged = params == null ? Map.of() : params;
        calls.call("irisInvestigate", Map.of("params", logged));
        try {
            IrisInvestigate.validate(params);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return broker.get(DomainTools.IRIS_INVESTIGATE_PATH, params);
    }

    public CompletableFuture<HttpResponse<String>> parsedWhois(String query) {
        return parsedWhois(query, Map.of());
    }

    public CompletableFuture<HttpResponse<String>> parsedWhois(String query, Map<String, ?> params) {
        calls.query("parsedWhois", query);
        try {
            return broker.get(DomainTools.parsedWhoisPath(query), params);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public CompletableFuture<HttpResponse<String>> reverseIp(String query) {
        return reverseIp(query, Map.of());
    }

    public CompletableFuture<HttpResponse<String>> reverseIp(String query, Map<String, ?> params) {
        calls.query("reverseIp", query);
        try {
            return broker.get(DomainTools.reverseIpPath(query), params);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public CompletableFuture<HttpResponse<String>> reverseNameserver(String query) {
        return reverseNameserver(query, Map.of());
    }

    public CompletableFuture<HttpResponse<String>> reverseNameserver(String query, Map<String, ?> params) {
        calls.query("reverseNameserver", query);
        try {
            return broker.get(DomainTools.reverseNameserverPath(query), params);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public AsyncBroker broker() {
        return broker;
    }

    /** Closes the broker without blocking. */
    public CompletableFuture<Void> closeAsync() {
        return broker.closeAsync();
    }

    @Override
    public void close() {
        broker.close();
    }
}
