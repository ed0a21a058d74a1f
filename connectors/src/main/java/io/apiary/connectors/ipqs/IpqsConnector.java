package io.apiary.connectors.ipqs;

import io.apiary.connectors.ConnectorSupport;
import io.apiary.core.config.BrokerConfig;
import io.apiary.core.config.EnvConfig;
import io.apiary.core.config.EnvConfigResolver;
import io.apiary.core.http.Broker;
import io.apiary.core.log.CallLogger;
import java.net.http.HttpResponse;
import java.util.Map;

/**
 * Blocking client for the IPQualityScore malicious URL scanner.
 *
 * <p>
 * The API key is taken from the constructor, or from {@code IPQS_API_KEY} when
 * {@link BrokerConfig#loadEnvVars()} is set. IPQS expects it as a form field, so it travels in
 * the request body rather than a header.
 */
public final class IpqsConnector implements AutoCloseable {

    static final String MISSING_KEY_MESSAGE = "API key is required for IPQSConnector";

    private final Broker broker;
    private final CallLogger calls;
    private final String apiKey;

    public IpqsConnector(String apiKey) {
        this(apiKey, BrokerConfig.builder().build());
    }

    /**
     * @param apiKey API key, or {@code null} to look it up in the environment configuration
     * @param config broker settings; {@code baseUrl} defaults to {@link Ipqs#BASE_URL}
     * @throws io.apiary.core.error.ConfigurationException if no API key is available
     */
    public IpqsConnector(String apiKey, BrokerConfig config) {
        this(apiKey, config, EnvConfigResolver.resolve(config.loadEnvVars()));
    }

    IpqsConnector(String apiKey, BrokerConfig config, EnvConfig env) {
        this.apiKey = ConnectorSupport.requireApiKey(apiKey, env, Ipqs.API_KEY_VARIABLE, MISSING_KEY_MESSAGE);
        BrokerConfig effective = config.withDefaultBaseUrl(Ipqs.BASE_URL)
                .toBuilder()
                .header(Ipqs.CONTENT_TYPE, Ipqs.FORM_URLENCODED)
                .build();
        this.broker = new Broker(effective, env, IpqsConnector.class);
        this.calls = new CallLogger(IpqsConnector.class, config.enableLogging());
    }

    IpqsConnector(Broker broker, CallLogger calls, String apiKey) {
        this.broker = broker;
        this.calls = calls;
        this.apiKey = apiKey;
    }

    /** Scans {@code query} with default settings. */
    public HttpResponse<String> maliciousUrl(String query) throws InterruptedException {
        return maliciousUrl(query, Map.of());
    }

    /**
     * Scans {@code query}.
     *
     * @param extra optional scan fields such as {@code strictness} or {@code fast}
     */
    public HttpResponse<String> maliciousUrl(String query, Map<String, ?> extra) throws InterruptedException {
        calls.query("maliciousUrl", query);
        return broker.postForm(Ipqs.MALICIOUS_URL_PATH, Ipqs.maliciousUrlForm(query, apiKey, extra));
    }

    public Broker broker() {
        return broker;
    }

    @Override
    public void close() {
        broker.close();
    }
}
