package io.apiary.connectors.domaintools;

import io.apiary.connectors.ConnectorSupport;
import io.apiary.core.config.BrokerConfig;
import io.apiary.core.config.EnvConfig;
import io.apiary.core.config.EnvConfigResolver;
import io.apiary.core.http.Broker;
import io.apiary.core.log.CallLogger;
import java.net.http.HttpResponse;
import java.util.Map;

/**
 * Blocking client for the DomainTools API.
 *
 * <p>
 * The API key is taken from the constructor, or from {@code DOMAINTOOLS_API_KEY} when
 * {@link BrokerConfig#loadEnvVars()} is set, and sent as the {@code X-API-KEY} header. Every
 * method returns the raw response on 2xx and throws the broker's exceptions otherwise.
 */
public final class DomainToolsConnector implements AutoCloseable {

    private final Broker broker;
    private final CallLogger calls;

    /** Creates a connector with default broker settings. */
    public DomainToolsConnector(String apiKey) {
        this(apiKey, BrokerConfig.builder().build());
    }

    /**
     * @param apiKey API key, or {@code null} to look it up in the environment configuration
     * @param config broker settings; {@code baseUrl} defaults to {@link DomainTools#BASE_URL}
     * @throws io.apiary.core.error.ConfigurationException if no API key is available
     */
    public DomainToolsConnector(String apiKey, BrokerConfig config) {
        this(apiKey, config, EnvConfigResolver.resolve(config.loadEnvVars()));
    }

    DomainToolsConnector(String apiKey, BrokerConfig config, EnvConfig env) {
        String key = ConnectorSupport.requireApiKey(
                apiKey, env, DomainTools.API_KEY_VARIABLE, DomainTools.MISSING_KEY_MESSAGE);
        BrokerConfig effective = config.withDefaultBaseUrl(DomainTools.BASE_URL)
                .toBuilder()
                .header(DomainTools.API_KEY_HEADER, key)
                .build();
        this.broker = new Broker(effective, env, DomainToolsConnector.class);
        this.calls = new CallLogger(DomainToolsConnector.class, config.enableLogging());
    }

    DomainToolsConnector(Broker broker, CallLogger calls) {
        this.broker = broker;
        this.calls = calls;
    }

    /**
     * Searches Iris Investigate. Parameters can be base search fields (domain, IP, SSL hash,
     * email...) or filters refining the search.
     *
     * @param params search parameters, all from {@link IrisInvestigate#ALLOWED_PARAMS}
     * @throws io.apiary.core.error.ValidationException before any request if {@code params}
     *                                                  is empty or has unknown names
     */
    public HttpResponse<String> irisInvestigate(Map<String, ?> params) throws InterruptedException {
        Map<String, ?> logged = params == null ? Map.of() : params;
        calls.call("irisInvestigate", Map.of("params", logged));
        IrisInvestigate.validate(params);
        return broker.get(DomainTools.IRIS_INVESTIGATE_PATH, params);
    }

    /** Parsed WHOIS record for a domain name or IP address. */
    public HttpResponse<String> parsedWhois(String query) throws InterruptedException {
        return parsedWhois(query, Map.of());
    }

    public HttpResponse<String> parsedWhois(String query, Map<String, ?> params) throws InterruptedException {
        calls.query("parsedWhois", query);
        return broker.get(DomainTools.parsedWhoisPath(query), params);
    }

    /** Domains hosted on the same IP address as {@code query}. */
    public HttpResponse<String> reverseIp(String query) throws InterruptedException {
        return reverseIp(query, Map.of());
    }

    public HttpResponse<String> reverseIp(String query, Map<String, ?> params) throws InterruptedException {
        calls.query("reverseIp", query);
        return broker.get(DomainTools.reverseIpPath(query), params);
    }

    /** Domains sharing the name server {@code query}. */
    public HttpResponse<String> reverseNameserver(String query) throws InterruptedException {
        return reverseNameserver(query, Map.of());
    }

    public HttpResponse<String> reverseNameserver(String query, Map<String, ?> params)
            throws InterruptedException {
        calls.query("reverseNameserver", query);
        return broker.get(DomainTools.reverseNameserverPath(query), params);
    }

    /** The underlying broker, for endpoints this class does not wrap. */
    public Broker broker() {
        return broker;
    }

    @Override
    public void close() {
        broker.close();
    }
}
