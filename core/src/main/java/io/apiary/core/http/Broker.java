package io.apiary.core.http;

import io.apiary.core.config.BrokerConfig;
import io.apiary.core.config.EnvConfig;
import io.apiary.core.config.EnvConfigResolver;
import io.apiary.core.error.ConfigurationException;
import io.apiary.core.log.CallLogger;
import io.apiary.core.proxy.ProxyDecision;
import io.apiary.core.proxy.ProxyResolver;
import io.apiary.core.retry.RetryPolicy;
import io.github.resilience4j.retry.Retry;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking HTTP executor shared by the connectors.
 *
 * <p>
 * Owns one JDK {@link HttpClient} for its whole life. Safe for concurrent use from many
 * threads. Every call either returns a 2xx response or throws one of the
 * {@link io.apiary.core.error.ApiaryException} subtypes; with backoff enabled, transient
 * failures are retried per {@link RetryPolicy} and the last attempt's error is what the caller
 * sees.
 */
public class Broker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Broker.class);

    private final BrokerConfig config;
    private final EnvConfig env;
    private final ProxyDecision proxy;
    private final RequestFactory requests;
    private final ExecutorService executor;
    private final HttpClient client;
    private final CallLogger failures;

    /** Creates a broker, resolving the {@link EnvConfig} when {@code loadEnvVars} is set. */
    public Broker(BrokerConfig config) {
        this(config, EnvConfigResolver.resolve(config.loadEnvVars()));
    }

    public Broker(BrokerConfig config, EnvConfig env) {
        this(config, env, Broker.class);
    }

    /**
     * @param config broker settings; {@code baseUrl} is required
     * @param env    pre-resolved configuration, consulted for proxy settings
     * @param owner  class whose logger receives failure log lines
     * @throws ConfigurationException if the base URL is missing or a proxy URL is invalid
     */
    public Broker(BrokerConfig config, EnvConfig env, Class<?> owner) {
        this(config, env, owner, System.getenv());
    }

    Broker(BrokerConfig config, EnvConfig env, Class<?> owner, Map<String, String> processEnv) {
        if (config.baseUrl() == null || config.baseUrl().isBlank()) {
            throw new ConfigurationException("A base URL is required");
        }
        this.config = config;
        this.env = env;
        this.proxy = ProxyResolver.select(config, env, processEnv);
        this.requests = new RequestFactory(config.baseUrl(), config.timeout());
        this.failures = new CallLogger(owner, config.enableLogging());
        this.executor = HttpClients.newExecutor("apiary-http");
        try {
            this.client = HttpClients.create(config, proxy, executor);
        } catch (RuntimeException e) {
            executor.shutdownNow();
            throw e;
        }
        LOG.debug("Broker initialized: baseUrl={}, proxy={}, backoff={}",
                requests.baseUrl(), proxy.getClass().getSimpleName(), config.enableBackoff());
    }

    public HttpResponse<String> get(String endpoint) throws InterruptedException {
        return get(RequestSpec.to(endpoint).build());
    }

    public HttpResponse<String> get(String endpoint, Map<String, ?> params) throws InterruptedException {
        return get(RequestSpec.to(endpoint).params(params).build());
    }

    public HttpResponse<String> get(RequestSpec spec) throws InterruptedException {
        return request(HttpMethod.GET, spec);
    }

    /** POSTs {@code jsonBody} serialized as JSON. */
    public HttpResponse<String> post(String endpoint, Object jsonBody) throws InterruptedException {
        return post(RequestSpec.to(endpoint).json(jsonBody).build());
    }

    /** POSTs {@code formBody} as {@code application/x-www-form-urlencoded}. */
    public HttpResponse<String> postForm(String endpoint, Map<String, ?> formBody) throws InterruptedException {
        return post(RequestSpec.to(endpoint).form(formBody).build());
    }

    public HttpResponse<String> post(RequestSpec spec) throws InterruptedException {
        return request(HttpMethod.POST, spec);
    }

    /**
     * Sends one request, retrying when backoff is enabled.
     *
     * @return the 2xx response
     * @throws io.apiary.core.error.HttpStatusException for any other status
     * @throws io.apiary.core.error.TransportException  if the exchange fails at the I/O level
     * @throws io.apiary.core.error.ValidationException if the request cannot be built
     * @throws InterruptedException                     if the calling thread is interrupted
     */
    public HttpResponse<String> request(HttpMethod method, RequestSpec spec) throws InterruptedException {
        HttpRequest request = requests.build(method, spec, config.headers());
        AtomicInteger attempts = new AtomicInteger();

        if (!config.enableBackoff()) {
            try {
                return exchange(method, request, attempts);
            } catch (RuntimeException e) {
                Exchanges.reportFailure(failures, e, attempts.get());
                throw e;
            }
        }

        Retry retry = RetryPolicy.forCall(method + " " + request.uri().getPath(), spec.retry());
        try {
            return retry.executeCheckedSupplier(() -> exchange(method, request, attempts));
        } catch (RuntimeException | InterruptedException | Error e) {
            Exchanges.reportFailure(failures, e, attempts.get());
            throw e;
        } catch (Throwable e) {
            throw new IllegalStateException("Unexpected checked failure from " + method + " " + request.uri(), e);
        }
    }

    private HttpResponse<String> exchange(HttpMethod method, HttpRequest request, AtomicInteger attempts)
            throws InterruptedException {
        int attempt = attempts.incrementAndGet();
        LOG.debug("Sending {} {} (attempt {})", method, request.uri(), attempt);
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw ErrorClassifier.transport(e, method, request.uri());
        }
        LOG.debug("Received {} for {} {}", response.statusCode(), method, request.uri());
        return Exchanges.requireSuccess(response);
    }

    public BrokerConfig config() {
        return config;
    }

    public EnvConfig envConfig() {
        return env;
    }

    /** The proxy decision the client was built with. */
    public ProxyDecision proxyDecision() {
        return proxy;
    }

    /** Base URL without trailing slashes. */
    public String baseUrl() {
        return requests.baseUrl();
    }

    /** Releases the client's threads. Calls made afterwards fail. */
    @Override
    public void close() {
        executor.shutdown();
        LOG.debug("Broker closed: baseUrl={}", requests.baseUrl());
    }
}
