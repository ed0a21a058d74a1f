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
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-blocking counterpart of {@link Broker}.
 *
 * <p>
 * Returned futures complete with the 2xx response, or exceptionally with the same error types
 * {@link Broker} throws. Backoff delays are scheduled on a private single-thread scheduler, so
 * no thread blocks while waiting.
 *
 * <p>
 * Explicit {@code mounts} are rejected. Differing {@code HTTP_PROXY}/{@code HTTPS_PROXY} values
 * from the environment are still applied per scheme, as in {@link Broker}.
 */
public class AsyncBroker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncBroker.class);

    private static final long CLOSE_TIMEOUT_SECONDS = 5;

    private final BrokerConfig config;
    private final EnvConfig env;
    private final ProxyDecision proxy;
    private final RequestFactory requests;
    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final HttpClient client;
    private final CallLogger failures;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

    /** Creates a broker, resolving the {@link EnvConfig} when {@code loadEnvVars} is set. */
    public AsyncBroker(BrokerConfig config) {
        this(config, EnvConfigResolver.resolve(config.loadEnvVars()));
    }

    public AsyncBroker(BrokerConfig config, EnvConfig env) {
        this(config, env, AsyncBroker.class);
    }

    /**
     * @param config broker settings; {@code baseUrl} is required and {@code mounts} must be
     *               unset
     * @param env    pre-resolved configuration, consulted for proxy settings
     * @param owner  class whose logger receives failure log lines
     * @throws ConfigurationException if mounts are given, the base URL is missing or a proxy
     *                                URL is invalid
     */
    public AsyncBroker(BrokerConfig config, EnvConfig env, Class<?> owner) {
        this(config, env, owner, System.getenv());
    }

    AsyncBroker(BrokerConfig config, EnvConfig env, Class<?> owner, Map<String, String> processEnv) {
        if (config.mounts() != null) {
            throw new ConfigurationException("Per-scheme proxy mounts are not supported by AsyncBroker; "
                    + "use 'proxy', or rely on HTTP_PROXY/HTTPS_PROXY in the environment with trustEnv");
        }
        if (config.baseUrl() == null || config.baseUrl().isBlank()) {
            throw new ConfigurationException("A base URL is required");
        }
        this.config = config;
        this.env = env;
        this.proxy = ProxyResolver.select(config, env, processEnv);
        this.requests = new RequestFactory(config.baseUrl(), config.timeout());
        this.failures = new CallLogger(owner, config.enableLogging());
        this.executor = HttpClients.newExecutor("apiary-async-http");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(HttpClients.daemonThreads("apiary-backoff"));
        try {
            this.client = HttpClients.create(config, proxy, executor);
        } catch (RuntimeException e) {
            executor.shutdownNow();
            scheduler.shutdownNow();
            throw e;
        }
        LOG.debug("AsyncBroker initialized: baseUrl={}, proxy={}, backoff={}",
                requests.baseUrl(), proxy.getClass().getSimpleName(), config.enableBackoff());
    }

    public CompletableFuture<HttpResponse<String>> get(String endpoint) {
        return get(RequestSpec.to(endpoint).build());
    }

    public CompletableFuture<HttpResponse<String>> get(String endpoint, Map<String, ?> params) {
        return get(RequestSpec.to(endpoint).params(params).build());
    }

    public CompletableFuture<HttpResponse<String>> get(RequestSpec spec) {
        return request(HttpMethod.GET, spec);
    }

    /** POSTs {@code jsonBody} serialized as JSON. */
    public CompletableFuture<HttpResponse<String>> post(String endpoint, Object jsonBody) {
        return post(RequestSpec.to(endpoint).json(jsonBody).build());
    }

    /** POSTs {@code formBody} as {@code application/x-www-form-urlencoded}. */
    public CompletableFuture<HttpResponse<String>> postForm(String endpoint, Map<String, ?> formBody) {
        return post(RequestSpec.to(endpoint).form(formBody).build());
    }

    public CompletableFuture<HttpResponse<String>> post(RequestSpec spec) {
        return request(HttpMethod.POST, spec);
    }

    /**
     * Sends one request, retrying when backoff is enabled. Never throws; every failure is
     * delivered through the returned future.
     */
    public CompletableFuture<HttpResponse<String>> request(HttpMethod method, RequestSpec spec) {
        HttpRequest request;
        try {
            request = requests.build(method, spec, config.headers());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<HttpResponse<String>> outcome;
        if (config.enableBackoff()) {
            Retry retry = RetryPolicy.forCall(method + " " + request.uri().getPath(), spec.retry());
            outcome = retry.executeCompletionStage(scheduler, () -> exchange(method, request, attempts))
                    .toCompletableFuture();
        } else {
            outcome = exchange(method, request, attempts);
        }

        CompletableFuture<HttpResponse<String>> result = new CompletableFuture<>();
        outcome.whenComplete((response, error) -> {
            if (error == null) {
                result.complete(response);
                return;
            }
            Throwable failure = unwrap(error);
            Exchanges.reportFailure(failures, failure, attempts.get());
            result.completeExceptionally(failure);
        });
        return result;
    }

    private CompletableFuture<HttpResponse<String>> exchange(
            HttpMethod method, HttpRequest request, AtomicInteger attempts) {
        int attempt = attempts.incrementAndGet();
        LOG.debug("Sending {} {} (attempt {})", method, request.uri(), attempt);
        CompletableFuture<HttpResponse<String>> result = new CompletableFuture<>();
        CompletableFuture<HttpResponse<String>> sent;
        try {
            sent = client.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return result;
        }
        sent.whenComplete((response, error) -> {
            if (error != null) {
                result.completeExceptionally(ErrorClassifier.classify(error, method, request.uri()));
                return;
            }
            LOG.debug("Received {} for {} {}", response.statusCode(), method, request.uri());
            try {
                result.complete(Exchanges.requireSuccess(response));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
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

    /**
     * Releases the client and scheduler threads without blocking the caller. Idempotent; every
     * call returns the same future.
     */
    public CompletableFuture<Void> closeAsync() {
        if (closed.compareAndSet(false, true)) {
            Thread closer = HttpClients.daemonThreads("apiary-close").newThread(this::shutdown);
            closer.start();
        }
        return closeFuture;
    }

    private void shutdown() {
        scheduler.shutdown();
        executor.shutdown();
        try {
            if (!scheduler.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            if (!executor.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("HTTP client threads still busy {}s after close", CLOSE_TIMEOUT_SECONDS);
            }
            LOG.debug("AsyncBroker closed: baseUrl={}", requests.baseUrl());
            closeFuture.complete(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeFuture.completeExceptionally(e);
        }
    }

    /** Blocks until {@link #closeAsync()} completes. */
    @Override
    public void close() {
        closeAsync().join();
    }
}
