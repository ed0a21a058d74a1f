package io.apiary.core.http;

import io.apiary.core.config.BrokerConfig;
import io.apiary.core.proxy.ProxyDecision;
import io.apiary.core.proxy.ProxyInstaller;
import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Builds the JDK {@link HttpClient} a broker uses for its whole life. */
final class HttpClients {

    private HttpClients() {
        // utility class
    }

    /**
     * Creates a client: HTTP/1.1, connect timeout from the config, normal redirects, the given
     * proxy decision, then the caller's customizer.
     */
    static HttpClient create(BrokerConfig config, ProxyDecision proxy, ExecutorService executor) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.timeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .executor(executor);
        ProxyInstaller.install(builder, proxy, config.trustEnv());
        config.clientCustomizer().accept(builder);
        return builder.build();
    }

    /** A cached pool of daemon threads for the client's internal work. */
    static ExecutorService newExecutor(String prefix) {
        return Executors.newCachedThreadPool(daemonThreads(prefix));
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
