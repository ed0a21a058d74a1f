package io.apiary.core.proxy;

import io.apiary.core.config.BrokerConfig;
import io.apiary.core.config.EnvConfig;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses the {@link ProxyDecision} for a broker. Pure: all inputs are passed in, nothing is
 * read from the process.
 */
public final class ProxyResolver {

    static final String ALL_PROXY = "ALL_PROXY";
    static final String HTTP_PROXY = "HTTP_PROXY";
    static final String HTTPS_PROXY = "HTTPS_PROXY";

    /** Mount key for plain-HTTP traffic. */
    public static final String HTTP_MOUNT = "http://";

    /** Mount key for HTTPS traffic. */
    public static final String HTTPS_MOUNT = "https://";

    private ProxyResolver() {
        // utility class
    }

    /**
     * Derives the proxy from configuration and environment variables.
     *
     * <p>
     * A non-empty {@code env} is the only source consulted, even when {@code trustEnv} is set.
     * Otherwise {@code processEnv} is read if {@code trustEnv} allows it. Differing HTTP and
     * HTTPS proxies give a {@link ProxyDecision.SplitProxy}; anything else collapses to a
     * single proxy with precedence {@code ALL_PROXY}, {@code HTTPS_PROXY}, {@code HTTP_PROXY}.
     *
     * @param env        merged configuration from {@code EnvConfigResolver}
     * @param trustEnv   whether the raw process environment may be consulted
     * @param processEnv the raw process environment
     */
    public static ProxyDecision resolve(EnvConfig env, boolean trustEnv, Map<String, String> processEnv) {
        EnvConfig source;
        if (!env.isEmpty()) {
            source = env;
        } else if (trustEnv) {
            source = new EnvConfig(processEnv);
        } else {
            return ProxyDecision.none();
        }

        Optional<String> allProxy = source.getEitherCase(ALL_PROXY);
        Optional<String> httpProxy = source.getEitherCase(HTTP_PROXY);
        Optional<String> httpsProxy = source.getEitherCase(HTTPS_PROXY);

        if (httpProxy.isPresent() && httpsProxy.isPresent() && !httpProxy.get().equals(httpsProxy.get())) {
            return new ProxyDecision.SplitProxy(httpProxy.get(), httpsProxy.get());
        }

        return allProxy.or(() -> httpsProxy)
                .or(() -> httpProxy)
                .<ProxyDecision>map(ProxyDecision.SingleProxy::new)
                .orElse(ProxyDecision.none());
    }

    /**
     * Applies caller precedence: explicit mounts, then an explicit proxy, then
     * {@link #resolve(EnvConfig, boolean, Map)}.
     */
    public static ProxyDecision select(BrokerConfig config, EnvConfig env, Map<String, String> processEnv) {
        if (config.mounts() != null) {
            return new ProxyDecision.SplitProxy(config.mounts().get(HTTP_MOUNT), config.mounts().get(HTTPS_MOUNT));
        }
        if (config.proxy() != null && !config.proxy().isBlank()) {
            return new ProxyDecision.SingleProxy(config.proxy());
        }
        return resolve(env, config.trustEnv(), processEnv);
    }
}
