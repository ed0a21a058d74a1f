package io.apiary.core.proxy;

import java.util.Objects;

/**
 * The proxy setup a broker's HTTP client is built with. Exactly one variant applies and it is
 * fixed for the client's lifetime.
 */
public sealed interface ProxyDecision {

    /** Direct connections. */
    record NoProxy() implements ProxyDecision {
        static final NoProxy INSTANCE = new NoProxy();
    }

    /** One proxy for every scheme. */
    record SingleProxy(String url) implements ProxyDecision {
        public SingleProxy {
            Objects.requireNonNull(url, "url");
        }
    }

    /**
     * Scheme-specific proxies. Either side may be {@code null}, in which case traffic for that
     * scheme goes direct.
     */
    record SplitProxy(String httpProxy, String httpsProxy) implements ProxyDecision {}

    static ProxyDecision none() {
        return NoProxy.INSTANCE;
    }
}
