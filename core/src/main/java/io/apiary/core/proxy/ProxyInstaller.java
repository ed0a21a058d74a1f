package io.apiary.core.proxy;

import java.io.IOException;
import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Translates a {@link ProxyDecision} into JDK {@link HttpClient.Builder} settings. */
public final class ProxyInstaller {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyInstaller.class);

    private ProxyInstaller() {
        // utility class
    }

    /**
     * Configures {@code builder} for {@code decision}.
     *
     * <p>
     * With {@link ProxyDecision.NoProxy} the JVM default selector (driven by the
     * {@code http.proxyHost} family of system properties) is kept when {@code trustEnv} is set,
     * and every connection goes direct otherwise.
     *
     * @throws io.apiary.core.error.ConfigurationException if a proxy URL cannot be parsed
     */
    public static void install(HttpClient.Builder builder, ProxyDecision decision, boolean trustEnv) {
        if (decision instanceof ProxyDecision.SingleProxy single) {
            ProxyEndpoint endpoint = ProxyEndpoint.parse(single.url());
            builder.proxy(ProxySelector.of(endpoint.address()));
            installCredentials(builder, Map.of(endpoint.address(), endpoint));
            LOG.debug("Proxying all traffic through {}:{}", endpoint.host(), endpoint.port());
        } else if (decision instanceof ProxyDecision.SplitProxy split) {
            ProxyEndpoint http = split.httpProxy() == null ? null : ProxyEndpoint.parse(split.httpProxy());
            ProxyEndpoint https = split.httpsProxy() == null ? null : ProxyEndpoint.parse(split.httpsProxy());
            builder.proxy(new SchemeProxySelector(http, https));

            Map<InetSocketAddress, ProxyEndpoint> endpoints = new HashMap<>();
            if (http != null) {
                endpoints.put(http.address(), http);
            }
            if (https != null) {
                endpoints.put(https.address(), https);
            }
            installCredentials(builder, endpoints);
            LOG.debug("Proxying per scheme: http={}, https={}", describe(http), describe(https));
        } else if (!trustEnv) {
            builder.proxy(HttpClient.Builder.NO_PROXY);
        } else if (ProxySelector.getDefault() != null) {
            builder.proxy(ProxySelector.getDefault());
        }
    }

    private static void installCredentials(HttpClient.Builder builder, Map<InetSocketAddress, ProxyEndpoint> endpoints) {
        boolean anyCredentials =
                endpoints.values().stream().anyMatch(e -> e.credentials().isPresent());
        if (anyCredentials) {
            builder.authenticator(new ProxyAuthenticator(endpoints));
        }
    }

    private static String describe(ProxyEndpoint endpoint) {
        return endpoint == null ? "direct" : endpoint.host() + ":" + endpoint.port();
    }

    /** Routes by request scheme; a scheme without a proxy goes direct. */
    static final class SchemeProxySelector extends ProxySelector {

        private final ProxyEndpoint http;
        private final ProxyEndpoint https;

        SchemeProxySelector(ProxyEndpoint http, ProxyEndpoint https) {
            this.http = http;
            this.https = https;
        }

        @Override
        public List<Proxy> select(URI uri) {
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            ProxyEndpoint endpoint = "https".equals(scheme) ? https : "http".equals(scheme) ? http : null;
            if (endpoint == null) {
                return List.of(Proxy.NO_PROXY);
            }
            return List.of(new Proxy(Proxy.Type.HTTP, endpoint.address()));
        }

        @Override
        public void connectFailed(URI uri, SocketAddress sa, IOException ioe) {
            LOG.debug("Proxy {} failed for {}: {}", sa, uri, ioe.getMessage());
        }
    }

    /** Answers proxy authentication challenges with the user-info of the matching proxy URL. */
    private static final class ProxyAuthenticator extends Authenticator {

        private final Map<InetSocketAddress, ProxyEndpoint> endpoints;

        ProxyAuthenticator(Map<InetSocketAddress, ProxyEndpoint> endpoints) {
            this.endpoints = Map.copyOf(endpoints);
        }

        @Override
        protected PasswordAuthentication getPasswordAuthentication() {
            if (getRequestorType() != RequestorType.PROXY) {
                return null;
            }
            for (ProxyEndpoint endpoint : endpoints.values()) {
                if (endpoint.host().equalsIgnoreCase(getRequestingHost()) && endpoint.port() == getRequestingPort()) {
                    return endpoint.credentials().orElse(null);
                }
            }
            return null;
        }
    }
}
