package io.apiary.connectors;

import io.apiary.core.config.EnvConfig;
import io.apiary.core.error.ConfigurationException;
import io.apiary.core.error.ValidationException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Argument checks shared by the API connectors. */
public final class ConnectorSupport {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectorSupport.class);

    private ConnectorSupport() {
        // utility class
    }

    /**
     * Returns {@code explicit} when it is non-blank, else the value of {@code variable} in
     * {@code env}.
     *
     * @throws ConfigurationException with {@code message} when neither source has a key
     */
    public static String requireApiKey(String explicit, EnvConfig env, String variable, String message) {
        if (explicit != null && !explicit.isBlank()) {
            LOG.debug("Using explicit API key (ignoring {})", variable);
            return explicit;
        }
        String key = env.get(variable).orElseThrow(() -> new ConfigurationException(message));
        LOG.debug("Using API key from {}", variable);
        return key;
    }

    /**
     * @throws ValidationException if {@code query} is {@code null} or blank
     */
    public static String requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("A non-blank query is required");
        }
        return query;
    }

    /**
     * Percent-encodes a non-blank {@code query} as a single URL path segment. Colons stay
     * literal so IPv6 addresses read naturally; dot-only segments are encoded so they cannot
     * climb the path.
     *
     * @throws ValidationException if {@code query} is {@code null} or blank
     */
    public static String pathSegment(String query) {
        String encoded = URLEncoder.encode(requireQuery(query), StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%3A", ":");
        if (encoded.equals(".") || encoded.equals("..")) {
            return encoded.replace(".", "%2E");
        }
        return encoded;
    }
}
