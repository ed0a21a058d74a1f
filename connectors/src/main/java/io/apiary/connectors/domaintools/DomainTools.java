package io.apiary.connectors.domaintools;

import io.apiary.connectors.ConnectorSupport;

/** DomainTools API constants and endpoint paths, shared by the sync and async connectors. */
public final class DomainTools {

    public static final String BASE_URL = "https://api.domaintools.com";

    /** Header carrying the API key on every request. */
    public static final String API_KEY_HEADER = "X-API-KEY";

    /** {@code EnvConfig} key consulted when no API key is passed explicitly. */
    public static final String API_KEY_VARIABLE = "DOMAINTOOLS_API_KEY";

    static final String MISSING_KEY_MESSAGE = "API key is required for DomainTools";

    static final String IRIS_INVESTIGATE_PATH = "/v1/iris-investigate";

    private DomainTools() {
        // utility class
    }

    static String parsedWhoisPath(String query) {
        return "v1/" + ConnectorSupport.pathSegment(query) + "/whois/parsed";
    }

    static String reverseIpPath(String query) {
        return "v1/" + ConnectorSupport.pathSegment(query) + "/reverse-ip";
    }

    static String reverseNameserverPath(String query) {
        return "v1/" + ConnectorSupport.pathSegment(query) + "/name-server-domains";
    }
}
