package io.apiary.connectors.ipqs;

import io.apiary.connectors.ConnectorSupport;
import java.util.LinkedHashMap;
import java.util.Map;

/** IPQualityScore API constants, shared by the sync and async connectors. */
public final class Ipqs {

    public static final String BASE_URL = "https://ipqualityscore.com/api/json";

    /** {@code EnvConfig} key consulted when no API key is passed explicitly. */
    public static final String API_KEY_VARIABLE = "IPQS_API_KEY";

    static final String CONTENT_TYPE = "Content-Type";
    static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

    static final String MALICIOUS_URL_PATH = "/url/";

    private Ipqs() {
        // utility class
    }

    /**
     * Form fields for a malicious URL scan: {@code url} and {@code key} first, then
     * {@code extra}. Extra fields named {@code url} or {@code key} win, as in a plain map merge.
     */
    static Map<String, Object> maliciousUrlForm(String query, String apiKey, Map<String, ?> extra) {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("url", ConnectorSupport.requireQuery(query));
        form.put("key", apiKey);
        if (extra != null) {
            form.putAll(extra);
        }
        return form;
    }
}
