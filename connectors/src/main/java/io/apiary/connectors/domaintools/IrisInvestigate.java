package io.apiary.connectors.domaintools;

import io.apiary.core.error.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Search parameters accepted by the Iris Investigate endpoint.
 *
 * @see <a href="https://docs.domaintools.com/api/iris/investigate/search/">Iris Investigate</a>
 */
public final class IrisInvestigate {

    /** Every parameter name the endpoint accepts, sorted. */
    public static final Set<String> ALLOWED_PARAMS = Collections.unmodifiableSet(new TreeSet<>(List.of(
            "active",
            "adsense",
            "baidu_analytics",
            "contact_name",
            "contact_phone",
            "contact_street",
            "create_date",
            "domain",
            "email",
            "email_dns_soa",
            "email_domain",
            "expiration_date",
            "facebook",
            "first_seen_since",
            "first_seen_within",
            "google_analytics",
            "google_analytics_4",
            "google_tag_manager",
            "historical_email",
            "historical_free_text",
            "historical_registrant",
            "hotjar",
            "iana_id",
            "ip",
            "ip_country_code",
            "mailserver_domain",
            "mailserver_host",
            "mailserver_ip",
            "matomo",
            "nameserver_domain",
            "nameserver_host",
            "nameserver_ip",
            "not_tagged_with_all",
            "not_tagged_with_any",
            "rank",
            "redirect_domain",
            "registrant",
            "registrant_org",
            "registrar",
            "risk_score",
            "search_hash",
            "server_type",
            "ssl_alt_names",
            "ssl_common_name",
            "ssl_duration",
            "ssl_email",
            "ssl_hash",
            "ssl_issuer_common_name",
            "ssl_not_after",
            "ssl_not_before",
            "ssl_org",
            "ssl_subject",
            "statcounter_project",
            "statcounter_security",
            "tagged_with_all",
            "tagged_with_any",
            "tld",
            "website_title",
            "whois",
            "yandex_metrica")));

    private IrisInvestigate() {
        // utility class
    }

    /**
     * Checks {@code params} against {@link #ALLOWED_PARAMS}.
     *
     * @throws ValidationException if {@code params} is empty, or names parameters the endpoint
     *                             does not know; the unknown names are listed sorted
     */
    public static void validate(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            throw new ValidationException("At least one Iris Investigate parameter is required.");
        }
        List<String> invalid = new ArrayList<>(new TreeSet<>(params.keySet()));
        invalid.removeAll(ALLOWED_PARAMS);
        if (!invalid.isEmpty()) {
            throw new ValidationException("Invalid Iris Investigate parameters: " + invalid, invalid);
        }
    }
}
