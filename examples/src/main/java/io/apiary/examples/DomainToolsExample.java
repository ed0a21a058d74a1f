package io.apiary.examples;

import io.apiary.connectors.domaintools.DomainToolsConnector;
import io.apiary.core.config.BrokerConfig;
import java.net.http.HttpResponse;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls one DomainTools endpoint and prints the response body.
 *
 * <pre>
 * DomainToolsExample whois example.com
 * DomainToolsExample reverse-ip example.com
 * DomainToolsExample reverse-ns ns1.example.com
 * DomainToolsExample iris domain=example.com risk_score=70
 * </pre>
 *
 * The API key comes from {@code DOMAINTOOLS_API_KEY} in the environment or {@code apiary.yaml}.
 */
public final class DomainToolsExample {

    private static final Logger LOG = LoggerFactory.getLogger(DomainToolsExample.class);

    private DomainToolsExample() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        LogbackConfigurator.configure(System.getenv());
        if (args.length < 2) {
            LOG.error("Usage: DomainToolsExample whois|reverse-ip|reverse-ns <query> | iris name=value...");
            System.exit(2);
        }
        BrokerConfig config = BrokerConfig.builder()
                .enableBackoff(true)
                .enableLogging(true)
                .loadEnvVars(true)
                .build();
        try (DomainToolsConnector connector = new DomainToolsConnector(null, config)) {
            HttpResponse<String> response = call(connector, args[0], Arrays.asList(args).subList(1, args.length));
            System.out.println(response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Interrupted");
            System.exit(1);
        } catch (Exception e) {
            LOG.error("Request failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static HttpResponse<String> call(DomainToolsConnector connector, String command, List<String> rest)
            throws InterruptedException {
        switch (command) {
            case "whois":
                return connector.parsedWhois(rest.get(0));
            case "reverse-ip":
                return connector.reverseIp(rest.get(0));
            case "reverse-ns":
                return connector.reverseNameserver(rest.get(0));
            case "iris":
                return connector.irisInvestigate(ExampleArgs.keyValues(rest));
            default:
                throw new IllegalArgumentException("Unknown command '" + command + "'");
        }
    }
}
