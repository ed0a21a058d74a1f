package io.apiary.examples;

import io.apiary.connectors.ipqs.AsyncIpqsConnector;
import io.apiary.core.config.BrokerConfig;
import java.net.http.HttpResponse;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans a URL with the async IPQS connector and prints the response body.
 *
 * <pre>
 * IpqsExample https://example.com strictness=1 fast=true
 * </pre>
 *
 * The API key comes from {@code IPQS_API_KEY} in the environment or {@code apiary.yaml}.
 */
public final class IpqsExample {

    private static final Logger LOG = LoggerFactory.getLogger(IpqsExample.class);

    private IpqsExample() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        LogbackConfigurator.configure(System.getenv());
        if (args.length < 1) {
            LOG.error("Usage: IpqsExample <url> [name=value...]");
            System.exit(2);
        }
        BrokerConfig config = BrokerConfig.builder()
                .enableBackoff(true)
                .enableLogging(true)
                .loadEnvVars(true)
                .build();
        Map<String, String> extra = ExampleArgs.keyValues(Arrays.asList(args).subList(1, args.length));
        try (AsyncIpqsConnector connector = new AsyncIpqsConnector(null, config)) {
            HttpResponse<String> response = connector.maliciousUrl(args[0], extra).join();
            System.out.println(response.body());
        } catch (CompletionException e) {
            LOG.error("Scan failed: {}", e.getCause().getMessage(), e.getCause());
            System.exit(1);
        } catch (Exception e) {
            LOG.error("Scan failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
