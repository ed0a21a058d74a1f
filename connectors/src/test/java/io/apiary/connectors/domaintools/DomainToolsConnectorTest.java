package io.apiary.connectors.domaintools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.apiary.connectors.StubApi;
import io.apiary.core.config.BrokerConfig;
import io.apiary.core.config.EnvConfig;
import io.apiary.core.error.ConfigurationException;
import io.apiary.core.error.ValidationException;
import io.apiary.core.http.Broker;
import io.apiary.core.log.CallLogger;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

@DisplayName("DomainToolsConnector")
class DomainToolsConnectorTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("No key and environment loading off → ConfigurationException")
        void missingKey() {
            BrokerConfig config = BrokerConfig.builder().loadEnvVars(false).build();

            assertThatThrownBy(() -> new DomainToolsConnector(null, config))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("API key is required for DomainTools");
        }

        @Test
        @DisplayName("Key from EnvConfig is sent as X-API-KEY against the default host")
        void keyFromEnvironment() {
            EnvConfig env = new EnvConfig(Map.of("DOMAINTOOLS_API_KEY", "env-key"));

            try (DomainToolsConnector connector = new DomainToolsConnector(null, BrokerConfig.builder().build(), env)) {
                assertThat(connector.broker().config().headers()).containsEntry("X-API-KEY", "env-key");
                assertThat(connector.broker().baseUrl()).isEqualTo("https://api.domaintools.com");
            }
        }

        @Test
        @DisplayName("Explicit key wins and caller headers are kept")
        void explicitKey() {
            BrokerConfig config = BrokerConfig.builder().header("Accept", "application/json").build();
            EnvConfig env = new EnvConfig(Map.of("DOMAINTOOLS_API_KEY", "env-key"));

            try (DomainToolsConnector connector = new DomainToolsConnector("explicit", config, env)) {
                assertThat(connector.broker().config().headers())
                        .containsEntry("X-API-KEY", "explicit")
                        .containsEntry("Accept", "application/json");
            }
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Endpoint mapping")
    class EndpointMapping {

        @Mock
        Broker broker;

        @Mock
        HttpResponse<String> response;

        private DomainToolsConnector connector() {
            return new DomainToolsConnector(broker, CallLogger.disabled(DomainToolsConnector.class));
        }

        @Test
        @DisplayName("parsedWhois → GET v1/{query}/whois/parsed")
        void parsedWhois() throws Exception {
            when(broker.get(anyString(), anyMap())).thenReturn(response);

            assertThat(connector().parsedWhois("example.com")).isSameAs(response);
            verify(broker).get("v1/example.com/whois/parsed", Map.of());
        }

        @Test
        @DisplayName("reverseIp forwards extra params")
        void reverseIp() throws Exception {
            when(broker.get(anyString(), anyMap())).thenReturn(response);

            connector().reverseIp("example.com", Map.of("limit", 10));

            verify(broker).get("v1/example.com/reverse-ip", Map.of("limit", 10));
        }

        @Test
        @DisplayName("reverseNameserver → GET v1/{query}/name-server-domains")
        void reverseNameserver() throws Exception {
            when(broker.get(anyString(), anyMap())).thenReturn(response);

            connector().reverseNameserver("ns1.example.com");

            verify(broker).get("v1/ns1.example.com/name-server-domains", Map.of());
        }

        @Test
        @DisplayName("irisInvestigate forwards allow-listed params verbatim")
        void irisInvestigate() throws Exception {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("domain", "example.com");
            params.put("risk_score", 70);
            when(broker.get(anyString(), any())).thenReturn(response);

            connector().irisInvestigate(params);

            verify(broker).get("/v1/iris-investigate", params);
        }

        @Test
        @DisplayName("irisInvestigate with unknown params fails before any request")
        void irisInvestigateInvalid() {
            assertThatThrownBy(() -> connector().irisInvestigate(Map.of("bogus", 1)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Invalid Iris Investigate parameters: [bogus]");
            verifyNoInteractions(broker);
        }

        @Test
        @DisplayName("Blank query fails before any request")
        void blankQuery() {
            assertThatThrownBy(() -> connector().parsedWhois(" ")).isInstanceOf(ValidationException.class);
            verifyNoInteractions(broker);
        }
    }

    @Nested
    @DisplayName("Against a stub API")
    class EndToEnd {

        @Test
        @DisplayName("parsedWhois issues GET {base}/v1/example.com/whois/parsed with the key header")
        void parsedWhois() throws Exception {
            try (StubApi api = StubApi.start();
                    DomainToolsConnector connector = new DomainToolsConnector(
                            "test-key", BrokerConfig.builder().baseUrl(api.baseUrl()).trustEnv(false).build())) {
                HttpResponse<String> response = connector.parsedWhois("example.com");

                assertThat(response.statusCode()).isEqualTo(200);
                StubApi.Seen seen = api.lastRequest();
                assertThat(seen.method()).isEqualTo("GET");
                assertThat(seen.path()).isEqualTo("/v1/example.com/whois/parsed");
                assertThat(seen.apiKeyHeader()).isEqualTo("test-key");
            }
        }

        @Test
        @DisplayName("Reserved characters in the query stay inside one path segment")
        void queryIsEncodedAsOneSegment() throws Exception {
            try (StubApi api = StubApi.start();
                    DomainToolsConnector connector = new DomainToolsConnector(
                            "test-key", BrokerConfig.builder().baseUrl(api.baseUrl()).trustEnv(false).build())) {
                connector.parsedWhois("example.com#frag");
                assertThat(api.lastRequest().path()).isEqualTo("/v1/example.com%23frag/whois/parsed");

                connector.reverseIp("evil.com/../../v1/other?x=1");
                assertThat(api.lastRequest().path())
                        .isEqualTo("/v1/evil.com%2F..%2F..%2Fv1%2Fother%3Fx%3D1/reverse-ip");
                assertThat(api.lastRequest().query()).isNull();

                connector.reverseNameserver("exa mple.com");
                assertThat(api.lastRequest().path()).isEqualTo("/v1/exa%20mple.com/name-server-domains");
            }
        }

        @Test
        @DisplayName("irisInvestigate encodes params into the query string")
        void irisInvestigate() throws Exception {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("domain", "example.com");
            params.put("ssl_email", "a@b.c");

            try (StubApi api = StubApi.start();
                    DomainToolsConnector connector = new DomainToolsConnector(
                            "test-key", BrokerConfig.builder().baseUrl(api.baseUrl()).trustEnv(false).build())) {
                connector.irisInvestigate(params);

                assertThat(api.lastRequest().path()).isEqualTo("/v1/iris-investigate");
                assertThat(api.lastRequest().query()).isEqualTo("domain=example.com&ssl_email=a%40b.c");
            }
        }

        @Test
        @DisplayName("Call logging writes one INFO line under the connector's logger")
        void callLogging() throws Exception {
            Logger logger = (Logger) LoggerFactory.getLogger(DomainToolsConnector.class);
            ListAppender<ILoggingEvent> appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);

            try (StubApi api = StubApi.start();
                    DomainToolsConnector connector = new DomainToolsConnector("test-key", BrokerConfig.builder()
                            .baseUrl(api.baseUrl())
                            .trustEnv(false)
                            .enableLogging(true)
                            .build())) {
                connector.reverseIp("example.com");
                connector.irisInvestigate(Map.of("ip", "1.2.3.4"));
            } finally {
                logger.detachAppender(appender);
            }

            assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage).containsExactly(
                    "reverseIp called with query: example.com",
                    "irisInvestigate called with params_keys=[ip]");
        }
    }
}
