package io.apiary.core.log;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("CallLogger")
class CallLoggerTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(CallLoggerTest.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logAppender.stop();
    }

    private List<String> messages() {
        return logAppender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
    }

    @Test
    @DisplayName("Query calls → '<method> called with query: <query>' at INFO")
    void queryLine() {
        new CallLogger(CallLoggerTest.class, true).query("parsedWhois", "example.com");

        assertThat(messages()).containsExactly("parsedWhois called with query: example.com");
        assertThat(logAppender.list.get(0).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    @DisplayName("Map arguments are reduced to sorted key names")
    void mapArguments() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("ip", "1.2.3.4");
        params.put("domain", "example.com");

        new CallLogger(CallLoggerTest.class, true).call("irisInvestigate", Map.of("params", params));

        assertThat(messages()).containsExactly("irisInvestigate called with params_keys=[domain, ip]");
    }

    @Test
    @DisplayName("Scalars render as name=value, strings quoted")
    void scalars() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("name", "widget");
        arguments.put("limit", 5);

        new CallLogger(CallLoggerTest.class, true).call("search", arguments);

        assertThat(messages()).containsExactly("search called with name='widget', limit=5");
    }

    @Test
    @DisplayName("No arguments → '<method> called'")
    void noArguments() {
        CallLogger calls = new CallLogger(CallLoggerTest.class, true);

        calls.call("ping", Map.of());
        calls.query("ping", null);

        assertThat(messages()).containsExactly("ping called", "ping called");
    }

    @Test
    @DisplayName("Disabled → nothing written")
    void disabled() {
        CallLogger calls = CallLogger.disabled(CallLoggerTest.class);

        calls.query("parsedWhois", "example.com");
        calls.log("HTTP error: boom");

        assertThat(calls.isEnabled()).isFalse();
        assertThat(messages()).isEmpty();
    }
}
