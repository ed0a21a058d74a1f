package io.apiary.examples;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback setup for the example programs: text or JSON lines on stderr, so stdout
 * carries only the API response.
 *
 * <p>
 * Reads {@code APIARY_LOG_FORMAT} ({@code text} or {@code json}) and {@code APIARY_LOG_LEVEL}
 * from the environment.
 */
public final class LogbackConfigurator {

    static final String FORMAT_VARIABLE = "APIARY_LOG_FORMAT";
    static final String LEVEL_VARIABLE = "APIARY_LOG_LEVEL";

    /** Human-readable pattern for text mode. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /** Configures the root logger from {@code environment}. */
    public static void configure(Map<String, String> environment) {
        configure(environment.getOrDefault(FORMAT_VARIABLE, "text"), environment.getOrDefault(LEVEL_VARIABLE, "INFO"));
    }

    /**
     * @param format "json" for structured output, anything else for the text pattern
     * @param level  root level; unknown names fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.toLevel(level, Level.INFO));
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("STDERR");
        appender.setTarget("System.err");

        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            appender.setEncoder(encoder);
        } else {
            PatternLayoutEncoder encoder = new PatternLayoutEncoder();
            encoder.setContext(context);
            encoder.setPattern(TEXT_PATTERN);
            encoder.start();
            appender.setEncoder(encoder);
        }

        appender.start();
        rootLogger.addAppender(appender);

        // Resilience4j is chatty below WARN
        context.getLogger("io.github.resilience4j").setLevel(Level.WARN);
    }
}
