package io.apiary.core.log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opt-in INFO logging of public connector calls, written under the owning class's logger.
 *
 * <p>
 * Line formats:
 * <ul>
 * <li>{@code parsedWhois called with query: example.com}
 * <li>{@code irisInvestigate called with params_keys=[domain, ip]}
 * <li>{@code close called}
 * </ul>
 * Map arguments are reduced to their sorted key names so parameter values never reach the log.
 */
public final class CallLogger {

    private final Logger logger;
    private final boolean enabled;

    public CallLogger(Class<?> owner, boolean enabled) {
        this(LoggerFactory.getLogger(owner), enabled);
    }

    CallLogger(Logger logger, boolean enabled) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.enabled = enabled;
    }

    /** A logger that never writes. */
    public static CallLogger disabled(Class<?> owner) {
        return new CallLogger(owner, false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Writes {@code message} at INFO when enabled. */
    public void log(String message) {
        if (enabled) {
            logger.info(message);
        }
    }

    /** Logs a call whose main argument is a query string. */
    public void query(String method, String query) {
        if (query == null) {
            call(method, Map.of());
            return;
        }
        log(method + " called with query: " + query);
    }

    /**
     * Logs a call by summarizing its named arguments, in the iteration order of
     * {@code arguments}.
     */
    public void call(String method, Map<String, ?> arguments) {
        if (!enabled) {
            return;
        }
        if (arguments == null || arguments.isEmpty()) {
            log(method + " called");
            return;
        }
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, ?> argument : arguments.entrySet()) {
            parts.add(describe(argument.getKey(), argument.getValue()));
        }
        log(method + " called with " + String.join(", ", parts));
    }

    static String describe(String name, Object value) {
        if (value instanceof Map<?, ?> map) {
            List<String> keys = new ArrayList<>();
            for (Object key : map.keySet()) {
                keys.add(String.valueOf(key));
            }
            Collections.sort(keys);
            return name + "_keys=" + keys;
        }
        if (value instanceof CharSequence text) {
            return name + "='" + text + "'";
        }
        return name + "=" + value;
    }
}
