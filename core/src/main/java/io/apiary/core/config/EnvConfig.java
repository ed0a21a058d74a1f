package io.apiary.core.config;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only merge of the process environment and the optional settings file, built once per
 * connector by {@link EnvConfigResolver}.
 *
 * @param values merged key/value pairs; file values already override environment values
 */
public record EnvConfig(Map<String, String> values) {

    /** The configuration used when environment loading is disabled. */
    public static final EnvConfig EMPTY = new EnvConfig(Map.of());

    public EnvConfig {
        values = Map.copyOf(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Exact-key lookup. A blank value counts as absent. */
    public Optional<String> get(String key) {
        String value = values.get(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Looks up {@code key} as written, then its lowercase form, so both {@code HTTP_PROXY} and
     * {@code http_proxy} are honoured.
     */
    public Optional<String> getEitherCase(String key) {
        Optional<String> literal = get(key);
        return literal.isPresent() ? literal : get(key.toLowerCase(Locale.ROOT));
    }
}
