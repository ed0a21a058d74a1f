package io.apiary.examples;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Command-line parsing shared by the example programs. */
final class ExampleArgs {

    private ExampleArgs() {
        // utility class
    }

    /**
     * Parses {@code name=value} arguments in order.
     *
     * @throws IllegalArgumentException for an argument without {@code =} or with an empty name
     */
    static Map<String, String> keyValues(List<String> args) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String arg : args) {
            int separator = arg.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("Expected name=value, got '" + arg + "'");
            }
            values.put(arg.substring(0, separator), arg.substring(separator + 1));
        }
        return values;
    }
}
