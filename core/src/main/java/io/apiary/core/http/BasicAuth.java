package io.apiary.core.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * HTTP basic credentials for a single request.
 *
 * @param username user name
 * @param password password
 */
public record BasicAuth(String username, String password) {

    public BasicAuth {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
    }

    /** The {@code Authorization} header value. */
    String headerValue() {
        String token = Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        return "Basic " + token;
    }

    @Override
    public String toString() {
        return "BasicAuth[username=" + username + ", password=***]";
    }
}
