package io.apiary.core.error;

import java.net.http.HttpResponse;

/**
 * Thrown when the upstream API answers with a status outside 200-299. The full response is
 * kept so callers can inspect headers and body.
 */
public final class HttpStatusException extends ApiaryException {

    private static final long serialVersionUID = 1L;

    private final transient HttpResponse<String> response;

    public HttpStatusException(HttpResponse<String> response) {
        super(describe(response), Stage.EXCHANGE);
        this.response = response;
    }

    public int statusCode() {
        return response.statusCode();
    }

    /** The unmodified upstream response. */
    public HttpResponse<String> response() {
        return response;
    }

    /** {@code true} for 4xx statuses. */
    public boolean isClientError() {
        return statusCode() >= 400 && statusCode() < 500;
    }

    /** {@code true} for 5xx statuses. */
    public boolean isServerError() {
        return statusCode() >= 500 && statusCode() < 600;
    }

    private static String describe(HttpResponse<String> response) {
        int status = response.statusCode();
        String category;
        if (status >= 400 && status < 500) {
            category = "Client error";
        } else if (status >= 500 && status < 600) {
            category = "Server error";
        } else if (status >= 300 && status < 400) {
            category = "Redirect response";
        } else {
            category = "Unexpected status";
        }
        return category + " '" + status + "' for " + response.request().method() + " " + response.uri();
    }
}
