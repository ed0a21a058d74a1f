package io.apiary.core.http;

import io.apiary.core.error.HttpStatusException;
import io.apiary.core.log.CallLogger;
import java.net.http.HttpResponse;

/** Response checks and failure logging shared by {@link Broker} and {@link AsyncBroker}. */
final class Exchanges {

    private Exchanges() {
        // utility class
    }

    /**
     * Returns {@code response} when its status is 2xx.
     *
     * @throws HttpStatusException for any other status
     */
    static HttpResponse<String> requireSuccess(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new HttpStatusException(response);
        }
        return response;
    }

    /**
     * Logs a failed call before it propagates.
     *
     * @param attempts number of attempts made, more than one when the call was retried
     */
    static void reportFailure(CallLogger log, Throwable failure, int attempts) {
        if (attempts > 1) {
            log.log("Retry failed: " + failure.getMessage());
        }
        if (failure instanceof HttpStatusException) {
            log.log("HTTP error: " + failure.getMessage());
        }
    }
}
