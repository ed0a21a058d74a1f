package io.apiary.core.http;

import io.apiary.core.error.TransportException;
import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.ProtocolException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import javax.net.ssl.SSLException;

/** Maps JDK client failures onto {@link TransportException.Kind}. */
final class ErrorClassifier {

    private ErrorClassifier() {
        // utility class
    }

    /**
     * Wraps {@code error} in a {@link TransportException} when it is an I/O failure. Anything
     * else is returned unwrapped from future wrappers so callers see the original exception.
     */
    static Throwable classify(Throwable error, HttpMethod method, URI uri) {
        Throwable actual = unwrap(error);
        if (actual instanceof TransportException) {
            return actual;
        }
        TransportException.Kind kind = kindOf(actual);
        if (kind == null) {
            return actual;
        }
        return new TransportException(kind, method.name(), uri, actual);
    }

    static TransportException transport(IOException error, HttpMethod method, URI uri) {
        return new TransportException(kindOf(error), method.name(), uri, error);
    }

    /** Returns the failure kind, or {@code null} when {@code error} is not an I/O failure. */
    static TransportException.Kind kindOf(Throwable error) {
        // HttpConnectTimeoutException extends HttpTimeoutException, so it is checked first
        if (error instanceof HttpConnectTimeoutException
                || error instanceof ConnectException
                || error instanceof UnknownHostException
                || error instanceof NoRouteToHostException
                || error instanceof UnresolvedAddressException
                || error instanceof SSLException) {
            return TransportException.Kind.CONNECT;
        }
        if (error instanceof HttpTimeoutException) {
            return TransportException.Kind.READ_TIMEOUT;
        }
        if (error instanceof EOFException || error instanceof ProtocolException) {
            return TransportException.Kind.PROTOCOL;
        }
        if (error instanceof IOException) {
            String message = error.getMessage();
            if (message != null && message.contains("Broken pipe")) {
                return TransportException.Kind.WRITE;
            }
            if (error.getCause() != null && error.getCause() != error) {
                TransportException.Kind causeKind = kindOf(error.getCause());
                if (causeKind != null) {
                    return causeKind;
                }
            }
            return TransportException.Kind.NETWORK;
        }
        return null;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
