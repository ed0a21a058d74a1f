package io.apiary.core.error;

import java.net.URI;

/**
 * Thrown when the exchange with the upstream API fails below the HTTP status level.
 *
 * <p>
 * The {@link Kind} tells callers (and the default retry predicate) what went wrong:
 * <ul>
 * <li>{@link Kind#CONNECT} - connection refused, unresolved host, TLS handshake failure
 * <li>{@link Kind#READ_TIMEOUT} - no response within the configured timeout
 * <li>{@link Kind#WRITE} - the request could not be written (broken pipe)
 * <li>{@link Kind#PROTOCOL} - the upstream sent a malformed or truncated response
 * <li>{@link Kind#POOL_TIMEOUT} - no pooled connection became available in time
 * <li>{@link Kind#NETWORK} - any other I/O failure
 * </ul>
 */
public final class TransportException extends ApiaryException {

    private static final long serialVersionUID = 1L;

    /** Failure category. */
    public enum Kind {
        CONNECT,
        READ_TIMEOUT,
        WRITE,
        PROTOCOL,
        POOL_TIMEOUT,
        NETWORK
    }

    private final Kind kind;
    private final String method;
    private final URI uri;

    public TransportException(Kind kind, String method, URI uri, Throwable cause) {
        super(kind + " failure on " + method + " " + uri + ": " + cause.getMessage(), cause, Stage.EXCHANGE);
        this.kind = kind;
        this.method = method;
        this.uri = uri;
    }

    public Kind kind() {
        return kind;
    }

    /** HTTP method of the failed request. */
    public String method() {
        return method;
    }

    /** Absolute URI of the failed request. */
    public URI uri() {
        return uri;
    }
}
