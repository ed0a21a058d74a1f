package io.apiary.core.error;

/**
 * Abstract base for all apiary exceptions. Never thrown directly: use one of
 * {@link ConfigurationException}, {@link ValidationException}, {@link TransportException} or
 * {@link HttpStatusException}.
 */
public abstract class ApiaryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Stage at which the error was raised. */
    public enum Stage {
        /** Client or connector construction. */
        CONSTRUCTION,
        /** Request preparation, before any network I/O. */
        PREPARATION,
        /** Network exchange with the upstream API. */
        EXCHANGE
    }

    private final Stage stage;

    protected ApiaryException(String message, Stage stage) {
        super(message);
        this.stage = stage;
    }

    protected ApiaryException(String message, Throwable cause, Stage stage) {
        super(message, cause);
        this.stage = stage;
    }

    /** The stage at which the error was raised. */
    public Stage stage() {
        return stage;
    }

    /** Whether the error came from the network exchange rather than local checks. */
    public boolean isExchangeFailure() {
        return stage == Stage.EXCHANGE;
    }
}
