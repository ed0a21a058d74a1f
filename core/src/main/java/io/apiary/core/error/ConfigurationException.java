package io.apiary.core.error;

/**
 * Thrown when a broker or connector cannot be constructed: a missing API key, an unsupported
 * proxy combination, an unparseable proxy URL or settings file. Never retried.
 */
public final class ConfigurationException extends ApiaryException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message, Stage.CONSTRUCTION);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause, Stage.CONSTRUCTION);
    }
}
