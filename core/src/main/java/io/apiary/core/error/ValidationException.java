package io.apiary.core.error;

import java.util.List;

/**
 * Thrown when request parameters are rejected before any network call is made. Carries the
 * offending parameter names, sorted, when the failure is about specific names.
 */
public final class ValidationException extends ApiaryException {

    private static final long serialVersionUID = 1L;

    private final List<String> invalidNames;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> invalidNames) {
        super(message, Stage.PREPARATION);
        this.invalidNames = List.copyOf(invalidNames);
    }

    /** Offending parameter names in sorted order; empty when not name-related. */
    public List<String> invalidNames() {
        return invalidNames;
    }
}
