package io.edgesim.core.error;

/**
 * Thrown when a registration tuple is malformed: unknown event type, missing
 * handler, invalid origin URL, or a duplicate (pattern, stage) pair in strict mode.
 */
public final class InvalidRegistrationException extends EdgeLoadException {

    private static final long serialVersionUID = 1L;

    public InvalidRegistrationException(String message, String pattern) {
        super(message, "InvalidRegistration", pattern);
    }

    public InvalidRegistrationException(String message, Throwable cause, String pattern) {
        super(message, cause, "InvalidRegistration", pattern);
    }
}
