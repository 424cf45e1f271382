package io.edgesim.core.error;

/** Thrown when a behavior path pattern cannot be compiled. Fatal at startup. */
public final class InvalidPatternException extends EdgeLoadException {

    private static final long serialVersionUID = 1L;

    public InvalidPatternException(String message, String pattern) {
        super(message, "InvalidPattern", pattern);
    }
}
