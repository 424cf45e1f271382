package io.edgesim.core.error;

/**
 * Abstract parent for registration-time errors. Thrown while a
 * {@code BehaviorRegistry} is being built; a registry whose build fails never
 * becomes visible to requests.
 */
public abstract class EdgeLoadException extends EdgeException {

    private static final long serialVersionUID = 1L;

    private final String pattern;

    protected EdgeLoadException(String message, String code, String pattern) {
        super(message, code, 500, Phase.LOAD);
        this.pattern = pattern;
    }

    protected EdgeLoadException(String message, Throwable cause, String code, String pattern) {
        super(message, cause, code, 500, Phase.LOAD);
        this.pattern = pattern;
    }

    /** The path pattern being registered, or {@code null} if not applicable. */
    public String pattern() {
        return pattern;
    }
}
