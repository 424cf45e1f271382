package io.edgesim.core.error;

/**
 * Abstract base for all edge-sim exceptions. Never thrown directly; use the
 * concrete subclasses under {@link EdgeLoadException} or {@link EdgeRequestException}.
 *
 * <p>
 * Every exception carries a taxonomy {@link #code()} (e.g. {@code NoOriginConfigured})
 * and the HTTP status the router answers with when the failure reaches a client.
 */
public abstract class EdgeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        REQUEST
    }

    private final String code;
    private final int httpStatus;
    private final Phase phase;

    protected EdgeException(String message, String code, int httpStatus, Phase phase) {
        super(message);
        this.code = code;
        this.httpStatus = httpStatus;
        this.phase = phase;
    }

    protected EdgeException(String message, Throwable cause, String code, int httpStatus, Phase phase) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
        this.phase = phase;
    }

    /** Taxonomy tag, stable across releases. */
    public String code() {
        return code;
    }

    /** HTTP status to surface to the client. */
    public int httpStatus() {
        return httpStatus;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
