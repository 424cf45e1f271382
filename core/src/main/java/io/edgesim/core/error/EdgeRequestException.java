package io.edgesim.core.error;

/**
 * Abstract parent for per-request failures. Raised by the lifecycle engine and
 * handed to the router, which maps {@link #httpStatus()} onto the client
 * response. Never swallowed by the engine.
 */
public abstract class EdgeRequestException extends EdgeException {

    private static final long serialVersionUID = 1L;

    protected EdgeRequestException(String message, String code, int httpStatus) {
        super(message, code, httpStatus, Phase.REQUEST);
    }

    protected EdgeRequestException(String message, Throwable cause, String code, int httpStatus) {
        super(message, cause, code, httpStatus, Phase.REQUEST);
    }
}
