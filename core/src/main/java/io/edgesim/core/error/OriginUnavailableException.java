package io.edgesim.core.error;

/**
 * Thrown when the origin cannot be reached, times out, or answers with
 * something that cannot be read as an HTTP response.
 */
public final class OriginUnavailableException extends EdgeRequestException {

    private static final long serialVersionUID = 1L;

    public OriginUnavailableException(String message, Throwable cause) {
        super(message, cause, "OriginUnavailable", 502);
    }
}
