package io.edgesim.core.error;

/**
 * Thrown when the lifecycle reaches the origin fetch on a cache miss and the
 * matched behavior has no origin to fetch from.
 */
public final class NoOriginConfiguredException extends EdgeRequestException {

    private static final long serialVersionUID = 1L;

    public NoOriginConfiguredException(String message) {
        super(message, "NoOriginConfigured", 502);
    }
}
