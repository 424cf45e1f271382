package io.edgesim.core.error;

/** Thrown by the router when no registry is installed to resolve a behavior from. */
public final class NoBehaviorMatchedException extends EdgeRequestException {

    private static final long serialVersionUID = 1L;

    public NoBehaviorMatchedException(String message) {
        super(message, "NoBehaviorMatched", 404);
    }
}
