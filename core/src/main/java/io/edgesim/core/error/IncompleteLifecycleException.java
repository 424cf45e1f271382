package io.edgesim.core.error;

/** Thrown when the lifecycle finishes without any response having been produced. */
public final class IncompleteLifecycleException extends EdgeRequestException {

    private static final long serialVersionUID = 1L;

    public IncompleteLifecycleException(String message) {
        super(message, "IncompleteLifecycle", 500);
    }
}
