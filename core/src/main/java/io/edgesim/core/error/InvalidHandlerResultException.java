package io.edgesim.core.error;

import io.edgesim.core.model.EventType;

/**
 * Thrown when a stage handler returns something its stage does not accept:
 * {@code null}, an unknown result type, or a request where a response is
 * required.
 */
public final class InvalidHandlerResultException extends EdgeRequestException {

    private static final long serialVersionUID = 1L;

    private final EventType stage;

    public InvalidHandlerResultException(String message, EventType stage) {
        super(message, "InvalidHandlerResult", 500);
        this.stage = stage;
    }

    /** The stage whose handler violated its contract. */
    public EventType stage() {
        return stage;
    }
}
