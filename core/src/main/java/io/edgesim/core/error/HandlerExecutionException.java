package io.edgesim.core.error;

import io.edgesim.core.model.EventType;

/** Thrown when a stage handler itself fails, synchronously or asynchronously. */
public final class HandlerExecutionException extends EdgeRequestException {

    private static final long serialVersionUID = 1L;

    private final EventType stage;

    public HandlerExecutionException(EventType stage, Throwable cause) {
        super(stage.wireName() + " handler failed: " + cause.getMessage(), cause, "HandlerExecutionError", 500);
        this.stage = stage;
    }

    /** The stage whose handler raised the error. */
    public EventType stage() {
        return stage;
    }
}
