package io.edgesim.core.model;

import java.util.Objects;

/**
 * The event passed to a stage handler.
 *
 * @param config   stage and distribution metadata
 * @param request  the current request
 * @param response the current response; {@code null} in the request-phase stages
 */
public record EdgeEvent(EventConfig config, RequestEvent request, ResponseArtifact response) {

    public EdgeEvent {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(request, "request must not be null");
    }

    /** The stage this event is delivered to. */
    public EventType eventType() {
        return config.eventType();
    }
}
