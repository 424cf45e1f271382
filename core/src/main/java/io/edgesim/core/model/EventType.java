package io.edgesim.core.model;

import java.util.Locale;

/** The four handler stages of an edge lifecycle, in execution order. */
public enum EventType {
    VIEWER_REQUEST("viewer-request", true),
    ORIGIN_REQUEST("origin-request", true),
    ORIGIN_RESPONSE("origin-response", false),
    VIEWER_RESPONSE("viewer-response", false);

    private final String wireName;
    private final boolean requestPhase;

    EventType(String wireName, boolean requestPhase) {
        this.wireName = wireName;
        this.requestPhase = requestPhase;
    }

    /** The name used in configuration and in handler events, e.g. {@code viewer-request}. */
    public String wireName() {
        return wireName;
    }

    /** True for the stages that run before the origin fetch. */
    public boolean isRequestPhase() {
        return requestPhase;
    }

    /**
     * Parses a wire name (case-insensitive; underscores accepted in place of dashes).
     *
     * @throws IllegalArgumentException if the name is not one of the four stages
     */
    public static EventType fromWireName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (EventType type : values()) {
                if (type.wireName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown event type: '" + name
                + "' (expected viewer-request, origin-request, origin-response or viewer-response)");
    }
}
