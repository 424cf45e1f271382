package io.edgesim.core.engine;

/** States of one request's lifecycle, in order. {@link #DONE} is terminal. */
public enum LifecycleState {
    VIEWER_REQUEST,
    ORIGIN_REQUEST,
    FETCH_ORIGIN,
    ORIGIN_RESPONSE,
    VIEWER_RESPONSE,
    DONE
}
