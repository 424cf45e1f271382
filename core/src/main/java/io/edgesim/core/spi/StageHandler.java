package io.edgesim.core.spi;

import io.edgesim.core.model.EdgeEvent;
import io.edgesim.core.model.HandlerResult;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A function attached to one stage of a behavior.
 *
 * <p>
 * Request-phase handlers ({@code viewer-request}, {@code origin-request}) may
 * return a {@link io.edgesim.core.model.RequestEvent} to continue or a
 * {@link io.edgesim.core.model.ResponseArtifact} to answer immediately.
 * Response-phase handlers must return a {@code ResponseArtifact}.
 *
 * <p>
 * Handlers are asynchronous: the engine awaits the returned stage before
 * advancing. Implementations loaded from configuration need a public no-arg
 * constructor.
 */
@FunctionalInterface
public interface StageHandler {

    /**
     * Handles one stage of a request.
     *
     * @param event stage metadata, the current request and (response phase only)
     *              the current response
     * @return the stage result; completing exceptionally aborts the lifecycle
     * @throws Exception any failure, treated the same as exceptional completion
     */
    CompletionStage<? extends HandlerResult> handle(EdgeEvent event) throws Exception;

    /** Blocking variant for handlers that do no I/O. */
    @FunctionalInterface
    interface Sync {
        HandlerResult apply(EdgeEvent event) throws Exception;
    }

    /** Adapts a {@link Sync} handler to the asynchronous contract. */
    static StageHandler sync(Sync handler) {
        return event -> CompletableFuture.completedFuture(handler.apply(event));
    }
}
