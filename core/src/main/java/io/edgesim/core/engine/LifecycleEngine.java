package io.edgesim.core.engine;

import io.edgesim.core.cache.CacheFingerprint;
import io.edgesim.core.cache.ResponseCache;
import io.edgesim.core.error.HandlerExecutionException;
import io.edgesim.core.error.IncompleteLifecycleException;
import io.edgesim.core.error.InvalidHandlerResultException;
import io.edgesim.core.error.NoOriginConfiguredException;
import io.edgesim.core.error.OriginUnavailableException;
import io.edgesim.core.model.CacheEntry;
import io.edgesim.core.model.EdgeEvent;
import io.edgesim.core.model.EventConfig;
import io.edgesim.core.model.EventType;
import io.edgesim.core.model.HandlerResult;
import io.edgesim.core.model.OriginTarget;
import io.edgesim.core.model.RequestEvent;
import io.edgesim.core.model.ResponseArtifact;
import io.edgesim.core.spi.OriginClient;
import io.edgesim.core.spi.StageHandler;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one request through the edge lifecycle:
 *
 * <pre>
 * VIEWER_REQUEST → ORIGIN_REQUEST → FETCH_ORIGIN → ORIGIN_RESPONSE → VIEWER_RESPONSE → DONE
 * </pre>
 *
 * <p>
 * Stage rules:
 * <ul>
 * <li>A stage without a handler passes the current request or response through.</li>
 * <li>A request-phase handler returning a {@link RequestEvent} replaces the
 * request; returning a {@link ResponseArtifact} jumps straight to {@code DONE}:
 * the origin is not contacted and no response-phase handler runs.</li>
 * <li>{@code FETCH_ORIGIN} serves from the {@link ResponseCache} on a hit;
 * on a miss it fetches from the behavior's origin and stores the result.</li>
 * <li>A response-phase handler must return a {@code ResponseArtifact}, which
 * replaces the current response.</li>
 * </ul>
 *
 * <p>
 * Handlers are awaited asynchronously, one suspension point per stage. Any
 * failure aborts the remaining stages; the future returned by {@link #run()}
 * completes exceptionally with the {@link io.edgesim.core.error.EdgeRequestException}.
 * Cache read and write failures are never fatal.
 *
 * <p>
 * One instance per request. The engine borrows the cache and origin client and
 * owns its copy of the request and response.
 */
public final class LifecycleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LifecycleEngine.class);

    /** How the response cache took part in a run. */
    public enum CacheStatus {
        NOT_CONSULTED,
        HIT,
        MISS
    }

    private final Behavior behavior;
    private final EventConfig eventConfig;
    private final ResponseCache cache;
    private final CacheFingerprint fingerprint;
    private final OriginClient originClient;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile LifecycleState state = LifecycleState.VIEWER_REQUEST;
    private volatile CacheStatus cacheStatus = CacheStatus.NOT_CONSULTED;
    private volatile EventType shortCircuitedAt;
    private RequestEvent request;
    private ResponseArtifact response;

    /**
     * @param behavior     the behavior resolved for the request
     * @param request      the incoming request
     * @param eventConfig  distribution metadata and request id; the stage field is
     *                     overwritten per stage
     * @param cache        response cache consulted at the origin fetch
     * @param fingerprint  cache key derivation
     * @param originClient client used on a cache miss
     */
    public LifecycleEngine(
            Behavior behavior,
            RequestEvent request,
            EventConfig eventConfig,
            ResponseCache cache,
            CacheFingerprint fingerprint,
            OriginClient originClient) {
        this.behavior = behavior;
        this.request = request;
        this.eventConfig = eventConfig;
        this.cache = cache;
        this.fingerprint = fingerprint;
        this.originClient = originClient;
    }

    /**
     * Runs the lifecycle. May be called once per instance.
     *
     * @return a future with the final response, or failing with the error that
     *         aborted the lifecycle
     * @throws IllegalStateException if called a second time
     */
    public CompletableFuture<ResponseArtifact> run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Lifecycle already started for request " + eventConfig.requestId());
        }
        long startNanos = System.nanoTime();
        String method = request.method();
        String path = request.uri();
        CompletableFuture<ResponseArtifact> result = new CompletableFuture<>();

        CompletableFuture<Void> pipeline;
        try {
            pipeline = step();
        } catch (Throwable e) {
            pipeline = CompletableFuture.failedFuture(e);
        }

        pipeline.whenComplete((ignored, failure) -> {
            LifecycleState reached = state;
            state = LifecycleState.DONE;
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            if (failure != null) {
                Throwable cause = unwrap(failure);
                LOG.debug(
                        "Lifecycle {} aborted in {}: {} {} ({}ms): {}",
                        eventConfig.requestId(),
                        reached,
                        method,
                        path,
                        elapsedMs,
                        cause.toString());
                result.completeExceptionally(cause);
                return;
            }
            if (response == null) {
                result.completeExceptionally(new IncompleteLifecycleException(
                        "No response set after full request lifecycle for " + method + " " + path));
                return;
            }
            LOG.info(
                    "{} {} → {} (behavior='{}', cache={}, shortCircuit={}, {}ms)",
                    method,
                    path,
                    response.status(),
                    behavior.pattern(),
                    cacheStatus,
                    shortCircuitedAt != null ? shortCircuitedAt.wireName() : "none",
                    elapsedMs);
            result.complete(response);
        });
        return result;
    }

    /** The current state; {@link LifecycleState#DONE} once the run has finished. */
    public LifecycleState state() {
        return state;
    }

    /** Whether the response came from the cache, the origin, or neither. */
    public CacheStatus cacheStatus() {
        return cacheStatus;
    }

    /**
     * The request-phase stage that produced the response.
     *
     * @return the stage, or null if no handler short-circuited
     */
    public EventType shortCircuitedAt() {
        return shortCircuitedAt;
    }

    // --- State machine ---

    private CompletableFuture<Void> step() {
        LOG.debug("Lifecycle {} entering {}", eventConfig.requestId(), state);
        return switch (state) {
            case VIEWER_REQUEST -> runRequestStage(EventType.VIEWER_REQUEST, LifecycleState.ORIGIN_REQUEST)
                    .thenCompose(v -> step());
            case ORIGIN_REQUEST -> runRequestStage(EventType.ORIGIN_REQUEST, LifecycleState.FETCH_ORIGIN)
                    .thenCompose(v -> step());
            case FETCH_ORIGIN -> fetchOrigin().thenCompose(v -> step());
            case ORIGIN_RESPONSE -> runResponseStage(EventType.ORIGIN_RESPONSE, LifecycleState.VIEWER_RESPONSE)
                    .thenCompose(v -> step());
            case VIEWER_RESPONSE -> runResponseStage(EventType.VIEWER_RESPONSE, LifecycleState.DONE)
                    .thenCompose(v -> step());
            case DONE -> CompletableFuture.completedFuture(null);
        };
    }

    private CompletableFuture<Void> runRequestStage(EventType stage, LifecycleState next) {
        StageHandler handler = behavior.handler(stage);
        if (handler == null) {
            state = next;
            return CompletableFuture.completedFuture(null);
        }
        return invoke(stage, handler, null).thenAccept(result -> {
            if (result instanceof ResponseArtifact produced) {
                LOG.debug("Lifecycle {} short-circuited at {} with {}", eventConfig.requestId(), stage.wireName(),
                        produced.status());
                response = produced;
                shortCircuitedAt = stage;
                state = LifecycleState.DONE;
            } else if (result instanceof RequestEvent updated) {
                request = updated;
                state = next;
            } else {
                throw new InvalidHandlerResultException(
                        stage.wireName() + " handler must return a request or a response, got " + describe(result),
                        stage);
            }
        });
    }

    private CompletableFuture<Void> runResponseStage(EventType stage, LifecycleState next) {
        StageHandler handler = behavior.handler(stage);
        if (handler == null) {
            state = next;
            return CompletableFuture.completedFuture(null);
        }
        return invoke(stage, handler, response).thenAccept(result -> {
            if (result instanceof ResponseArtifact updated) {
                response = updated;
                state = next;
            } else {
                throw new InvalidHandlerResultException(
                        stage.wireName() + " handler must return a response, got " + describe(result), stage);
            }
        });
    }

    private CompletableFuture<Void> fetchOrigin() {
        String key = fingerprint.fingerprint(request);
        Optional<CacheEntry> cached = lookup(key);
        if (cached.isPresent()) {
            LOG.debug("Lifecycle {} cache hit {}", eventConfig.requestId(), key);
            cacheStatus = CacheStatus.HIT;
            response = cached.get().response();
            state = LifecycleState.ORIGIN_RESPONSE;
            return CompletableFuture.completedFuture(null);
        }
        cacheStatus = CacheStatus.MISS;

        OriginTarget origin = behavior.origin();
        if (origin == null) {
            return CompletableFuture.failedFuture(new NoOriginConfiguredException("No origin configured for behavior '"
                    + behavior.pattern() + "' and no handler produced a response for " + request.method() + " "
                    + request.uri()));
        }

        CompletableFuture<ResponseArtifact> pending;
        try {
            pending = originClient.fetch(request, origin);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(asOriginUnavailable(e, origin));
        }
        return pending.<Void>handle((fetched, failure) -> {
            if (failure != null) {
                throw asOriginUnavailable(unwrap(failure), origin);
            }
            if (fetched == null) {
                throw new OriginUnavailableException("Origin " + origin.baseUrl() + " produced no response", null);
            }
            store(key, fetched);
            response = fetched;
            state = LifecycleState.ORIGIN_RESPONSE;
            return null;
        });
    }

    // --- Collaborator calls ---

    private CompletableFuture<HandlerResult> invoke(EventType stage, StageHandler handler, ResponseArtifact current) {
        EdgeEvent event = new EdgeEvent(eventConfig.forStage(stage), request, current);
        CompletionStage<? extends HandlerResult> pending;
        try {
            pending = handler.handle(event);
        } catch (Throwable e) {
            // Errors from handler code (e.g. AssertionError) are handler failures too
            return CompletableFuture.failedFuture(new HandlerExecutionException(stage, e));
        }
        if (pending == null) {
            return CompletableFuture.failedFuture(
                    new InvalidHandlerResultException(stage.wireName() + " handler returned no result", stage));
        }
        CompletableFuture<HandlerResult> settled = new CompletableFuture<>();
        pending.whenComplete((result, failure) -> {
            if (failure != null) {
                settled.completeExceptionally(new HandlerExecutionException(stage, unwrap(failure)));
            } else {
                settled.complete(result);
            }
        });
        return settled;
    }

    private Optional<CacheEntry> lookup(String key) {
        try {
            return cache.lookup(key);
        } catch (RuntimeException e) {
            LOG.warn("Cache lookup failed for {}, fetching from origin: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String key, ResponseArtifact fetched) {
        try {
            cache.store(key, fetched);
        } catch (RuntimeException e) {
            LOG.warn("Cache store failed for {}, response served uncached: {}", key, e.getMessage());
        }
    }

    private static OriginUnavailableException asOriginUnavailable(Throwable failure, OriginTarget origin) {
        if (failure instanceof OriginUnavailableException unavailable) {
            return unavailable;
        }
        return new OriginUnavailableException(
                "Origin " + origin.baseUrl() + " unavailable: " + failure.getMessage(), failure);
    }

    private static String describe(HandlerResult result) {
        return result == null ? "null" : result.getClass().getSimpleName();
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
