package io.edgesim.core.engine;

import io.edgesim.core.cache.CacheFingerprint;
import io.edgesim.core.cache.ResponseCache;
import io.edgesim.core.error.EdgeException;
import io.edgesim.core.error.NoBehaviorMatchedException;
import io.edgesim.core.model.EventConfig;
import io.edgesim.core.model.EventType;
import io.edgesim.core.model.RequestEvent;
import io.edgesim.core.model.ResponseArtifact;
import io.edgesim.core.spi.OriginClient;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for every inbound request.
 *
 * <p>
 * Per request:
 * <ol>
 * <li>{@code PURGE} requests empty the {@link ResponseCache} and answer
 * {@code 200} with an empty body; they never reach a behavior.</li>
 * <li>The behavior is resolved from the current {@link BehaviorRegistry}
 * snapshot.</li>
 * <li>A fresh {@link LifecycleEngine} runs the stages.</li>
 * <li>Failures are mapped to {@code {code, message}} JSON responses by
 * {@link ErrorResponseBuilder}: origin failures → 502, handler and contract
 * failures → 500, no registry → 404.</li>
 * </ol>
 * The returned future always completes normally.
 *
 * <p>
 * Thread-safe: uses {@link AtomicReference} to hold an immutable
 * {@link BehaviorRegistry} snapshot. {@link #reload} atomically swaps the
 * registry; in-flight requests keep the snapshot they started with.
 */
public final class Router {

    private static final Logger LOG = LoggerFactory.getLogger(Router.class);

    /** Method that purges the response cache. */
    public static final String PURGE_METHOD = "PURGE";

    private static final String REQUEST_ID_HEADER = "x-request-id";

    private final AtomicReference<BehaviorRegistry> registryRef = new AtomicReference<>();
    private final ResponseCache cache;
    private final OriginClient originClient;
    private final CacheFingerprint fingerprint;
    private final String distributionDomainName;
    private final String distributionId;
    private final ErrorResponseBuilder errorResponseBuilder = new ErrorResponseBuilder();

    /**
     * Creates a router with no registry installed; call {@link #reload} before
     * serving traffic.
     *
     * @param cache                  response cache, owned for the process lifetime
     * @param originClient           client for origin fetches
     * @param fingerprint            cache key derivation
     * @param distributionDomainName simulated distribution domain, handed to handlers
     * @param distributionId         simulated distribution id, handed to handlers
     */
    public Router(
            ResponseCache cache,
            OriginClient originClient,
            CacheFingerprint fingerprint,
            String distributionDomainName,
            String distributionId) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.originClient = Objects.requireNonNull(originClient, "originClient");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.distributionDomainName = distributionDomainName;
        this.distributionId = distributionId;
    }

    /**
     * Installs {@code registry}, replacing the current one atomically.
     *
     * @param registry the fully built replacement
     */
    public void reload(BehaviorRegistry registry) {
        BehaviorRegistry previous = registryRef.getAndSet(Objects.requireNonNull(registry, "registry"));
        LOG.info(
                "Behavior registry {}: behaviors={}",
                previous == null ? "installed" : "reloaded",
                registry.size());
    }

    /**
     * The current registry snapshot.
     *
     * @return the registry, or null before the first {@link #reload}
     */
    public BehaviorRegistry registry() {
        return registryRef.get();
    }

    /** The response cache owned by this router. */
    public ResponseCache cache() {
        return cache;
    }

    /**
     * Removes every cached origin response.
     *
     * @return the number of entries removed
     */
    public int purge() {
        return cache.purgeAll();
    }

    /**
     * Routes one request through PURGE interception, behavior matching and the
     * lifecycle.
     *
     * @param request the parsed inbound request
     * @return a future that always completes with the response to send
     */
    public CompletableFuture<ResponseArtifact> route(RequestEvent request) {
        if (PURGE_METHOD.equalsIgnoreCase(request.method())) {
            return CompletableFuture.completedFuture(handlePurge(request));
        }

        BehaviorRegistry registry = registryRef.get();
        if (registry == null) {
            return CompletableFuture.completedFuture(toErrorResponse(
                    new NoBehaviorMatchedException("No behaviors registered; cannot route " + request.uri()), request));
        }

        Behavior behavior = registry.resolve(request.uri());
        LOG.debug("{} {} matched behavior '{}'", request.method(), request.uri(), behavior.pattern());

        EventConfig eventConfig =
                new EventConfig(distributionDomainName, distributionId, EventType.VIEWER_REQUEST, requestId(request));
        LifecycleEngine engine =
                new LifecycleEngine(behavior, request, eventConfig, cache, fingerprint, originClient);

        CompletableFuture<ResponseArtifact> pending;
        try {
            pending = engine.run();
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(toErrorResponse(e, request));
        }
        return pending.handle((response, failure) ->
                failure == null ? response : toErrorResponse(LifecycleEngine.unwrap(failure), request));
    }

    private ResponseArtifact handlePurge(RequestEvent request) {
        try {
            int removed = cache.purgeAll();
            LOG.info("PURGE {}: {} cache entries removed", request.uri(), removed);
            return new ResponseArtifact(200, ErrorResponseBuilder.reasonPhrase(200), null, null);
        } catch (RuntimeException e) {
            return toErrorResponse(e, request);
        }
    }

    private ResponseArtifact toErrorResponse(Throwable failure, RequestEvent request) {
        int status = ErrorResponseBuilder.statusFor(failure);
        String code = failure instanceof EdgeException edge ? edge.code() : failure.getClass().getSimpleName();
        if (status >= 500 && !(failure instanceof EdgeException edge && edge.httpStatus() == 502)) {
            LOG.error("{} {} failed: {} {}", request.method(), request.uri(), code, failure.getMessage(), failure);
        } else {
            LOG.warn("{} {} failed: {} {}", request.method(), request.uri(), code, failure.getMessage());
        }
        return errorResponseBuilder.build(failure);
    }

    private static String requestId(RequestEvent request) {
        String fromHeader = request.headers().first(REQUEST_ID_HEADER);
        return fromHeader != null && !fromHeader.isBlank() ? fromHeader : UUID.randomUUID().toString();
    }
}
