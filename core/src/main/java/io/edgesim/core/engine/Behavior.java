package io.edgesim.core.engine;

import io.edgesim.core.model.EventType;
import io.edgesim.core.model.OriginTarget;
import io.edgesim.core.spi.StageHandler;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A path pattern with its stage handlers and optional origin.
 *
 * <p>
 * Handlers are resolved into an {@link EnumMap} once, when the registry is
 * built; request handling only does enum lookups. Immutable.
 */
public final class Behavior {

    private final PathPatternMatcher.Matcher matcher;
    private final Map<EventType, StageHandler> stages;
    private final OriginTarget origin;

    Behavior(PathPatternMatcher.Matcher matcher, Map<EventType, StageHandler> stages, OriginTarget origin) {
        this.matcher = matcher;
        EnumMap<EventType, StageHandler> copy = new EnumMap<>(EventType.class);
        copy.putAll(stages);
        this.stages = Collections.unmodifiableMap(copy);
        this.origin = origin;
    }

    /** The path pattern this behavior was registered under. */
    public String pattern() {
        return matcher.pattern();
    }

    /** True if the behavior's pattern matches {@code path}. */
    public boolean matches(String path) {
        return matcher.matches(path);
    }

    /** True for the {@code *} fallback behavior. */
    public boolean isCatchAll() {
        return matcher.isCatchAll();
    }

    /**
     * The handler for {@code stage}.
     *
     * @return the handler, or null if the stage is a pass-through
     */
    public StageHandler handler(EventType stage) {
        return stages.get(stage);
    }

    /** Stage → handler, for the stages this behavior defines. */
    public Map<EventType, StageHandler> stages() {
        return stages;
    }

    /**
     * The origin to fetch from on a cache miss.
     *
     * @return the origin, or null if none is configured
     */
    public OriginTarget origin() {
        return origin;
    }

    @Override
    public String toString() {
        return "Behavior[" + pattern() + ", stages=" + stages.keySet() + ", origin="
                + (origin != null ? origin.baseUrl() : "none") + "]";
    }
}
