package io.edgesim.core.engine;

import io.edgesim.core.error.InvalidRegistrationException;
import io.edgesim.core.model.EventType;
import io.edgesim.core.model.OriginTarget;
import io.edgesim.core.spi.StageHandler;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable snapshot of all registered behaviors.
 *
 * <p>
 * This is the unit of atomic swap in {@link Router#reload(BehaviorRegistry)}.
 * The router holds a {@code BehaviorRegistry} reference via
 * {@link java.util.concurrent.atomic.AtomicReference}; reloading builds a new
 * registry and swaps it in. In-flight requests that captured the old reference
 * continue using it; new requests pick up the new one.
 *
 * <p>
 * A catch-all {@code *} behavior always exists after construction: if none was
 * registered, an empty one is synthesized (with the {@code *} origin mapping,
 * if any).
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class BehaviorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(BehaviorRegistry.class);

    private final List<Behavior> specific;
    private final Behavior fallback;

    private BehaviorRegistry(List<Behavior> specific, Behavior fallback) {
        this.specific = Collections.unmodifiableList(new ArrayList<>(specific));
        this.fallback = fallback;
    }

    /**
     * Creates a registry with only the empty catch-all behavior.
     *
     * @return an empty, immutable registry
     */
    public static BehaviorRegistry empty() {
        return builder().build();
    }

    /**
     * Returns a new {@link Builder} for constructing a registry from
     * registration tuples.
     *
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the behavior for a request path: the first non-wildcard behavior
     * (in registration order) whose pattern matches, otherwise the catch-all.
     *
     * @param path the request path, without query string
     * @return the matching behavior; never null
     */
    public Behavior resolve(String path) {
        for (Behavior behavior : specific) {
            if (behavior.matches(path)) {
                return behavior;
            }
        }
        return fallback;
    }

    /** The catch-all behavior. */
    public Behavior fallback() {
        return fallback;
    }

    /**
     * All behaviors in evaluation order, catch-all last.
     *
     * @return unmodifiable list
     */
    public List<Behavior> behaviors() {
        List<Behavior> all = new ArrayList<>(specific);
        all.add(fallback);
        return Collections.unmodifiableList(all);
    }

    /** Number of behaviors including the catch-all. */
    public int size() {
        return specific.size() + 1;
    }

    /**
     * Builder that groups {@code (pattern, eventType, handler)} registrations by
     * pattern into behaviors.
     *
     * <p>
     * Patterns are compiled as they are registered, so an invalid pattern fails
     * the build before any registry exists. A second registration for an
     * already-filled (pattern, stage) slot replaces the first and logs a warning;
     * in {@linkplain #strict(boolean) strict mode} it is rejected instead.
     */
    public static final class Builder {

        private final Map<String, PathPatternMatcher.Matcher> matchers = new LinkedHashMap<>();
        private final Map<String, Map<EventType, StageHandler>> handlers = new LinkedHashMap<>();
        private final Map<String, OriginTarget> origins = new LinkedHashMap<>();
        private boolean strict;

        Builder() {}

        /**
         * Rejects duplicate (pattern, stage) registrations with
         * {@link InvalidRegistrationException} instead of replacing.
         *
         * @return this builder (fluent)
         */
        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        /**
         * Registers a handler for one stage of the behavior with {@code pattern}.
         *
         * @return this builder (fluent)
         * @throws io.edgesim.core.error.InvalidPatternException if the pattern is invalid
         * @throws InvalidRegistrationException                  if the stage or handler is
         *                                                       missing, or on a duplicate
         *                                                       in strict mode
         */
        public Builder register(String pattern, EventType eventType, StageHandler handler) {
            if (eventType == null) {
                throw new InvalidRegistrationException("Event type is required for pattern '" + pattern + "'", pattern);
            }
            if (handler == null) {
                throw new InvalidRegistrationException(
                        "Handler is required for " + eventType.wireName() + " on pattern '" + pattern + "'", pattern);
            }
            matcherFor(pattern);
            Map<EventType, StageHandler> slots =
                    handlers.computeIfAbsent(pattern, p -> new EnumMap<>(EventType.class));
            if (slots.containsKey(eventType)) {
                if (strict) {
                    throw new InvalidRegistrationException(
                            "Duplicate " + eventType.wireName() + " handler for pattern '" + pattern + "'", pattern);
                }
                LOG.warn(
                        "Duplicate {} handler for pattern '{}': later registration replaces the earlier one",
                        eventType.wireName(),
                        pattern);
            }
            slots.put(eventType, handler);
            return this;
        }

        /**
         * Convenience overload taking the stage by its wire name.
         *
         * @throws InvalidRegistrationException if {@code eventType} is not a known stage
         */
        public Builder register(String pattern, String eventType, StageHandler handler) {
            EventType type;
            try {
                type = EventType.fromWireName(eventType);
            } catch (IllegalArgumentException e) {
                throw new InvalidRegistrationException(e.getMessage(), e, pattern);
            }
            return register(pattern, type, handler);
        }

        /**
         * Maps {@code pattern} to an origin. A pattern with an origin but no
         * handlers still becomes a behavior.
         *
         * @return this builder (fluent)
         */
        public Builder origin(String pattern, String baseUrl) {
            return origin(pattern, new OriginTarget(baseUrl));
        }

        /** @see #origin(String, String) */
        public Builder origin(String pattern, OriginTarget target) {
            matcherFor(pattern);
            OriginTarget previous = origins.put(pattern, target);
            if (previous != null && !previous.equals(target)) {
                LOG.warn("Origin for pattern '{}' redefined: {} -> {}", pattern, previous.baseUrl(), target.baseUrl());
            }
            return this;
        }

        private PathPatternMatcher.Matcher matcherFor(String pattern) {
            PathPatternMatcher.Matcher matcher = matchers.get(pattern);
            if (matcher == null) {
                matcher = PathPatternMatcher.compile(pattern);
                matchers.put(pattern, matcher);
            }
            return matcher;
        }

        /**
         * Builds an immutable {@link BehaviorRegistry} from the accumulated state.
         *
         * @return the new registry
         */
        public BehaviorRegistry build() {
            List<Behavior> specific = new ArrayList<>();
            Behavior fallback = null;
            for (Map.Entry<String, PathPatternMatcher.Matcher> entry : matchers.entrySet()) {
                String pattern = entry.getKey();
                Behavior behavior = new Behavior(
                        entry.getValue(), handlers.getOrDefault(pattern, Map.of()), origins.get(pattern));
                if (behavior.isCatchAll()) {
                    fallback = behavior;
                } else {
                    specific.add(behavior);
                }
            }
            if (fallback == null) {
                fallback = new Behavior(
                        PathPatternMatcher.compile(PathPatternMatcher.CATCH_ALL), Map.of(), null);
            }
            return new BehaviorRegistry(specific, fallback);
        }
    }
}
