package io.edgesim.standalone.server;

import io.edgesim.core.engine.Behavior;
import io.edgesim.core.engine.BehaviorRegistry;
import io.edgesim.core.engine.PathPatternMatcher;
import io.edgesim.core.model.EventType;
import io.edgesim.core.spi.StageHandler;
import io.edgesim.standalone.config.BehaviorConfig;
import io.edgesim.standalone.config.EdgeConfig;
import io.edgesim.standalone.config.HandlerLoader;
import io.edgesim.standalone.config.OriginMapping;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link BehaviorRegistry} from the {@code behaviors} and
 * {@code origins} sections of an {@link EdgeConfig}.
 *
 * <p>
 * Used at startup and by {@link AdminReloadHandler}. Any failure (unknown
 * handler class, invalid pattern, invalid origin URL, strict-mode duplicate)
 * propagates before a registry exists, so a failed reload never replaces the
 * running one.
 */
final class RegistryLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RegistryLoader.class);

    private RegistryLoader() {
        // utility class
    }

    static BehaviorRegistry load(EdgeConfig config) {
        HandlerLoader handlers = new HandlerLoader();
        BehaviorRegistry.Builder builder = BehaviorRegistry.builder().strict(config.strictRegistration());

        for (BehaviorConfig behavior : config.behaviors()) {
            StageHandler handler = handlers.load(behavior.handler());
            builder.register(behavior.pattern(), behavior.eventType(), handler);
        }
        for (OriginMapping origin : config.origins()) {
            builder.origin(origin.pathPattern(), origin.target());
            if (origin.defaultOrigin() && !PathPatternMatcher.CATCH_ALL.equals(origin.pathPattern())) {
                builder.origin(PathPatternMatcher.CATCH_ALL, origin.target());
            }
        }
        return builder.build();
    }

    /** Logs one line per behavior listing its stages and origin. */
    static void logBehaviors(BehaviorRegistry registry) {
        for (Behavior behavior : registry.behaviors()) {
            String stages = behavior.stages().keySet().stream()
                    .map(EventType::wireName)
                    .collect(Collectors.joining(", ", "[", "]"));
            LOG.info(
                    "Behavior '{}': stages={}, origin={}",
                    behavior.pattern(),
                    stages,
                    behavior.origin() != null ? behavior.origin().baseUrl() : "none");
        }
    }
}
