package io.edgesim.standalone.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.edgesim.core.engine.BehaviorRegistry;
import io.edgesim.core.engine.ErrorResponseBuilder;
import io.edgesim.core.engine.Router;
import io.edgesim.standalone.config.ConfigLoader;
import io.edgesim.standalone.config.EdgeConfig;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admin reload endpoint.
 *
 * <p>
 * {@code POST <admin.reload-path>} re-reads the configuration file, rebuilds
 * the behavior registry (handlers and origins) and installs it with
 * {@link Router#reload}. Server, cache and logging settings are not
 * re-applied.
 *
 * <p>
 * Response on success:
 *
 * <pre>
 * 200 OK
 * {"status": "reloaded", "behaviors": N}
 * </pre>
 *
 * <p>
 * On failure the running registry is kept and the response is
 * {@code 500 {"code": 500, "message": "Reload failed: ..."}}.
 */
public final class AdminReloadHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(AdminReloadHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Router router;
    private final Path configPath;
    private final Function<String, String> envLookup;
    private final ErrorResponseBuilder errors = new ErrorResponseBuilder();

    /**
     * @param router     router whose registry is replaced
     * @param configPath configuration file to re-read
     * @param envLookup  environment lookup applied on every reload
     */
    public AdminReloadHandler(Router router, Path configPath, Function<String, String> envLookup) {
        this.router = router;
        this.configPath = configPath;
        this.envLookup = envLookup;
    }

    @Override
    public void handle(Context ctx) {
        LOG.info("Admin reload triggered via POST {}", ctx.path());

        BehaviorRegistry registry;
        try {
            EdgeConfig config = ConfigLoader.load(configPath, envLookup);
            registry = RegistryLoader.load(config);
        } catch (RuntimeException e) {
            LOG.error("Reload failed, keeping current behaviors: {}", e.getMessage(), e);
            ctx.status(500);
            ctx.contentType("application/json");
            ctx.result(errors.build(500, "Reload failed: " + e.getMessage()).body().asString());
            return;
        }

        router.reload(registry);
        RegistryLoader.logBehaviors(registry);

        ObjectNode response = MAPPER.createObjectNode();
        response.put("status", "reloaded");
        response.put("behaviors", registry.size());

        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(response.toString());
    }
}
