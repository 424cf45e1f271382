package io.edgesim.standalone.server;

import io.edgesim.core.cache.CacheFingerprint;
import io.edgesim.core.cache.FileResponseCache;
import io.edgesim.core.engine.BehaviorRegistry;
import io.edgesim.core.engine.Router;
import io.edgesim.core.origin.HttpOriginClient;
import io.edgesim.standalone.adapter.RequestAdapter;
import io.edgesim.standalone.config.ConfigLoader;
import io.edgesim.standalone.config.EdgeConfig;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the standalone server startup sequence.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback</li>
 * <li>Load handler classes and build the behavior registry</li>
 * <li>Open the durable response cache</li>
 * <li>Create the origin client and the {@link Router}</li>
 * <li>Start the Javalin HTTP server</li>
 * </ol>
 *
 * <p>
 * Separate from {@link io.edgesim.standalone.StandaloneMain} so integration
 * tests can start and stop servers without going through {@code main()}.
 */
public final class EdgeServerApp {

    private static final Logger LOG = LoggerFactory.getLogger(EdgeServerApp.class);

    /** Methods Javalin dispatches to HTTP handlers; anything else is routed from a before-handler. */
    private static final List<HandlerType> STANDARD_METHODS = List.of(
            HandlerType.GET,
            HandlerType.POST,
            HandlerType.PUT,
            HandlerType.DELETE,
            HandlerType.PATCH,
            HandlerType.HEAD,
            HandlerType.OPTIONS);

    private static final Set<String> STANDARD_METHOD_NAMES =
            Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");

    private final Javalin app;
    private final Router router;
    private final EdgeConfig config;

    private EdgeServerApp(Javalin app, Router router, EdgeConfig config) {
        this.app = app;
        this.router = router;
        this.config = config;
    }

    /**
     * Runs the startup sequence with the process environment.
     *
     * @param args command-line arguments (e.g. {@code --config edge-sim.yaml})
     * @return a running server
     */
    public static EdgeServerApp start(String[] args) {
        return start(ConfigLoader.resolveConfigPath(args), System::getenv);
    }

    /**
     * Runs the startup sequence.
     *
     * @param configPath the YAML configuration file
     * @param envLookup  environment lookup for overrides, also used on reload
     * @return a running server
     */
    public static EdgeServerApp start(Path configPath, Function<String, String> envLookup) {
        long startTime = System.nanoTime();

        // 1. Configuration
        EdgeConfig config = ConfigLoader.load(configPath, envLookup);

        // 2. Logging
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);

        // 3. Behaviors
        BehaviorRegistry registry = RegistryLoader.load(config);

        // 4. Cache
        FileResponseCache cache = new FileResponseCache(Path.of(config.cacheDir()));
        LOG.info("Response cache directory: {} ({} entries)", cache.directory(), cache.size());

        // 5. Origin client + router
        HttpOriginClient originClient = new HttpOriginClient(
                Duration.ofMillis(config.originConnectTimeoutMs()), Duration.ofMillis(config.originReadTimeoutMs()));
        Router router = new Router(
                cache,
                originClient,
                new CacheFingerprint(config.cacheKeyHeaders()),
                config.distributionDomainName(),
                config.distributionId());
        router.reload(registry);
        RegistryLoader.logBehaviors(registry);

        // 6. HTTP server
        EdgeRequestHandler requestHandler = new EdgeRequestHandler(router, new RequestAdapter());
        Javalin app = Javalin.create(javalinConfig -> javalinConfig.showJavalinBanner = false);

        app.addHttpHandler(
                HandlerType.POST, config.adminReloadPath(), new AdminReloadHandler(router, configPath, envLookup));

        // PURGE and other extension methods have no HandlerType; route them here
        app.before(ctx -> {
            String method = ctx.req().getMethod().toUpperCase(Locale.ROOT);
            if (!STANDARD_METHOD_NAMES.contains(method)) {
                requestHandler.handle(ctx);
                ctx.skipRemainingHandlers();
            }
        });
        for (HandlerType method : STANDARD_METHODS) {
            app.addHttpHandler(method, "/", requestHandler);
            app.addHttpHandler(method, "/<path>", requestHandler);
        }

        app.start(config.host(), config.port());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "edge-sim started: port={}, behaviors={}, cacheDir={}, startupMs={}",
                app.port(),
                registry.size(),
                cache.directory(),
                elapsedMs);

        return new EdgeServerApp(app, router, config);
    }

    /** Returns the port the server is listening on. */
    public int port() {
        return app.port();
    }

    /** Returns the router serving requests. */
    public Router router() {
        return router;
    }

    /** Returns the loaded configuration. */
    public EdgeConfig config() {
        return config;
    }

    /** Stops the HTTP server. The cache directory is left in place. */
    public void stop() {
        app.stop();
        LOG.info("edge-sim stopped");
    }
}
