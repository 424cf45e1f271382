package io.edgesim.standalone;

import io.edgesim.standalone.server.EdgeServerApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone edge simulator.
 *
 * <p>
 * Delegates to {@link EdgeServerApp#start(String[])}. On failure, logs the
 * error and exits with a non-zero status code.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config edge-sim.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            EdgeServerApp app = EdgeServerApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "edge-sim-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
