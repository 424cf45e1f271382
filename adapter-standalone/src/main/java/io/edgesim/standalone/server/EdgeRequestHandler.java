package io.edgesim.standalone.server;

import io.edgesim.core.engine.Router;
import io.edgesim.core.model.RequestEvent;
import io.edgesim.core.model.ResponseArtifact;
import io.edgesim.standalone.adapter.RequestAdapter;
import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Catch-all handler: converts the Javalin request, routes it through the
 * {@link Router} and writes the result.
 *
 * <p>
 * The router's future always completes normally, error responses included, so
 * the handler only waits for it.
 */
public final class EdgeRequestHandler implements Handler {

    private final Router router;
    private final RequestAdapter adapter;

    public EdgeRequestHandler(Router router, RequestAdapter adapter) {
        this.router = router;
        this.adapter = adapter;
    }

    @Override
    public void handle(Context ctx) {
        RequestEvent request = adapter.toRequestEvent(ctx);
        ResponseArtifact response = router.route(request).join();
        adapter.writeResponse(response, ctx);
    }
}
