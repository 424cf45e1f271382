package io.edgesim.core.spi;

import io.edgesim.core.model.OriginTarget;
import io.edgesim.core.model.RequestEvent;
import io.edgesim.core.model.ResponseArtifact;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards a request to a behavior's origin. Single-shot: no retries, no
 * redirect following.
 */
public interface OriginClient {

    /**
     * Fetches the response for {@code request} from {@code target}.
     *
     * @return a future completing with the origin response, or exceptionally with
     *         {@link io.edgesim.core.error.OriginUnavailableException} on
     *         connection failure, timeout or an unreadable response
     */
    CompletableFuture<ResponseArtifact> fetch(RequestEvent request, OriginTarget target);
}
