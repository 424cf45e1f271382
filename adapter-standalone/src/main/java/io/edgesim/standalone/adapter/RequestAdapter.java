package io.edgesim.standalone.adapter;

import io.edgesim.core.model.EventBody;
import io.edgesim.core.model.HttpHeaders;
import io.edgesim.core.model.RequestEvent;
import io.edgesim.core.model.ResponseArtifact;
import io.javalin.http.Context;
import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges Javalin's {@link Context} and the core event model.
 *
 * <p>
 * {@link #toRequestEvent} copies the inbound request (header names lowercased,
 * all values kept). {@link #writeResponse} writes a {@link ResponseArtifact}
 * back, leaving framing headers to Jetty.
 *
 * <p>
 * The method is read from the servlet request rather than
 * {@link Context#method()}, which has no constant for extension methods such
 * as {@code PURGE}.
 *
 * <p>
 * This class is thread-safe: all state is local to each invocation.
 */
public final class RequestAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(RequestAdapter.class);

    /** Managed by Jetty from the body actually written. */
    private static final Set<String> FRAMING_HEADERS = Set.of("content-length", "transfer-encoding");

    public RequestEvent toRequestEvent(Context ctx) {
        HttpServletRequest req = ctx.req();
        String method = req.getMethod().toUpperCase(Locale.ROOT);

        Map<String, List<String>> headersAll = new LinkedHashMap<>();
        for (String name : Collections.list(req.getHeaderNames())) {
            headersAll
                    .computeIfAbsent(name.toLowerCase(Locale.ROOT), k -> new ArrayList<>())
                    .addAll(Collections.list(req.getHeaders(name)));
        }
        HttpHeaders headers = HttpHeaders.ofMulti(headersAll);
        byte[] body = ctx.bodyAsBytes();

        LOG.debug("toRequestEvent: {} {} (body={} bytes, headers={})", method, ctx.path(), body.length,
                headers.names().size());

        return new RequestEvent(
                method,
                ctx.path(),
                ctx.queryString(),
                headers,
                new LinkedHashMap<>(ctx.cookieMap()),
                EventBody.of(body),
                ctx.ip());
    }

    public void writeResponse(ResponseArtifact response, Context ctx) {
        ctx.status(response.status());
        response.headers().forEach((name, values) -> {
            if (FRAMING_HEADERS.contains(name)) {
                return;
            }
            ctx.res().setHeader(name, null);
            for (String value : values) {
                ctx.res().addHeader(name, value);
            }
        });
        ctx.result(response.body().content());

        LOG.debug("writeResponse: status={}, headers={}, body={} bytes", response.status(),
                response.headers().names().size(), response.body().size());
    }
}
