package io.edgesim.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The request as seen by every stage of the lifecycle.
 *
 * <p>
 * Immutable: stage handlers return a modified copy via the {@code with*}
 * methods, so each stage sees the latest version and no stage can mutate an
 * event another stage still holds.
 *
 * @param method      HTTP method, upper case
 * @param uri         request path, always starting with {@code /}
 * @param querystring raw query string without the leading {@code ?}; empty when absent
 * @param headers     request headers
 * @param cookies     parsed cookies (name → value)
 * @param body        request body
 * @param clientIp    address of the viewer, may be null
 */
public record RequestEvent(
        String method,
        String uri,
        String querystring,
        HttpHeaders headers,
        Map<String, String> cookies,
        EventBody body,
        String clientIp)
        implements HandlerResult {

    public RequestEvent {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(uri, "uri must not be null");
        querystring = querystring != null ? querystring : "";
        headers = headers != null ? headers : HttpHeaders.empty();
        cookies = cookies != null ? Collections.unmodifiableMap(new LinkedHashMap<>(cookies)) : Map.of();
        body = body != null ? body : EventBody.empty();
    }

    /** Convenience factory for a bodyless request with no headers. */
    public static RequestEvent of(String method, String uri) {
        return of(method, uri, "");
    }

    /** Convenience factory for a bodyless request with a query string and no headers. */
    public static RequestEvent of(String method, String uri, String querystring) {
        return new RequestEvent(method, uri, querystring, HttpHeaders.empty(), Map.of(), EventBody.empty(), null);
    }

    public RequestEvent withMethod(String newMethod) {
        return new RequestEvent(newMethod, uri, querystring, headers, cookies, body, clientIp);
    }

    public RequestEvent withUri(String newUri) {
        return new RequestEvent(method, newUri, querystring, headers, cookies, body, clientIp);
    }

    public RequestEvent withQuerystring(String newQuerystring) {
        return new RequestEvent(method, uri, newQuerystring, headers, cookies, body, clientIp);
    }

    public RequestEvent withHeaders(HttpHeaders newHeaders) {
        return new RequestEvent(method, uri, querystring, newHeaders, cookies, body, clientIp);
    }

    /** Returns a copy with {@code name} set to the single {@code value}. */
    public RequestEvent withHeader(String name, String value) {
        return withHeaders(headers.with(name, value));
    }

    public RequestEvent withBody(EventBody newBody) {
        return new RequestEvent(method, uri, querystring, headers, cookies, newBody, clientIp);
    }

    /** Path plus query string, e.g. {@code /api/users?page=2}. */
    public String pathWithQuery() {
        return querystring.isEmpty() ? uri : uri + "?" + querystring;
    }
}
