package io.edgesim.core.origin;

import io.edgesim.core.error.OriginUnavailableException;
import io.edgesim.core.model.EventBody;
import io.edgesim.core.model.HttpHeaders;
import io.edgesim.core.model.OriginTarget;
import io.edgesim.core.model.RequestEvent;
import io.edgesim.core.model.ResponseArtifact;
import io.edgesim.core.spi.OriginClient;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based origin fetcher.
 *
 * <p>
 * Forwards method, path, query, headers and body to
 * {@code OriginTarget.baseUrl + path} over HTTP/1.1. Redirects are never
 * followed: a 3xx from the origin is returned as-is to the response-phase
 * stages. No retries.
 *
 * <p>
 * This class is thread-safe: the underlying {@link HttpClient} is
 * thread-safe and designed for concurrent use.
 */
public final class HttpOriginClient implements OriginClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpOriginClient.class);

    /**
     * Hop-by-hop headers per RFC 7230 §6.1, stripped in both request and
     * response directions.
     */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection",
            "transfer-encoding",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailer",
            "upgrade");

    /** Headers the JDK client manages itself and refuses to have set. */
    private static final Set<String> RESTRICTED_HEADERS = Set.of("host", "content-length", "expect");

    private final HttpClient httpClient;
    private final Duration readTimeout;

    /**
     * Creates an origin client.
     *
     * @param connectTimeout TCP connect timeout
     * @param readTimeout    time allowed for the whole response
     */
    public HttpOriginClient(Duration connectTimeout, Duration readTimeout) {
        this.readTimeout = readTimeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        LOG.debug("HttpOriginClient initialized: connectTimeout={}, readTimeout={}", connectTimeout, readTimeout);
    }

    @Override
    public CompletableFuture<ResponseArtifact> fetch(RequestEvent request, OriginTarget target) {
        URI targetUri;
        HttpRequest httpRequest;
        try {
            targetUri = target.resolve(request.pathWithQuery());
            httpRequest = buildRequest(request, targetUri);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new OriginUnavailableException(
                    "Invalid origin request " + target.baseUrl() + request.pathWithQuery() + ": " + e.getMessage(), e));
        }

        LOG.debug("Fetching {} {} from origin {}", request.method(), request.pathWithQuery(), targetUri);

        return httpClient
                .sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
                .handle((response, failure) -> {
                    if (failure != null) {
                        throw translate(failure, targetUri);
                    }
                    LOG.debug("Origin responded: {} {} → {}", request.method(), targetUri, response.statusCode());
                    return toArtifact(response);
                });
    }

    private HttpRequest buildRequest(RequestEvent request, URI targetUri) {
        EventBody body = request.body();
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(targetUri)
                .timeout(readTimeout)
                .method(
                        request.method(),
                        body.isEmpty()
                                ? HttpRequest.BodyPublishers.noBody()
                                : HttpRequest.BodyPublishers.ofByteArray(body.content()));

        request.headers().forEach((name, values) -> {
            if (isRestrictedHeader(name) || isHopByHop(name)) {
                return;
            }
            for (String value : values) {
                builder.header(name, value);
            }
        });
        return builder.build();
    }

    private static ResponseArtifact toArtifact(HttpResponse<byte[]> response) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> {
            String lowerName = name.toLowerCase(Locale.ROOT);
            if (!values.isEmpty() && !isHopByHop(lowerName) && !lowerName.startsWith(":")) {
                headers.computeIfAbsent(lowerName, k -> new ArrayList<>()).addAll(values);
            }
        });
        return new ResponseArtifact(
                response.statusCode(), "", HttpHeaders.ofMulti(headers), EventBody.of(response.body()));
    }

    private static OriginUnavailableException translate(Throwable failure, URI targetUri) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        if (cause instanceof HttpConnectTimeoutException) {
            return new OriginUnavailableException("Connect timeout to " + targetUri, cause);
        }
        if (cause instanceof HttpTimeoutException) {
            return new OriginUnavailableException("Read timeout from " + targetUri, cause);
        }
        if (cause instanceof ConnectException) {
            return new OriginUnavailableException("Connection refused by " + targetUri, cause);
        }
        if (cause instanceof IOException) {
            return new OriginUnavailableException("Failed to fetch " + targetUri + ": " + cause.getMessage(), cause);
        }
        return new OriginUnavailableException("Origin fetch failed for " + targetUri + ": " + cause, cause);
    }

    /**
     * Returns the underlying {@link HttpClient}. Package-private for testing.
     */
    HttpClient httpClient() {
        return httpClient;
    }

    private static boolean isRestrictedHeader(String name) {
        return RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT));
    }

    private static boolean isHopByHop(String lowerCaseName) {
        return HOP_BY_HOP_HEADERS.contains(lowerCaseName);
    }
}
