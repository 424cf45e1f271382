package io.edgesim.core.model;

import io.edgesim.core.error.InvalidRegistrationException;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * The backing server a behavior fetches from.
 *
 * @param baseUrl absolute {@code http} or {@code https} URL without a trailing slash
 */
public record OriginTarget(String baseUrl) {

    public OriginTarget {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new InvalidRegistrationException("Origin base URL must not be blank", null);
        }
        baseUrl = baseUrl.trim();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        URI uri;
        try {
            uri = new URI(baseUrl);
        } catch (URISyntaxException e) {
            throw new InvalidRegistrationException("Invalid origin URL: " + baseUrl, e, null);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme) || uri.getHost() == null) {
            throw new InvalidRegistrationException("Origin URL must be an absolute http(s) URL: " + baseUrl, null);
        }
    }

    /** Absolute URI for the given request path and query. */
    public URI resolve(String pathWithQuery) {
        return URI.create(baseUrl + pathWithQuery);
    }
}
