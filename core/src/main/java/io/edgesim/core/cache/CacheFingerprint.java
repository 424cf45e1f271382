package io.edgesim.core.cache;

import io.edgesim.core.model.RequestEvent;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives the deterministic cache key of a request.
 *
 * <p>
 * The key is the SHA-256 (lowercase hex) of a canonical form built from:
 * <ol>
 * <li>the upper-cased method</li>
 * <li>the normalized path: duplicate slashes collapsed, {@code .} and
 * {@code ..} segments resolved</li>
 * <li>the query string with its parameters sorted</li>
 * <li>the values of the declared key headers, by lowercase name</li>
 * </ol>
 * Any header not declared does not affect the key. Thread-safe.
 */
public final class CacheFingerprint {

    private final List<String> keyHeaders;

    /** A fingerprint over method, path and query only. */
    public CacheFingerprint() {
        this(Set.of());
    }

    /**
     * @param keyHeaders header names (case-insensitive) whose values are part of the key
     */
    public CacheFingerprint(Collection<String> keyHeaders) {
        TreeSet<String> names = new TreeSet<>();
        for (String name : keyHeaders) {
            names.add(name.trim().toLowerCase(Locale.ROOT));
        }
        this.keyHeaders = List.copyOf(names);
    }

    /** The declared key headers, lowercase and sorted. */
    public List<String> keyHeaders() {
        return keyHeaders;
    }

    /**
     * Computes the fingerprint of {@code request}.
     *
     * @return 64 lowercase hex characters
     */
    public String fingerprint(RequestEvent request) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonicalForm(request).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** The newline-separated string that is hashed. */
    String canonicalForm(RequestEvent request) {
        StringBuilder sb = new StringBuilder();
        sb.append(request.method().toUpperCase(Locale.ROOT)).append('\n');
        sb.append(normalizePath(request.uri())).append('\n');
        sb.append(normalizeQuery(request.querystring())).append('\n');
        for (String name : keyHeaders) {
            sb.append(name).append(':').append(String.join(",", request.headers().all(name))).append('\n');
        }
        return sb.toString();
    }

    /**
     * Collapses duplicate slashes and resolves dot segments. A trailing slash is
     * kept, so {@code /a/} and {@code /a} remain distinct keys.
     */
    static String normalizePath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            sb.append('/').append(segment);
        }
        boolean trailingSlash = path.endsWith("/") || path.endsWith("/.") || path.endsWith("/..");
        if (sb.length() == 0 || trailingSlash) {
            sb.append('/');
        }
        return sb.toString();
    }

    /** Sorts {@code &}-separated parameters; empty parameters are dropped. */
    static String normalizeQuery(String query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        List<String> params = new ArrayList<>(Arrays.asList(query.split("&")));
        params.removeIf(String::isEmpty);
        params.sort(null);
        return String.join("&", params);
    }
}
