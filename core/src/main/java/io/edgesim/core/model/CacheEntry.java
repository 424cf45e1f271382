package io.edgesim.core.model;

import java.time.Instant;

/**
 * A stored origin response.
 *
 * @param fingerprint deterministic request key
 * @param response    the origin response as fetched
 * @param storedAt    when the entry was written
 */
public record CacheEntry(String fingerprint, ResponseArtifact response, Instant storedAt) {}
