package io.edgesim.core.cache;

import io.edgesim.core.model.CacheEntry;
import io.edgesim.core.model.ResponseArtifact;
import java.util.Optional;

/**
 * Content-addressed store of origin responses, keyed by request fingerprint
 * (see {@link CacheFingerprint}).
 *
 * <p>
 * At most one entry exists per fingerprint; {@link #store} overwrites. Entries
 * never expire: they live until {@link #purgeAll()}. Implementations must be
 * safe for concurrent use, and a lookup racing a purge must see either a hit or
 * a miss, never a partial entry.
 */
public interface ResponseCache {

    /**
     * Looks up the entry for {@code fingerprint}.
     *
     * @return the entry, or empty on a miss (including an unreadable entry)
     */
    Optional<CacheEntry> lookup(String fingerprint);

    /** Stores {@code response} under {@code fingerprint}, replacing any existing entry. */
    void store(String fingerprint, ResponseArtifact response);

    /**
     * Removes every entry.
     *
     * @return the number of entries removed
     */
    int purgeAll();

    /** Number of entries currently stored. */
    int size();
}
