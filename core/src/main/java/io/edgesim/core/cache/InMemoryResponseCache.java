package io.edgesim.core.cache;

import io.edgesim.core.model.CacheEntry;
import io.edgesim.core.model.ResponseArtifact;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Non-durable {@link ResponseCache} backed by a concurrent map. */
public final class InMemoryResponseCache implements ResponseCache {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryResponseCache() {
        this(Clock.systemUTC());
    }

    public InMemoryResponseCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<CacheEntry> lookup(String fingerprint) {
        return Optional.ofNullable(entries.get(fingerprint));
    }

    @Override
    public void store(String fingerprint, ResponseArtifact response) {
        entries.put(fingerprint, new CacheEntry(fingerprint, response, clock.instant()));
    }

    @Override
    public int purgeAll() {
        int removed = 0;
        for (String key : entries.keySet()) {
            if (entries.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return entries.size();
    }
}
