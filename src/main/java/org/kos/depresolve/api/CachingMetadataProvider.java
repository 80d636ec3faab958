package org.kos.depresolve.api;

import org.kos.depresolve.model.PackageMetadata;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A memoizing cache in front of another provider to avoid redundant lookups
 *
 * Negative results are cached too. Entries live until {@link #invalidate(String)}
 * or {@link #clear()} is called; deciding when the underlying data changed is
 * the owner's job. Not thread-safe.
 */
public class CachingMetadataProvider implements MetadataProvider {
    private final MetadataProvider delegate;
    private final Map<String, Optional<PackageMetadata>> cache;
    private int hits;
    private int misses;

    public CachingMetadataProvider(MetadataProvider delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
        this.cache = new HashMap<>();
    }

    @Override
    public Optional<PackageMetadata> lookup(String name) {
        Optional<PackageMetadata> cached = cache.get(name);
        if (cached != null) {
            hits++;
            return cached;
        }
        misses++;
        Optional<PackageMetadata> result = delegate.lookup(name);
        cache.put(name, result);
        return result;
    }

    /**
     * Check if a lookup result for a package is cached
     */
    public boolean isCached(String name) {
        return cache.containsKey(name);
    }

    /**
     * Drop the cached result for one package
     */
    public void invalidate(String name) {
        cache.remove(name);
    }

    /**
     * Clear the cache and its counters
     */
    public void clear() {
        cache.clear();
        hits = 0;
        misses = 0;
    }

    public int size() {
        return cache.size();
    }

    public int getHits() {
        return hits;
    }

    public int getMisses() {
        return misses;
    }
}
