package com.circuitsync.core.library;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes lookups of a delegate library, including misses.
 *
 * <p>The cache belongs to this instance; share the instance to share the cache.
 */
public class CachingSymbolLibrary implements SymbolLibrary {

    private static final Logger log = LoggerFactory.getLogger(CachingSymbolLibrary.class);

    private final SymbolLibrary delegate;
    private final Map<String, Optional<SymbolDefinition>> cache = new ConcurrentHashMap<>();

    public CachingSymbolLibrary(SymbolLibrary delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<SymbolDefinition> resolve(String typeId) {
        return cache.computeIfAbsent(typeId, id -> {
            log.debug("Symbol cache miss: {}", id);
            return delegate.resolve(id);
        });
    }

    public void clear() {
        cache.clear();
    }

    public int cachedEntries() {
        return cache.size();
    }
}
