package org.flagenums.core.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.NonNull;
import org.flagenums.core.Cache;
import org.flagenums.util.function.BiFunc;

/**
 * Caffeine backed cache without size bound or expiry. Entries live as long as the cache.
 */
public class MemoryCache<TK, TV> implements Cache<TK, TV> {
    final com.github.benmanes.caffeine.cache.Cache<TK, TV> cache;

    public MemoryCache() {
        this(Caffeine.newBuilder());
    }

    public MemoryCache(@NonNull Caffeine<Object, Object> builder) {
        cache = builder.build();
    }

    @Override
    public TV get(TK key) {
        return cache.getIfPresent(key);
    }

    @Override
    public TV get(@NonNull TK key, @NonNull BiFunc<TK, TV> loadingFunc) {
        return cache.get(key, loadingFunc);
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }
}
