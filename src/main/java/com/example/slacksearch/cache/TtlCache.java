package com.example.slacksearch.cache;

import java.util.Optional;
import java.util.function.Function;

/**
 * Read-through cache whose entries expire a fixed time after they were written.
 * Entries are advisory: callers must always be able to re-derive a value from its source.
 */
public interface TtlCache<K, V> {

    Optional<V> get(K key);

    void put(K key, V value);

    void invalidate(K key);

    /**
     * Returns the cached value or loads, stores and returns it. A {@code null} from the loader
     * is returned as-is and not cached; loader exceptions propagate and nothing is cached.
     */
    default V getOrLoad(K key, Function<? super K, ? extends V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V loaded = loader.apply(key);
        if (loaded != null) {
            put(key, loaded);
        }
        return loaded;
    }
}
