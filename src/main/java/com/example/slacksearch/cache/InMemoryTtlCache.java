package com.example.slacksearch.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local {@link TtlCache}. Expiry is checked lazily on read; there is no sweeper.
 */
public class InMemoryTtlCache<K, V> implements TtlCache<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTtlCache.class);

    private final String name;
    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();

    public InMemoryTtlCache(String name, Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache " + name + " needs a positive TTL");
        }
        this.name = name;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public Optional<V> get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt)) {
            entries.remove(key, entry);
            logger.debug("Cache {} entry expired for key {}", name, key);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    @Override
    public void put(K key, V value) {
        entries.put(key, new Entry<>(value, clock.instant().plus(ttl)));
    }

    @Override
    public void invalidate(K key) {
        entries.remove(key);
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry<V> {
        private final V value;
        private final Instant expiresAt;

        private Entry(V value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
