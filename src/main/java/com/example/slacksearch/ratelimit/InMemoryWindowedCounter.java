package com.example.slacksearch.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Single-instance {@link WindowedCounter} for local runs and tests. Limits are per process,
 * so it must not back a horizontally scaled deployment.
 */
@Component
@ConditionalOnProperty(name = "app.impersonation.store", havingValue = "memory")
public class InMemoryWindowedCounter implements WindowedCounter {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryWindowedCounter.class);

    private final Clock clock;
    private final Duration entryTtl;
    private final Deque<Record> log = new ArrayDeque<>();

    public InMemoryWindowedCounter(Clock clock,
                                   @Value("${app.impersonation.entry-ttl-seconds:3600}") long entryTtlSeconds) {
        this.clock = clock;
        this.entryTtl = Duration.ofSeconds(entryTtlSeconds);
    }

    @Override
    public boolean recordAndCheck(String actingPrincipal, String targetIdentity, Duration window, int maxUnique) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        Set<String> distinct = new HashSet<>();

        synchronized (log) {
            log.addLast(new Record(targetIdentity, now));
            while (!log.isEmpty() && !log.peekFirst().timestamp.plus(entryTtl).isAfter(now)) {
                log.pollFirst();
            }
            for (Record record : log) {
                if (!record.timestamp.isBefore(cutoff)) {
                    distinct.add(record.targetIdentity);
                }
            }
        }

        logger.info("Local impersonation check: {}/{} unique users in last {}s (principal {})",
                distinct.size(), maxUnique, window.toSeconds(), actingPrincipal);
        return distinct.size() <= maxUnique;
    }

    private static final class Record {
        private final String targetIdentity;
        private final Instant timestamp;

        private Record(String targetIdentity, Instant timestamp) {
            this.targetIdentity = targetIdentity;
            this.timestamp = timestamp;
        }
    }
}
