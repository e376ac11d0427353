package com.example.slacksearch.ratelimit;

import com.example.slacksearch.model.ImpersonationLogEntry;
import com.example.slacksearch.repo.ImpersonationLogRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * {@link WindowedCounter} over the {@code impersonation_log} collection. Single-document inserts
 * only; the distinct reduction runs server side.
 */
@Component
@ConditionalOnProperty(name = "app.impersonation.store", havingValue = "mongo", matchIfMissing = true)
public class MongoWindowedCounter implements WindowedCounter {

    private static final Logger logger = LoggerFactory.getLogger(MongoWindowedCounter.class);

    private final ImpersonationLogRepo logRepo;
    private final MongoTemplate mongo;
    private final Clock clock;
    private final Duration entryTtl;

    public MongoWindowedCounter(ImpersonationLogRepo logRepo, MongoTemplate mongo, Clock clock,
                                @Value("${app.impersonation.entry-ttl-seconds:3600}") long entryTtlSeconds) {
        this.logRepo = logRepo;
        this.mongo = mongo;
        this.clock = clock;
        this.entryTtl = Duration.ofSeconds(entryTtlSeconds);
    }

    @Override
    public boolean recordAndCheck(String actingPrincipal, String targetIdentity, Duration window, int maxUnique) {
        Instant now = clock.instant();

        logRepo.insert(ImpersonationLogEntry.builder()
                .actingPrincipal(actingPrincipal)
                .targetIdentity(targetIdentity)
                .timestamp(now)
                .expiresAt(now.plus(entryTtl))
                .build());

        Query inWindow = Query.query(Criteria.where("timestamp").gte(now.minus(window)));
        List<String> distinct = mongo.findDistinct(inWindow, "targetIdentity", ImpersonationLogEntry.class, String.class);

        logger.info("Global impersonation check: {}/{} unique users in last {}s",
                distinct.size(), maxUnique, window.toSeconds());
        return distinct.size() <= maxUnique;
    }
}
