package com.example.slacksearch.ratelimit;

import com.example.slacksearch.cache.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWindowedCounterTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);
    private static final String BOT = "aibot-logic@project.iam.gserviceaccount.com";

    private MutableClock clock;
    private InMemoryWindowedCounter counter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        counter = new InMemoryWindowedCounter(clock, 3600);
    }

    @Test
    void testRecordAndCheck_AllowsUpToLimitThenRejects() {
        for (int i = 1; i <= 20; i++) {
            assertTrue(counter.recordAndCheck(BOT, "user" + i + "@example.com", WINDOW, 20), "user " + i);
        }
        assertFalse(counter.recordAndCheck(BOT, "user21@example.com", WINDOW, 20));
    }

    @Test
    void testRecordAndCheck_RepeatedIdentityCountsOnce() {
        for (int i = 0; i < 50; i++) {
            assertTrue(counter.recordAndCheck(BOT, "alice@example.com", WINDOW, 1));
        }
    }

    @Test
    void testRecordAndCheck_WindowSlidesAndRecovers() {
        for (int i = 1; i <= 20; i++) {
            counter.recordAndCheck(BOT, "user" + i + "@example.com", WINDOW, 20);
        }
        assertFalse(counter.recordAndCheck(BOT, "user21@example.com", WINDOW, 20));

        clock.advance(Duration.ofSeconds(61));

        assertTrue(counter.recordAndCheck(BOT, "user22@example.com", WINDOW, 20));
    }

    @Test
    void testRecordAndCheck_RejectedAttemptIsStillRecorded() {
        counter.recordAndCheck(BOT, "a@example.com", WINDOW, 1);
        assertFalse(counter.recordAndCheck(BOT, "b@example.com", WINDOW, 1));

        // "b" is in the log now, so even "a" is over the limit until the window moves
        assertFalse(counter.recordAndCheck(BOT, "a@example.com", WINDOW, 1));
    }
}
