package com.example.slacksearch.ratelimit;

import com.example.slacksearch.model.ImpersonationLogEntry;
import com.example.slacksearch.repo.ImpersonationLogRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoWindowedCounterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ImpersonationLogRepo logRepo;

    @Mock
    private MongoTemplate mongo;

    private MongoWindowedCounter counter;

    @BeforeEach
    void setUp() {
        counter = new MongoWindowedCounter(logRepo, mongo, Clock.fixed(NOW, ZoneOffset.UTC), 3600);
    }

    @Test
    void testRecordAndCheck_AppendsEntryWithExpiry() {
        // Given
        when(mongo.findDistinct(any(Query.class), eq("targetIdentity"), eq(ImpersonationLogEntry.class), eq(String.class)))
                .thenReturn(List.of("alice@example.com"));

        // When
        boolean allowed = counter.recordAndCheck("aibot-logic@p.iam", "alice@example.com", Duration.ofSeconds(60), 20);

        // Then
        assertTrue(allowed);
        ArgumentCaptor<ImpersonationLogEntry> entry = ArgumentCaptor.forClass(ImpersonationLogEntry.class);
        verify(logRepo).insert(entry.capture());
        assertEquals("aibot-logic@p.iam", entry.getValue().getActingPrincipal());
        assertEquals("alice@example.com", entry.getValue().getTargetIdentity());
        assertEquals(NOW, entry.getValue().getTimestamp());
        assertEquals(NOW.plusSeconds(3600), entry.getValue().getExpiresAt());
    }

    @Test
    void testRecordAndCheck_CountsOnlyTheTrailingWindow() {
        when(mongo.findDistinct(any(Query.class), eq("targetIdentity"), eq(ImpersonationLogEntry.class), eq(String.class)))
                .thenReturn(List.of());

        counter.recordAndCheck("aibot-logic@p.iam", "alice@example.com", Duration.ofSeconds(60), 20);

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongo).findDistinct(query.capture(), eq("targetIdentity"), eq(ImpersonationLogEntry.class), eq(String.class));
        Object bound = ((org.bson.Document) query.getValue().getQueryObject().get("timestamp")).get("$gte");
        Instant cutoff = bound instanceof Date ? ((Date) bound).toInstant() : (Instant) bound;
        assertEquals(NOW.minusSeconds(60), cutoff);
    }

    @Test
    void testRecordAndCheck_RejectsAboveLimit() {
        when(mongo.findDistinct(any(Query.class), eq("targetIdentity"), eq(ImpersonationLogEntry.class), eq(String.class)))
                .thenReturn(List.of("a", "b", "c"));

        assertFalse(counter.recordAndCheck("aibot-logic@p.iam", "c", Duration.ofSeconds(60), 2));
    }

    @Test
    void testRecordAndCheck_StoreFailurePropagates() {
        when(logRepo.insert(any(ImpersonationLogEntry.class))).thenThrow(new RuntimeException("mongo down"));

        assertThrows(RuntimeException.class,
                () -> counter.recordAndCheck("aibot-logic@p.iam", "alice@example.com", Duration.ofSeconds(60), 20));
        verifyNoInteractions(mongo);
    }
}
