package com.example.slacksearch.cache;

import com.example.slacksearch.kv.KvClient;
import com.example.slacksearch.model.AccessDecision;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisTtlCacheTest {

    @Mock
    private KvClient kvClient;

    private RedisTtlCache<AccessDecision> cache;

    @BeforeEach
    void setUp() {
        cache = new RedisTtlCache<>("slacksearch:channels", Duration.ofSeconds(600), kvClient, new ObjectMapper(), AccessDecision.class);
    }

    @Test
    void testPut_WritesJsonUnderNamespaceWithTtl() {
        // Given
        AccessDecision decision = AccessDecision.builder().channelId("C1").permitted(true).channelName("general").build();

        // When
        cache.put("C1:U1", decision);

        // Then
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(kvClient).set(eq("slacksearch:channels:C1:U1"), json.capture(), eq(Duration.ofSeconds(600)));
        assertTrue(json.getValue().contains("\"permitted\":true"));
    }

    @Test
    void testGet_DecodesStoredValue() {
        when(kvClient.get("slacksearch:channels:C1:U1"))
                .thenReturn(Optional.of("{\"channelId\":\"C1\",\"permitted\":true,\"channelName\":\"general\"}"));

        Optional<AccessDecision> cached = cache.get("C1:U1");

        assertTrue(cached.isPresent());
        assertTrue(cached.get().isPermitted());
        assertEquals("general", cached.get().getChannelName());
    }

    @Test
    void testGet_StoreFailureReadsAsMiss() {
        when(kvClient.get(anyString())).thenThrow(new RuntimeException("connection refused"));

        assertEquals(Optional.empty(), cache.get("C1:U1"));
    }

    @Test
    void testGet_UndecodableEntryDiscarded() {
        when(kvClient.get("slacksearch:channels:C1:U1")).thenReturn(Optional.of("{not json"));

        assertEquals(Optional.empty(), cache.get("C1:U1"));
        verify(kvClient).del("slacksearch:channels:C1:U1");
    }

    @Test
    void testGet_UndecodableEntryWithFailingDeleteReadsAsMiss() {
        when(kvClient.get("slacksearch:channels:C1:U1")).thenReturn(Optional.of("{not json"));
        doThrow(new RuntimeException("connection refused")).when(kvClient).del(anyString());

        assertEquals(Optional.empty(), cache.get("C1:U1"));
    }

    @Test
    void testInvalidate_StoreFailureSwallowed() {
        doThrow(new RuntimeException("connection refused")).when(kvClient).del(anyString());

        assertDoesNotThrow(() -> cache.invalidate("C1:U1"));
        verify(kvClient).del("slacksearch:channels:C1:U1");
    }

    @Test
    void testPut_StoreFailureSwallowedAsAdvisory() {
        doThrow(new RuntimeException("connection refused")).when(kvClient).set(anyString(), anyString(), any(Duration.class));

        assertDoesNotThrow(() -> cache.put("C1:U1", AccessDecision.denied("C1")));
    }
}
