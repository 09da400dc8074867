package org.listingwatch.tracker.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.listingwatch.tracker.store.ListingStore;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DeduplicationServiceTest {

    private final StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
    @SuppressWarnings("unchecked")
    private final ValueOperations<String, String> valueOps = mock(ValueOperations.class);
    private final ListingStore listingStore = mock(ListingStore.class);

    private DeduplicationService service;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        service = new DeduplicationService(redisTemplate, listingStore, true, 24);
    }

    @Test
    void shouldShortCircuitOnRedisHit() {
        when(valueOps.get("listing-fingerprint:domain:1")).thenReturn("abc");

        assertTrue(service.isUnchanged("domain:1", "abc"));
        verifyNoInteractions(listingStore);
    }

    @Test
    void shouldFallBackToStoreOnRedisMiss() {
        when(valueOps.get(anyString())).thenReturn(null);
        when(listingStore.findLastFingerprint("domain:1")).thenReturn(Optional.of("abc"));

        assertTrue(service.isUnchanged("domain:1", "abc"));
        assertFalse(service.isUnchanged("domain:1", "def"));
    }

    @Test
    void shouldFallBackToStoreWhenRedisIsDown() {
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        when(listingStore.findLastFingerprint("domain:1")).thenReturn(Optional.empty());

        assertFalse(service.isUnchanged("domain:1", "abc"));
    }

    @Test
    void shouldCacheFingerprintWithTtl() {
        service.markProcessed("domain:1", "abc");

        verify(valueOps).set("listing-fingerprint:domain:1", "abc", Duration.ofHours(24));
    }

    @Test
    void shouldEvictWhenCachingFails() {
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOps).set(anyString(), anyString(), any(Duration.class));

        assertDoesNotThrow(() -> service.markProcessed("domain:1", "abc"));
        verify(redisTemplate).delete("listing-fingerprint:domain:1");
    }

    @Test
    void shouldSkipRedisWhenDisabled() {
        DeduplicationService disabled = new DeduplicationService(redisTemplate, listingStore, false, 24);
        when(listingStore.findLastFingerprint("domain:1")).thenReturn(Optional.of("abc"));

        assertTrue(disabled.isUnchanged("domain:1", "abc"));
        disabled.markProcessed("domain:1", "abc");
        verifyNoInteractions(valueOps);
    }
}
