package org.listingwatch.tracker.service;

import lombok.extern.slf4j.Slf4j;
import org.listingwatch.tracker.store.ListingStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Two-layer "unchanged snapshot" check: Redis fast path keyed by listing id, then the
 * fingerprint table (authoritative). Redis failures only cost the fast path.
 */
@Service
@Slf4j
public class DeduplicationService {

    private static final String KEY_PREFIX = "listing-fingerprint:";

    private final StringRedisTemplate redisTemplate;
    private final ListingStore listingStore;
    private final boolean redisEnabled;
    private final Duration ttl;

    public DeduplicationService(StringRedisTemplate redisTemplate,
                                ListingStore listingStore,
                                @Value("${listings.dedup.redis-enabled:true}") boolean redisEnabled,
                                @Value("${listings.dedup.ttl-hours:24}") long ttlHours) {
        this.redisTemplate = redisTemplate;
        this.listingStore = listingStore;
        this.redisEnabled = redisEnabled;
        this.ttl = Duration.ofHours(ttlHours);
    }

    /**
     * @return true if {@code fingerprint} equals the last fingerprint applied to the listing
     */
    public boolean isUnchanged(String listingId, String fingerprint) {
        if (isUnchangedViaRedis(listingId, fingerprint)) {
            return true;
        }
        boolean unchanged = listingStore.findLastFingerprint(listingId)
                .map(fingerprint::equals)
                .orElse(false);
        if (unchanged) {
            log.debug("Unchanged snapshot detected via DB: listing={}", listingId);
        }
        return unchanged;
    }

    /**
     * Cache the fingerprint of a committed snapshot.
     */
    public void markProcessed(String listingId, String fingerprint) {
        if (!redisEnabled) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(buildKey(listingId), fingerprint, ttl);
            log.debug("Cached fingerprint for listing {}", listingId);
        } catch (Exception e) {
            log.warn("Failed to cache fingerprint for listing {}: {}", listingId, e.getMessage());
            evict(listingId);
        }
    }

    private boolean isUnchangedViaRedis(String listingId, String fingerprint) {
        if (!redisEnabled) {
            return false;
        }
        try {
            String cached = redisTemplate.opsForValue().get(buildKey(listingId));
            if (fingerprint.equals(cached)) {
                log.debug("Unchanged snapshot detected via Redis: listing={}", listingId);
                return true;
            }
        } catch (Exception e) {
            log.warn("Redis fingerprint check failed, falling back to DB: {}", e.getMessage());
        }
        return false;
    }

    // a stale cached fingerprint could hide a change back to an earlier state
    private void evict(String listingId) {
        try {
            redisTemplate.delete(buildKey(listingId));
        } catch (Exception e) {
            log.warn("Failed to evict cached fingerprint for listing {}: {}", listingId, e.getMessage());
        }
    }

    private String buildKey(String listingId) {
        return KEY_PREFIX + listingId;
    }
}
