package org.listingwatch.tracker.service;

import lombok.extern.slf4j.Slf4j;
import org.listingwatch.tracker.api.exception.ConflictException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per listing id. Entries exist only while some thread holds or waits on them,
 * so the map does not grow with the number of listings ever seen.
 */
@Component
@Slf4j
public class ListingLockManager {

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final long lockTimeoutMs;

    public ListingLockManager(@Value("${listings.ingestion.lock-timeout-ms:5000}") long lockTimeoutMs) {
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * Run {@code action} while holding the lock for {@code listingId}.
     *
     * @throws ConflictException if the lock is not acquired within the configured timeout
     */
    public <T> T withLock(String listingId, Supplier<T> action) {
        LockEntry entry = locks.compute(listingId, (id, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.references++;
            return e;
        });
        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.warn("Timed out after {} ms waiting for lock on listing {}", lockTimeoutMs, listingId);
                throw new ConflictException(listingId, "Timed out waiting for listing lock");
            }
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConflictException(listingId, "Interrupted waiting for listing lock", e);
        } finally {
            if (acquired) {
                entry.lock.unlock();
            }
            locks.computeIfPresent(listingId, (id, e) -> --e.references == 0 ? null : e);
        }
    }

    /**
     * Number of listings currently locked or waited on.
     */
    public int activeLocks() {
        return locks.size();
    }

    // references is only touched inside ConcurrentHashMap.compute for the entry's key
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int references;
    }
}
