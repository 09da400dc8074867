package org.listingwatch.tracker.service;

import org.junit.jupiter.api.Test;
import org.listingwatch.tracker.api.exception.ConflictException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ListingLockManagerTest {

    @Test
    void shouldSerializeSameListing() throws Exception {
        ListingLockManager lockManager = new ListingLockManager(5_000);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);

        List<Future<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            futures.add(pool.submit(() -> lockManager.withLock("domain:1", () -> {
                int now = inside.incrementAndGet();
                maxInside.accumulateAndGet(now, Math::max);
                sleep(2);
                inside.decrementAndGet();
                return now;
            })));
        }
        for (Future<Integer> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(1, maxInside.get());
        assertEquals(0, lockManager.activeLocks());
    }

    @Test
    void shouldNotBlockOtherListings() throws Exception {
        ListingLockManager lockManager = new ListingLockManager(5_000);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();

        Future<String> holder = pool.submit(() -> lockManager.withLock("domain:1", () -> {
            held.countDown();
            await(release);
            return "done";
        }));
        assertTrue(held.await(5, TimeUnit.SECONDS));

        assertEquals("other", lockManager.withLock("domain:2", () -> "other"));
        assertEquals(1, lockManager.activeLocks());

        release.countDown();
        assertEquals("done", holder.get(5, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(0, lockManager.activeLocks());
    }

    @Test
    void shouldTimeOutWithConflict() throws Exception {
        ListingLockManager lockManager = new ListingLockManager(50);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();

        Future<Object> holder = pool.submit(() -> lockManager.withLock("domain:1", () -> {
            held.countDown();
            await(release);
            return null;
        }));
        assertTrue(held.await(5, TimeUnit.SECONDS));

        ConflictException ex = assertThrows(ConflictException.class,
                () -> lockManager.withLock("domain:1", () -> "never"));
        assertEquals("domain:1", ex.getListingId());

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        pool.shutdown();
        assertEquals(0, lockManager.activeLocks());
    }

    @Test
    void shouldReleaseLockWhenActionFails() {
        ListingLockManager lockManager = new ListingLockManager(50);

        assertThrows(IllegalStateException.class, () -> lockManager.withLock("domain:1", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals("ok", lockManager.withLock("domain:1", () -> "ok"));
        assertEquals(0, lockManager.activeLocks());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
