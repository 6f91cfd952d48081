package com.fvr.recommendation.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-key sliding window over admission timestamps. A request is admitted when
 * fewer than {@code maxRequests} admissions fall inside the trailing window.
 * Rejected requests are not recorded.
 */
public class SlidingWindowRateLimiter implements RateLimiter {
    private final int maxRequests;
    private final long windowMs;
    private final Clock clock;
    private final Map<String, Deque<Long>> buckets = new HashMap<>();
    private final Lock lock = new ReentrantLock();
    private long lastSweepAt = Long.MIN_VALUE;

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        this.maxRequests = maxRequests;
        this.windowMs = window == null ? 0L : window.toMillis();
        this.clock = clock;
    }

    @Override
    public boolean allow(String key) {
        if (maxRequests <= 0 || windowMs <= 0) {
            return true;
        }
        long now = clock.millis();
        long cutoff = now - windowMs;
        lock.lock();
        try {
            purgeExpired(now, cutoff);
            Deque<Long> bucket = buckets.computeIfAbsent(key, k -> new ArrayDeque<>());
            while (!bucket.isEmpty() && bucket.peekFirst() <= cutoff) {
                bucket.pollFirst();
            }
            if (bucket.size() >= maxRequests) {
                return false;
            }
            bucket.addLast(now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops buckets whose newest admission has left the window. Runs at most
     * once per window length.
     */
    private void purgeExpired(long now, long cutoff) {
        if (lastSweepAt != Long.MIN_VALUE && now - lastSweepAt < windowMs) {
            return;
        }
        lastSweepAt = now;
        Iterator<Deque<Long>> it = buckets.values().iterator();
        while (it.hasNext()) {
            Deque<Long> bucket = it.next();
            Long newest = bucket.peekLast();
            if (newest == null || newest <= cutoff) {
                it.remove();
            }
        }
    }

    int trackedKeys() {
        lock.lock();
        try {
            return buckets.size();
        } finally {
            lock.unlock();
        }
    }

    public long getWindowSeconds() {
        return Math.max(1L, windowMs / 1000L);
    }
}
