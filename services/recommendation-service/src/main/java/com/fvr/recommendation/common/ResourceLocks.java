package com.fvr.recommendation.common;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Coarse mutual-exclusion domains around the shared stores: video metadata and
 * embeddings, per-user likes, and the ANN index. Callers take one lock at a time
 * and never call into another domain while holding one.
 */
@Component
public class ResourceLocks {
    private final Lock metadataLock = new ReentrantLock();
    private final Lock likesLock = new ReentrantLock();
    private final Lock indexLock = new ReentrantLock();

    public <T> T withMetadata(Supplier<T> work) {
        return withLock(metadataLock, work);
    }

    public <T> T withLikes(Supplier<T> work) {
        return withLock(likesLock, work);
    }

    public <T> T withIndex(Supplier<T> work) {
        return withLock(indexLock, work);
    }

    public void runWithMetadata(Runnable work) {
        withLock(metadataLock, () -> {
            work.run();
            return null;
        });
    }

    private static <T> T withLock(Lock lock, Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
