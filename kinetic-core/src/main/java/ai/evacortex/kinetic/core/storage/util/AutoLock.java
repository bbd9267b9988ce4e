/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.storage.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Try-with-resources scope over one side of a {@link ReadWriteLock}.
 */
public final class AutoLock implements AutoCloseable {
    private final Lock lock;

    private AutoLock(Lock lock) {
        this.lock = lock;
    }

    public static AutoLock read(ReadWriteLock rw) {
        Lock lock = rw.readLock();
        lock.lock();
        return new AutoLock(lock);
    }

    /**
     * Acquires the write side, giving up after {@code timeout}.
     *
     * @throws IllegalStateException if the lock was not acquired in time or the wait was interrupted
     */
    public static AutoLock tryWrite(ReadWriteLock rw, Duration timeout) {
        Lock lock = rw.writeLock();
        try {
            if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IllegalStateException("Write lock not acquired within " + timeout.toMillis() + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for write lock", e);
        }
        return new AutoLock(lock);
    }

    @Override
    public void close() {
        lock.unlock();
    }
}
