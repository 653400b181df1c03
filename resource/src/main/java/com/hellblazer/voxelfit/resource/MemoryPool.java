/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of VoxelFit.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.voxelfit.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe pool of direct buffers keyed by exact capacity.
 *
 * <p>Consecutive chunks of one model run allocate identically sized worker buffers, so returned buffers are kept for
 * reuse until they exceed the idle time or the pool exceeds its byte ceiling.
 */
public class MemoryPool {
    private static final Logger log = LoggerFactory.getLogger(MemoryPool.class);

    private final Map<Integer, Queue<PooledBuffer>> pools            = new ConcurrentHashMap<>();
    private final long                              maxPoolSizeBytes;
    private final Duration                          maxIdleTime;
    private final AtomicLong                        currentSizeBytes = new AtomicLong(0);
    private final AtomicLong                        hitCount         = new AtomicLong(0);
    private final AtomicLong                        missCount        = new AtomicLong(0);
    private final AtomicLong                        evictionCount    = new AtomicLong(0);

    public MemoryPool(long maxPoolSizeBytes, Duration maxIdleTime) {
        if (maxPoolSizeBytes < 0) {
            throw new IllegalArgumentException("Max pool size must be non-negative");
        }
        if (maxIdleTime == null || maxIdleTime.isNegative()) {
            throw new IllegalArgumentException("Max idle time must be non-negative");
        }
        this.maxPoolSizeBytes = maxPoolSizeBytes;
        this.maxIdleTime = maxIdleTime;
    }

    /**
     * Take a zeroed buffer of exactly {@code sizeBytes} from the pool, or allocate one.
     */
    public ByteBuffer allocate(int sizeBytes) {
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("Size must be non-negative");
        }
        var queue = pools.get(sizeBytes);
        if (queue != null) {
            PooledBuffer pooled;
            while ((pooled = queue.poll()) != null) {
                currentSizeBytes.addAndGet(-sizeBytes);
                if (pooled.isExpired(maxIdleTime)) {
                    evictionCount.incrementAndGet();
                    continue;
                }
                hitCount.incrementAndGet();
                var buffer = pooled.buffer.clear();
                zero(buffer);
                return buffer;
            }
        }
        missCount.incrementAndGet();
        return ByteBuffer.allocateDirect(sizeBytes);
    }

    /**
     * Hand a buffer back for reuse. Buffers that would push the pool over its ceiling are dropped.
     */
    public void returnToPool(ByteBuffer buffer) {
        if (buffer == null || !buffer.isDirect() || buffer.capacity() == 0) {
            return;
        }
        int capacity = buffer.capacity();
        if (currentSizeBytes.addAndGet(capacity) > maxPoolSizeBytes) {
            currentSizeBytes.addAndGet(-capacity);
            evictionCount.incrementAndGet();
            log.trace("Pool full, dropping buffer of {} bytes", capacity);
            return;
        }
        pools.computeIfAbsent(capacity, k -> new ConcurrentLinkedQueue<>()).offer(new PooledBuffer(buffer));
    }

    /**
     * Drop every buffer idle for longer than the configured idle time.
     */
    public void evictExpired() {
        for (var queue : pools.values()) {
            var iter = queue.iterator();
            while (iter.hasNext()) {
                var pooled = iter.next();
                if (pooled.isExpired(maxIdleTime)) {
                    iter.remove();
                    currentSizeBytes.addAndGet(-pooled.buffer.capacity());
                    evictionCount.incrementAndGet();
                }
            }
        }
    }

    public void clear() {
        pools.clear();
        currentSizeBytes.set(0);
    }

    public long getCurrentSize() {
        return currentSizeBytes.get();
    }

    public double getHitRate() {
        long hits = hitCount.get();
        long total = hits + missCount.get();
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public long getEvictionCount() {
        return evictionCount.get();
    }

    private static void zero(ByteBuffer buffer) {
        while (buffer.remaining() >= Long.BYTES) {
            buffer.putLong(0L);
        }
        while (buffer.hasRemaining()) {
            buffer.put((byte) 0);
        }
        buffer.clear();
    }

    private static class PooledBuffer {
        final ByteBuffer buffer;
        final Instant    addedTime;

        PooledBuffer(ByteBuffer buffer) {
            this.buffer = buffer;
            this.addedTime = Instant.now();
        }

        boolean isExpired(Duration maxIdleTime) {
            return Duration.between(addedTime, Instant.now()).compareTo(maxIdleTime) > 0;
        }
    }
}
