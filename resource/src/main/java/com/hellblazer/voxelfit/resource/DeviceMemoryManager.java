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
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accounts for the memory of a single compute device.
 *
 * <p>Every buffer a worker uses is allocated here, so the manager always knows how much of the device is in use and
 * can refuse allocations beyond the device capacity. Released buffers go back to a {@link MemoryPool} for the next
 * chunk.
 */
public class DeviceMemoryManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DeviceMemoryManager.class);

    private final String                                 deviceName;
    private final long                                   capacityBytes;
    private final ResourceTracker                        tracker;
    private final MemoryPool                             memoryPool;
    private final AtomicLong                             allocatedBytes = new AtomicLong(0);
    private final Map<DeviceResourceType, AtomicLong>    bytesPerType   = new EnumMap<>(DeviceResourceType.class);
    private volatile boolean                             closed         = false;

    public DeviceMemoryManager(String deviceName, long capacityBytes) {
        this(deviceName, capacityBytes, new ResourceTracker());
    }

    public DeviceMemoryManager(String deviceName, long capacityBytes, ResourceTracker tracker) {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("Device capacity must be positive: " + capacityBytes);
        }
        this.deviceName = deviceName;
        this.capacityBytes = capacityBytes;
        this.tracker = tracker;
        this.memoryPool = new MemoryPool(capacityBytes / 4, Duration.ofMinutes(1));
        for (var type : DeviceResourceType.values()) {
            bytesPerType.put(type, new AtomicLong(0));
        }
        log.debug("Device memory manager for {} initialized with {} bytes", deviceName, capacityBytes);
    }

    /**
     * Allocate a buffer holding {@code elementCount} 32 bit values.
     *
     * @throws DeviceMemoryExhaustedException if the device cannot hold the buffer
     */
    public DeviceBuffer allocate(DeviceResourceType type, int elementCount, String description) {
        return allocate(type, elementCount, Float.BYTES, description);
    }

    /**
     * Allocate a buffer holding {@code elementCount} values of {@code elementBytes} each.
     *
     * @throws DeviceMemoryExhaustedException if the device cannot hold the buffer
     */
    public DeviceBuffer allocate(DeviceResourceType type, int elementCount, int elementBytes, String description) {
        ensureNotClosed();
        if (elementCount < 0) {
            throw new IllegalArgumentException("Element count must be non-negative: " + elementCount);
        }
        if (elementBytes <= 0) {
            throw new IllegalArgumentException("Element size must be positive: " + elementBytes);
        }
        long sizeBytes = (long) elementCount * elementBytes;
        if (sizeBytes > Integer.MAX_VALUE) {
            throw new DeviceMemoryExhaustedException(deviceName, sizeBytes, getAvailableBytes());
        }
        long total = allocatedBytes.addAndGet(sizeBytes);
        if (total > capacityBytes) {
            allocatedBytes.addAndGet(-sizeBytes);
            throw new DeviceMemoryExhaustedException(deviceName, sizeBytes, capacityBytes - (total - sizeBytes));
        }
        bytesPerType.get(type).addAndGet(sizeBytes);

        var buffer = memoryPool.allocate((int) sizeBytes);
        var deviceBuffer = new DeviceBuffer(buffer, type, description, tracker, b -> reclaim(type, b));
        log.trace("Allocated {} on {}", deviceBuffer, deviceName);
        return deviceBuffer;
    }

    private void reclaim(DeviceResourceType type, ByteBuffer buffer) {
        long size = buffer.capacity();
        allocatedBytes.addAndGet(-size);
        bytesPerType.get(type).addAndGet(-size);
        if (!closed) {
            memoryPool.returnToPool(buffer);
        }
    }

    public String getDeviceName() {
        return deviceName;
    }

    public long getCapacityBytes() {
        return capacityBytes;
    }

    public long getAllocatedBytes() {
        return allocatedBytes.get();
    }

    public long getAllocatedBytes(DeviceResourceType type) {
        return bytesPerType.get(type).get();
    }

    public long getAvailableBytes() {
        return capacityBytes - allocatedBytes.get();
    }

    public ResourceTracker getTracker() {
        return tracker;
    }

    public MemoryPool getMemoryPool() {
        return memoryPool;
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Device memory manager for " + deviceName + " is closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        memoryPool.clear();
        int outstanding = tracker.getActiveCount();
        if (outstanding > 0) {
            log.warn("Closing device {} with {} buffers still allocated ({} bytes)", deviceName, outstanding,
                     allocatedBytes.get());
        }
    }

    @Override
    public String toString() {
        return String.format("DeviceMemoryManager[device=%s, allocated=%d/%d bytes]", deviceName,
                             allocatedBytes.get(), capacityBytes);
    }
}
