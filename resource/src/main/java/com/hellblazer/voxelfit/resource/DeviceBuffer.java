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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.DoubleBuffer;
import java.nio.FloatBuffer;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * A device-resident buffer, owned by exactly one compute worker. Measurements are staged as 32 bit floats and
 * fitted parameters come back as 64 bit doubles.
 *
 * <p>Instances are created by {@link DeviceMemoryManager#allocate}; closing the buffer hands the memory back to the
 * manager that created it.
 */
public final class DeviceBuffer extends ResourceHandle<ByteBuffer> {

    private final DeviceResourceType type;
    private final long               sizeBytes;
    private final AtomicInteger      accessCount    = new AtomicInteger(0);
    private final AtomicLong         lastAccessTime = new AtomicLong(System.nanoTime());

    DeviceBuffer(ByteBuffer buffer, DeviceResourceType type, String description, ResourceTracker tracker,
                 Consumer<ByteBuffer> releaser) {
        super(buffer.order(ByteOrder.nativeOrder()), description, tracker, releaser);
        this.type = type;
        this.sizeBytes = buffer.capacity();
    }

    public DeviceResourceType getType() {
        return type;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    /**
     * Number of 32 bit elements this buffer holds
     */
    public int getElementCount() {
        return (int) (sizeBytes / Float.BYTES);
    }

    /**
     * A float view over the whole buffer. Input buffers are returned read-only once the host copy is complete.
     */
    public FloatBuffer floats() {
        recordAccess();
        var view = get().duplicate().order(ByteOrder.nativeOrder()).clear().asFloatBuffer();
        return view;
    }

    /**
     * A read-only float view, used by kernels reading measurements.
     */
    public FloatBuffer readOnlyFloats() {
        return floats().asReadOnlyBuffer();
    }

    /**
     * A double view over the whole buffer, used for fitted parameters.
     */
    public DoubleBuffer doubles() {
        recordAccess();
        return get().duplicate().order(ByteOrder.nativeOrder()).clear().asDoubleBuffer();
    }

    public DoubleBuffer readOnlyDoubles() {
        return doubles().asReadOnlyBuffer();
    }

    public ResourceStatistics getStatistics() {
        return new ResourceStatistics(sizeBytes, accessCount.get(), lastAccessTime.get());
    }

    private void recordAccess() {
        accessCount.incrementAndGet();
        lastAccessTime.set(System.nanoTime());
    }

    @Override
    public String toString() {
        return String.format("%s[id=%s, type=%s, size=%d bytes, age=%d ms]", getClass().getSimpleName(), getId(),
                             type, sizeBytes, getAgeMillis());
    }
}
