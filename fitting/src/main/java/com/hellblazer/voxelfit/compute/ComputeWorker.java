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

package com.hellblazer.voxelfit.compute;

import com.hellblazer.voxelfit.balancing.WorkRange;
import com.hellblazer.voxelfit.data.Dataset;
import com.hellblazer.voxelfit.resource.DeviceBuffer;
import com.hellblazer.voxelfit.resource.DeviceResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a kernel over one range of voxels on one device.
 *
 * <p>The worker owns a read-only input buffer holding the measurements of its range as floats and an output buffer
 * receiving the fitted parameters at double precision. Both are allocated on construction, exclusively for this worker, and freed by
 * {@link #release()}. A worker dropped without release has its buffers reclaimed, and reported as leaked, when it is
 * garbage collected.
 *
 * @author hal.hildebrand
 */
public class ComputeWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ComputeWorker.class);

    private final ComputeEnvironment environment;
    private final WorkRange          range;
    private final int                measurementCount;
    private final int                parameterCount;
    private final VoxelKernel        kernel;
    private final DeviceBuffer       input;
    private final DeviceBuffer       output;
    private final AtomicBoolean      released = new AtomicBoolean();

    /**
     * @throws com.hellblazer.voxelfit.resource.DeviceMemoryExhaustedException if the device cannot hold the buffers
     */
    public ComputeWorker(ComputeEnvironment environment, WorkRange range, Dataset dataset, VoxelKernel kernel,
                         int parameterCount) {
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
        this.range = Objects.requireNonNull(range, "range cannot be null");
        this.kernel = Objects.requireNonNull(kernel, "kernel cannot be null");
        if (parameterCount <= 0) {
            throw new IllegalArgumentException("parameterCount must be positive: " + parameterCount);
        }
        this.measurementCount = dataset.measurementCount();
        this.parameterCount = parameterCount;

        var memory = environment.getMemory();
        this.input = memory.allocate(DeviceResourceType.INPUT_BUFFER,
                                     Math.multiplyExact(range.size(), measurementCount), "measurements " + range);
        try {
            this.output = memory.allocate(DeviceResourceType.OUTPUT_BUFFER,
                                          Math.multiplyExact(range.size(), parameterCount), Double.BYTES,
                                          "parameters " + range);
        } catch (RuntimeException e) {
            input.close();
            throw e;
        }
        dataset.copyRange(range, input.floats());
        log.debug("Worker for {} on {} staged {} measurements", range, environment.getDevice().name(),
                  range.size() * measurementCount);
    }

    /**
     * Fit the voxels of {@code subRange} asynchronously on the device queue. Completion implies the output region of
     * the range is valid.
     *
     * @param subRange a range within this worker's range
     */
    public CompletableFuture<WorkRange> calculate(WorkRange subRange) {
        checkRange(subRange);
        if (released.get()) {
            throw new IllegalStateException("Worker for " + range + " has been released");
        }
        return environment.submit(() -> {
            run(subRange);
            return subRange;
        });
    }

    private void run(WorkRange subRange) {
        var measurements = input.readOnlyFloats();
        var parameters = output.doubles();
        var observations = new float[measurementCount];
        var values = new double[parameterCount];
        for (int voxel = subRange.start(); voxel < subRange.end(); voxel++) {
            int local = voxel - range.start();
            measurements.get(local * measurementCount, observations);
            kernel.fit(voxel, observations, values);
            for (int p = 0; p < parameterCount; p++) {
                parameters.put(local * parameterCount + p, values[p]);
            }
        }
    }

    /**
     * Copy the fitted values of {@code subRange} into {@code target[parameter][voxel - targetOffset]}.
     */
    public void readResults(WorkRange subRange, double[][] target, int targetOffset) {
        checkRange(subRange);
        if (target.length != parameterCount) {
            throw new IllegalArgumentException(
            String.format("Expected %d parameter arrays, got %d", parameterCount, target.length));
        }
        var parameters = output.readOnlyDoubles();
        for (int voxel = subRange.start(); voxel < subRange.end(); voxel++) {
            int local = voxel - range.start();
            for (int p = 0; p < parameterCount; p++) {
                target[p][voxel - targetOffset] = parameters.get(local * parameterCount + p);
            }
        }
    }

    public WorkRange getRange() {
        return range;
    }

    public ComputeEnvironment getEnvironment() {
        return environment;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Free the device buffers. Only the first call has an effect.
     */
    public void release() {
        if (released.compareAndSet(false, true)) {
            try {
                input.close();
            } finally {
                output.close();
            }
            log.trace("Released worker for {}", range);
        }
    }

    @Override
    public void close() {
        release();
    }

    private void checkRange(WorkRange subRange) {
        if (!range.encloses(subRange)) {
            throw new IllegalArgumentException("Range " + subRange + " is outside the worker range " + range);
        }
    }

    @Override
    public String toString() {
        return String.format("ComputeWorker[range=%s, device=%s, released=%s]", range,
                             environment.getDevice().name(), released.get());
    }
}
