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

package com.hellblazer.voxelfit.processing;

import com.hellblazer.voxelfit.ConfigurationException;
import com.hellblazer.voxelfit.ResourceExhaustionException;
import com.hellblazer.voxelfit.balancing.DeviceDescriptor;
import com.hellblazer.voxelfit.balancing.WorkPartitioner;
import com.hellblazer.voxelfit.data.ProblemData;
import com.hellblazer.voxelfit.model.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Chunks sized so that every device's share of a chunk fits a fraction of that device's memory.
 *
 * <p>A voxel needs {@code 4 * measurements + 8 * parameters} bytes of device buffers, so device {@code i} holds
 * {@code floor(memory_i * fraction / bytesPerVoxel)} voxels. The chunk is the largest one the partitioner divides
 * without exceeding any of these capacities, which accounts for unequal device weights.
 *
 * @author hal.hildebrand
 */
public class MemoryBudgetStrategy extends ChunkedProcessingStrategy {
    private static final Logger log = LoggerFactory.getLogger(MemoryBudgetStrategy.class);

    public static final String NAME                    = "MemoryBudget";
    public static final double DEFAULT_MEMORY_FRACTION = 0.5;
    public static final int    DEFAULT_MIN_VOXELS      = 1;

    private final double memoryFraction;
    private final int    minVoxels;

    public MemoryBudgetStrategy() {
        this(DEFAULT_MEMORY_FRACTION, DEFAULT_MIN_VOXELS);
    }

    public MemoryBudgetStrategy(double memoryFraction, int minVoxels) {
        if (!(memoryFraction > 0 && memoryFraction <= 1)) {
            throw new IllegalArgumentException("memoryFraction must be in (0, 1]: " + memoryFraction);
        }
        if (minVoxels <= 0) {
            throw new IllegalArgumentException("minVoxels must be positive: " + minVoxels);
        }
        this.memoryFraction = memoryFraction;
        this.minVoxels = minVoxels;
    }

    /**
     * @throws ResourceExhaustionException if the minimum chunk does not fit the device budgets
     */
    @Override
    protected int chunkSize(Model model, ProblemData data, List<DeviceDescriptor> devices,
                            WorkPartitioner partitioner) {
        if (devices.isEmpty()) {
            throw new ConfigurationException("No compute devices available for " + model.name());
        }
        long bytesPerVoxel = (long) Float.BYTES * data.dataset().measurementCount()
                             + (long) Double.BYTES * model.parameterNames().size();
        var capacities = new long[devices.size()];
        long smallestBudget = Long.MAX_VALUE;
        for (int i = 0; i < capacities.length; i++) {
            long budget = (long) Math.floor(devices.get(i).memoryBytes() * memoryFraction);
            smallestBudget = Math.min(smallestBudget, budget);
            capacities[i] = budget / bytesPerVoxel;
        }
        int chunk = partitioner.largestFitting(Integer.MAX_VALUE, devices, capacities);
        if (chunk < minVoxels) {
            throw new ResourceExhaustionException(
            String.format("A chunk of %d voxels of %s does not fit the device budgets", minVoxels, model.name()),
            minVoxels * bytesPerVoxel, smallestBudget);
        }
        log.debug("Device capacities {} voxels at {} bytes per voxel, chunk of {} voxels",
                  Arrays.toString(capacities), bytesPerVoxel, chunk);
        return chunk;
    }

    @Override
    protected int minimumChunkSize() {
        return minVoxels;
    }

    public double getMemoryFraction() {
        return memoryFraction;
    }
}
