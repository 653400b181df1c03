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

import com.hellblazer.voxelfit.balancing.DeviceDescriptor;
import com.hellblazer.voxelfit.balancing.WorkPartitioner;
import com.hellblazer.voxelfit.data.ProblemData;
import com.hellblazer.voxelfit.model.Model;

import java.util.List;

/**
 * Chunks of a fixed maximum number of voxels.
 */
public class VoxelRangeStrategy extends ChunkedProcessingStrategy {

    public static final String NAME               = "VoxelRange";
    public static final int    DEFAULT_MAX_VOXELS = 10_000;

    private final int maxVoxels;

    public VoxelRangeStrategy() {
        this(DEFAULT_MAX_VOXELS);
    }

    public VoxelRangeStrategy(int maxVoxels) {
        if (maxVoxels <= 0) {
            throw new IllegalArgumentException("maxVoxels must be positive: " + maxVoxels);
        }
        this.maxVoxels = maxVoxels;
    }

    @Override
    protected int chunkSize(Model model, ProblemData data, List<DeviceDescriptor> devices,
                            WorkPartitioner partitioner) {
        return maxVoxels;
    }

    public int getMaxVoxels() {
        return maxVoxels;
    }
}
