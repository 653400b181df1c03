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
import com.hellblazer.voxelfit.compute.ChunkDispatcher;
import com.hellblazer.voxelfit.compute.ComputeEnvironment;
import com.hellblazer.voxelfit.compute.KernelContext;

import java.util.List;
import java.util.Objects;

/**
 * Where and how a processing strategy runs the chunks of one model.
 *
 * @param environments  the compute devices
 * @param partitioner   divides each chunk over the devices
 * @param dispatcher    runs a chunk on the devices
 * @param kernelContext handed to the model to build its kernels
 */
public record ProcessingContext(List<ComputeEnvironment> environments, WorkPartitioner partitioner,
                                ChunkDispatcher dispatcher, KernelContext kernelContext) {

    public ProcessingContext {
        environments = List.copyOf(environments);
        Objects.requireNonNull(partitioner, "partitioner cannot be null");
        Objects.requireNonNull(dispatcher, "dispatcher cannot be null");
        Objects.requireNonNull(kernelContext, "kernelContext cannot be null");
    }

    public List<DeviceDescriptor> devices() {
        return ChunkDispatcher.devices(environments);
    }
}
