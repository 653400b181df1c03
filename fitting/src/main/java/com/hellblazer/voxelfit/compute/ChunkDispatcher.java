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

import com.hellblazer.voxelfit.PartialFailureException;
import com.hellblazer.voxelfit.ResourceExhaustionException;
import com.hellblazer.voxelfit.balancing.DeviceDescriptor;
import com.hellblazer.voxelfit.balancing.WorkPartitioner;
import com.hellblazer.voxelfit.balancing.WorkRange;
import com.hellblazer.voxelfit.data.Dataset;
import com.hellblazer.voxelfit.resource.DeviceMemoryExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Processes one chunk of voxels across all compute devices.
 *
 * <p>The chunk is partitioned over the devices, one {@link ComputeWorker} is created per assigned range and all of
 * them run concurrently. Every worker is awaited before anything is read, and every worker is released before
 * {@link #process} returns, whether it succeeds or not.
 *
 * @author hal.hildebrand
 */
public class ChunkDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ChunkDispatcher.class);

    /**
     * Fit every voxel of the chunk.
     *
     * @param chunk          the voxels to fit
     * @param kernels        creates one kernel per worker
     * @param dataset        the measurements
     * @param parameterCount the number of values the kernel produces per voxel
     * @param environments   the devices to run on
     * @param partitioner    divides the chunk over the devices
     * @return {@code [parameter][voxel - chunk.start]}
     * @throws PartialFailureException     if any worker failed; no results are returned then
     * @throws ResourceExhaustionException if a device cannot hold the buffers of its range
     */
    public double[][] process(WorkRange chunk, Supplier<VoxelKernel> kernels, Dataset dataset, int parameterCount,
                              List<ComputeEnvironment> environments, WorkPartitioner partitioner) {
        var byDevice = new LinkedHashMap<DeviceDescriptor, ComputeEnvironment>();
        environments.forEach(e -> byDevice.put(e.getDevice(), e));
        var assignments = partitioner.partition(chunk.size(), new ArrayList<>(byDevice.keySet()));
        var results = new double[parameterCount][chunk.size()];

        var workers = new ArrayList<ComputeWorker>(assignments.size());
        try {
            for (var assignment : assignments) {
                var range = assignment.range().offset(chunk.start());
                workers.add(new ComputeWorker(byDevice.get(assignment.device()), range, dataset, kernels.get(),
                                              parameterCount));
            }

            var pending = new LinkedHashMap<ComputeWorker, CompletableFuture<WorkRange>>();
            for (var worker : workers) {
                pending.put(worker, worker.calculate(worker.getRange()));
            }

            Map<WorkRange, Throwable> failures = new LinkedHashMap<>();
            for (var entry : pending.entrySet()) {
                try {
                    entry.getValue().join();
                } catch (CompletionException e) {
                    var cause = e.getCause() == null ? e : e.getCause();
                    log.debug("Worker {} failed: {}", entry.getKey(), cause.toString());
                    failures.put(entry.getKey().getRange(), cause);
                }
            }
            if (!failures.isEmpty()) {
                throw new PartialFailureException(chunk, failures);
            }

            for (var worker : workers) {
                worker.readResults(worker.getRange(), results, chunk.start());
            }
            log.debug("Processed chunk {} with {} workers", chunk, workers.size());
            return results;
        } catch (DeviceMemoryExhaustedException e) {
            throw new ResourceExhaustionException("Cannot stage chunk " + chunk + ": " + e.getMessage(),
                                                  e.getRequestedBytes(), e.getAvailableBytes());
        } finally {
            for (var worker : workers) {
                worker.release();
            }
        }
    }

    /**
     * Devices taking part in this dispatch, in order.
     */
    public static List<DeviceDescriptor> devices(List<ComputeEnvironment> environments) {
        return environments.stream().map(ComputeEnvironment::getDevice).toList();
    }
}
