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

import com.hellblazer.voxelfit.balancing.DeviceDescriptor;
import com.hellblazer.voxelfit.resource.DeviceMemoryManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * A compute device: a single command queue executing kernels in submission order, and the device memory the
 * workers on it allocate from.
 *
 * @author hal.hildebrand
 */
public class ComputeEnvironment implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ComputeEnvironment.class);

    private final DeviceDescriptor    device;
    private final ExecutorService     queue;
    private final DeviceMemoryManager memory;

    public ComputeEnvironment(DeviceDescriptor device) {
        this.device = Objects.requireNonNull(device, "device cannot be null");
        this.queue = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "voxelfit-" + device.name());
            t.setDaemon(true);
            return t;
        });
        this.memory = new DeviceMemoryManager(device.name(), device.memoryBytes());
        log.debug("Created compute environment for {}", device);
    }

    /**
     * One environment per device, in device order.
     */
    public static List<ComputeEnvironment> forDevices(List<DeviceDescriptor> devices) {
        var environments = new ArrayList<ComputeEnvironment>(devices.size());
        for (var device : devices) {
            environments.add(new ComputeEnvironment(device));
        }
        return environments;
    }

    /**
     * Close every environment, in order.
     */
    public static void closeAll(List<ComputeEnvironment> environments) {
        for (var environment : environments) {
            environment.close();
        }
    }

    public DeviceDescriptor getDevice() {
        return device;
    }

    public DeviceMemoryManager getMemory() {
        return memory;
    }

    /**
     * Enqueue work on this device's queue.
     */
    public <T> CompletableFuture<T> submit(Supplier<T> work) {
        return CompletableFuture.supplyAsync(work, queue);
    }

    @Override
    public void close() {
        queue.shutdown();
        try {
            if (!queue.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Queue of {} did not drain, interrupting", device.name());
                queue.shutdownNow();
            }
        } catch (InterruptedException e) {
            queue.shutdownNow();
            Thread.currentThread().interrupt();
        }
        memory.close();
    }

    @Override
    public String toString() {
        return "ComputeEnvironment[" + device.name() + "]";
    }
}
