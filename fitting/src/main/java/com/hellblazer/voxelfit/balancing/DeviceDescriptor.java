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

package com.hellblazer.voxelfit.balancing;

import java.util.Objects;

/**
 * A compute device: its position in the configured device list, a name, a relative speed weight and the memory
 * available to fitting on it.
 *
 * @param index       position in the configured device list
 * @param name        human readable device name
 * @param weight      relative speed or priority, must be positive to receive work
 * @param memoryBytes memory available for worker buffers
 * @author hal.hildebrand
 */
public record DeviceDescriptor(int index, String name, double weight, long memoryBytes) {

    public static final long DEFAULT_MEMORY_BYTES = 256L * 1024 * 1024;

    public DeviceDescriptor {
        Objects.requireNonNull(name, "name cannot be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
        if (memoryBytes <= 0) {
            throw new IllegalArgumentException("memoryBytes must be positive: " + memoryBytes);
        }
    }

    /**
     * A single host device using the available processors as its weight.
     */
    public static DeviceDescriptor host() {
        return new DeviceDescriptor(0, "cpu-0", Runtime.getRuntime().availableProcessors(), DEFAULT_MEMORY_BYTES);
    }
}
