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

/**
 * Thrown when an allocation would exceed the memory available on a device.
 */
public class DeviceMemoryExhaustedException extends RuntimeException {

    private final long requestedBytes;
    private final long availableBytes;

    public DeviceMemoryExhaustedException(String device, long requestedBytes, long availableBytes) {
        super(String.format("Device %s cannot allocate %d bytes, only %d bytes available", device, requestedBytes,
                            availableBytes));
        this.requestedBytes = requestedBytes;
        this.availableBytes = availableBytes;
    }

    public long getRequestedBytes() {
        return requestedBytes;
    }

    public long getAvailableBytes() {
        return availableBytes;
    }
}
