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
 * Kinds of device-resident buffers owned by a compute worker
 */
public enum DeviceResourceType {
    INPUT_BUFFER("Input Buffer", "Read-only voxel measurements"),
    OUTPUT_BUFFER("Output Buffer", "Per-voxel parameter results"),
    SCRATCH_BUFFER("Scratch Buffer", "Kernel working memory");

    private final String displayName;
    private final String description;

    DeviceResourceType(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public boolean isReadOnly() {
        return this == INPUT_BUFFER;
    }
}
