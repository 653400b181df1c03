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

package com.hellblazer.voxelfit.data;

import com.hellblazer.voxelfit.protocol.ColumnTable;

import java.util.Objects;

/**
 * Everything a fit reads: the measurements, the acquisition protocol describing each measurement and the mask
 * locating each voxel.
 *
 * @author hal.hildebrand
 */
public record ProblemData(Dataset dataset, ColumnTable protocol, VoxelMask mask) {

    public ProblemData {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        Objects.requireNonNull(protocol, "protocol cannot be null");
        Objects.requireNonNull(mask, "mask cannot be null");
        if (protocol.length() != dataset.measurementCount()) {
            throw new IllegalArgumentException(
            String.format("Protocol has %d rows but each voxel has %d measurements", protocol.length(),
                          dataset.measurementCount()));
        }
        if (mask.voxelCount() != dataset.voxelCount()) {
            throw new IllegalArgumentException(
            String.format("Mask holds %d voxels but the dataset has %d", mask.voxelCount(), dataset.voxelCount()));
        }
    }

    public int voxelCount() {
        return dataset.voxelCount();
    }

    /**
     * Restrict the protocol rows and the matching measurements.
     */
    public ProblemData selectMeasurements(int[] rows) {
        return new ProblemData(dataset.subset(rows), protocol.subset(rows), mask);
    }
}
