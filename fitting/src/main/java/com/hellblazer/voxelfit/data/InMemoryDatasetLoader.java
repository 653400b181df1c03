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
 * Serves problem data already held in memory. Every load returns data with its own copy of the protocol, so callers
 * may adjust the columns without affecting later loads.
 */
public class InMemoryDatasetLoader implements DatasetLoader {

    private final Dataset     dataset;
    private final ColumnTable protocol;
    private final VoxelMask   mask;

    public InMemoryDatasetLoader(Dataset dataset, ColumnTable protocol) {
        this(dataset, protocol, VoxelMask.all(dataset.voxelCount()));
    }

    public InMemoryDatasetLoader(Dataset dataset, ColumnTable protocol, VoxelMask mask) {
        this.dataset = Objects.requireNonNull(dataset, "dataset cannot be null");
        this.protocol = Objects.requireNonNull(protocol, "protocol cannot be null");
        this.mask = Objects.requireNonNull(mask, "mask cannot be null");
    }

    @Override
    public ProblemData load() {
        return new ProblemData(dataset, protocol.copy(), mask);
    }
}
