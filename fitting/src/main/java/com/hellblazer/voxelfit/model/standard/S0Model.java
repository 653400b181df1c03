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

package com.hellblazer.voxelfit.model.standard;

import com.hellblazer.voxelfit.compute.KernelContext;
import com.hellblazer.voxelfit.compute.VoxelKernel;
import com.hellblazer.voxelfit.model.AbstractModel;
import com.hellblazer.voxelfit.protocol.ColumnTable;

import java.util.List;

/**
 * The unweighted signal: the mean of the unweighted measurements of each voxel.
 *
 * @author hal.hildebrand
 */
public class S0Model extends AbstractModel {

    public static final String NAME = "S0";
    public static final String S0   = "S0.s0";

    public S0Model() {
        super(NAME, List.of(S0), List.of("b"));
    }

    @Override
    protected List<String> additionalProblems(ColumnTable protocol) {
        return protocol.unweightedIndices().length == 0 ? List.of("No unweighted measurements") : List.of();
    }

    @Override
    public VoxelKernel createKernel(KernelContext context) {
        var rows = context.protocol().unweightedIndices();
        return (voxel, observations, parameters) -> {
            double sum = 0;
            for (int row : rows) {
                sum += observations[row];
            }
            parameters[0] = rows.length == 0 ? Double.NaN : sum / rows.length;
        };
    }
}
