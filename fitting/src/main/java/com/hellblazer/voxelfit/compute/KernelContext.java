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

import com.hellblazer.voxelfit.config.OptimizerSettings;
import com.hellblazer.voxelfit.protocol.ColumnTable;

import java.util.List;
import java.util.Objects;

/**
 * What a model needs to build its kernel: the protocol of the measurements being fitted and the optimizers to use.
 *
 * @param protocol       the protocol rows, matching the measurements handed to the kernel
 * @param optimizers     the optimizers to run, in order
 * @param extraOptimRuns how many times to repeat the optimizer sequence
 */
public record KernelContext(ColumnTable protocol, List<OptimizerSettings> optimizers, int extraOptimRuns) {

    public KernelContext {
        Objects.requireNonNull(protocol, "protocol cannot be null");
        optimizers = List.copyOf(optimizers);
        if (extraOptimRuns < 0) {
            throw new IllegalArgumentException("extraOptimRuns must be non-negative: " + extraOptimRuns);
        }
    }
}
