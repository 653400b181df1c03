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

package com.hellblazer.voxelfit.model;

import com.hellblazer.voxelfit.compute.KernelContext;
import com.hellblazer.voxelfit.compute.VoxelKernel;
import com.hellblazer.voxelfit.protocol.ColumnTable;

import java.util.List;

/**
 * A model fitted independently per voxel.
 *
 * @author hal.hildebrand
 */
public interface Model extends Fittable {

    /**
     * Names of the fitted parameters, in the order the kernel writes them. Names are qualified by compartment, e.g.
     * {@code S0.s0}.
     */
    List<String> parameterNames();

    /**
     * Reasons the protocol cannot support this model; empty if it can.
     */
    List<String> problems(ColumnTable protocol);

    default boolean isSufficient(ColumnTable protocol) {
        return problems(protocol).isEmpty();
    }

    /**
     * Build a kernel for one worker. Called once per worker, so kernels may keep per-worker scratch state.
     */
    VoxelKernel createKernel(KernelContext context);

    /**
     * Maps derived from the fitted parameters after the fit.
     */
    default List<ResultModifier> modifiers() {
        return List.of();
    }
}
