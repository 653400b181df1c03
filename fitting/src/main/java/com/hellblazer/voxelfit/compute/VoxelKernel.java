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

/**
 * Fits a model to the measurements of one voxel.
 *
 * <p>A kernel instance is used by a single worker, on a single thread.
 */
@FunctionalInterface
public interface VoxelKernel {

    /**
     * Fit one voxel.
     *
     * @param voxel        index of the voxel in the dataset
     * @param observations the voxel's measurements, in protocol row order
     * @param parameters   receives the fitted parameter values, in the model's parameter order
     */
    void fit(int voxel, float[] observations, double[] parameters);
}
