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

package com.hellblazer.voxelfit.processing;

import com.hellblazer.voxelfit.cascade.StageResult;
import com.hellblazer.voxelfit.data.ProblemData;
import com.hellblazer.voxelfit.model.Model;

/**
 * Runs a model over all voxels of a dataset in resource bounded chunks, persisting each chunk as it completes.
 *
 * @author hal.hildebrand
 */
public interface ProcessingStrategy {

    /**
     * Fit the model to every voxel.
     *
     * <p>With {@code recalculate} the stored output of the model path is invalidated before any chunk is processed;
     * otherwise stored chunks are read back instead of recomputed.
     *
     * @return the fitted parameter maps, one value per voxel
     */
    StageResult run(Model model, ProblemData data, ResultStore store, String modelPath, boolean recalculate,
                    ProcessingContext context);
}
