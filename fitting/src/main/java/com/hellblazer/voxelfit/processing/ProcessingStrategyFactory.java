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

import com.hellblazer.voxelfit.ConfigurationException;
import com.hellblazer.voxelfit.config.StrategySettings;

/**
 * Builds processing strategies from their configured name and options.
 */
public final class ProcessingStrategyFactory {

    private ProcessingStrategyFactory() {
    }

    /**
     * @throws ConfigurationException for an unknown name or invalid options
     */
    public static ProcessingStrategy create(StrategySettings settings) {
        try {
            switch (settings.name()) {
                case VoxelRangeStrategy.NAME:
                    return new VoxelRangeStrategy(
                    settings.intOption("max_nmr_voxels", VoxelRangeStrategy.DEFAULT_MAX_VOXELS));
                case MemoryBudgetStrategy.NAME:
                    return new MemoryBudgetStrategy(
                    settings.doubleOption("memory_fraction", MemoryBudgetStrategy.DEFAULT_MEMORY_FRACTION),
                    settings.intOption("min_nmr_voxels", MemoryBudgetStrategy.DEFAULT_MIN_VOXELS));
                default:
                    throw new ConfigurationException("Unknown processing strategy: " + settings.name());
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid options for processing strategy " + settings.name(), e);
        }
    }
}
