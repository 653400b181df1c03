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

import java.util.Map;
import java.util.function.Function;

/**
 * Derives an additional map from the fitted parameter maps of a model.
 */
public interface ResultModifier {

    /**
     * Name of the derived map, e.g. {@code ADC.decay_b1000}.
     */
    String name();

    /**
     * @param maps the fitted maps by parameter name, one value per voxel
     * @return the derived map, one value per voxel
     */
    double[] apply(Map<String, double[]> maps);

    static ResultModifier of(String name, Function<Map<String, double[]>, double[]> function) {
        return new ResultModifier() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public double[] apply(Map<String, double[]> maps) {
                return function.apply(maps);
            }
        };
    }
}
