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

import com.hellblazer.voxelfit.model.CascadeDefinition;

/**
 * S0 followed by ADC, the ADC fit starting from the fitted S0 map.
 */
public final class AdcCascade {

    public static final String NAME = "ADC (Cascade)";

    private AdcCascade() {
    }

    public static CascadeDefinition create() {
        return CascadeDefinition.builder(NAME)
                                .stage(new S0Model())
                                .stage(AdcModel.NAME,
                                       priors -> new AdcModel(priors.get(S0Model.NAME).get(S0Model.S0)))
                                .build();
    }
}
