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

package com.hellblazer.voxelfit.balancing;

import java.util.List;

/**
 * Splits work proportionally to each device's weight.
 */
public class WeightedDistribution extends WorkPartitioner {

    public WeightedDistribution() {
        this(Integer.MAX_VALUE);
    }

    public WeightedDistribution(int maxRangeSize) {
        super(maxRangeSize);
    }

    @Override
    protected double[] weights(List<DeviceDescriptor> devices) {
        return devices.stream().mapToDouble(DeviceDescriptor::weight).toArray();
    }
}
