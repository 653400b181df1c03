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

package com.hellblazer.voxelfit;

import com.hellblazer.voxelfit.balancing.DeviceDescriptor;
import com.hellblazer.voxelfit.config.FittingConfiguration;
import com.hellblazer.voxelfit.data.Dataset;
import com.hellblazer.voxelfit.data.ProblemData;
import com.hellblazer.voxelfit.data.VoxelMask;
import com.hellblazer.voxelfit.protocol.ColumnTable;

import java.util.ArrayList;

/**
 * Noise free mono-exponential decay data with known S0 and ADC per voxel.
 */
public final class SyntheticData {

    public static final double[] B_VALUES = { 0, 0, 1e9, 1e9, 2e9, 2e9, 3e9 };

    private SyntheticData() {
    }

    public static ColumnTable protocol() {
        return new ColumnTable().addColumn("b", B_VALUES.clone());
    }

    public static double s0(int voxel) {
        return 1000.0 + voxel;
    }

    public static double adc(int voxel) {
        return 0.5e-9 + (voxel % 10) * 0.15e-9;
    }

    public static Dataset dataset(int voxels) {
        int measurements = B_VALUES.length;
        var values = new float[voxels * measurements];
        for (int v = 0; v < voxels; v++) {
            for (int m = 0; m < measurements; m++) {
                values[v * measurements + m] = (float) (s0(v) * Math.exp(-B_VALUES[m] * adc(v)));
            }
        }
        return new Dataset(voxels, measurements, values);
    }

    public static ProblemData problem(int voxels) {
        return new ProblemData(dataset(voxels), protocol(), VoxelMask.all(voxels));
    }

    /**
     * Default configuration on {@code count} equally weighted devices.
     */
    public static FittingConfiguration onDevices(int count, long memoryBytes) {
        var devices = new ArrayList<DeviceDescriptor>();
        for (int i = 0; i < count; i++) {
            devices.add(new DeviceDescriptor(i, "test-" + i, 1.0, memoryBytes));
        }
        return FittingConfiguration.defaultConfig().withDevices(devices);
    }
}
