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

package com.hellblazer.voxelfit.data;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * The spatial positions included in a fit.
 *
 * <p>The mask has a volume shape, and an ascending list of the linear positions in that volume that hold a voxel of
 * the dataset. Voxel {@code i} of the dataset lives at {@code positions[i]}.
 *
 * @author hal.hildebrand
 */
public final class VoxelMask {

    private final int[] shape;
    private final int[] positions;

    public VoxelMask(int[] shape, int[] positions) {
        if (shape.length == 0 || Arrays.stream(shape).anyMatch(d -> d <= 0)) {
            throw new IllegalArgumentException("Invalid volume shape " + Arrays.toString(shape));
        }
        this.shape = shape.clone();
        this.positions = positions.clone();
        long total = totalPositions();
        for (int i = 0; i < positions.length; i++) {
            if (positions[i] < 0 || positions[i] >= total || (i > 0 && positions[i] <= positions[i - 1])) {
                throw new IllegalArgumentException("Mask positions must be ascending and inside the volume");
            }
        }
    }

    /**
     * A mask including every position of a one dimensional volume of {@code voxelCount} positions.
     */
    public static VoxelMask all(int voxelCount) {
        return new VoxelMask(new int[] { Math.max(voxelCount, 1) }, IntStream.range(0, voxelCount).toArray());
    }

    /**
     * A mask from a boolean volume in linear order.
     */
    public static VoxelMask fromVolume(int[] shape, boolean[] included) {
        return new VoxelMask(shape, IntStream.range(0, included.length).filter(i -> included[i]).toArray());
    }

    public int[] shape() {
        return shape.clone();
    }

    public int voxelCount() {
        return positions.length;
    }

    public long totalPositions() {
        long total = 1;
        for (int d : shape) {
            total *= d;
        }
        return total;
    }

    public int position(int voxel) {
        return positions[voxel];
    }

    /**
     * Scatter per voxel values back into volume order, filling positions outside the mask.
     */
    public double[] toVolume(double[] roiValues, double fill) {
        if (roiValues.length != positions.length) {
            throw new IllegalArgumentException(
            String.format("Expected %d values, got %d", positions.length, roiValues.length));
        }
        var volume = new double[Math.toIntExact(totalPositions())];
        Arrays.fill(volume, fill);
        for (int i = 0; i < positions.length; i++) {
            volume[positions[i]] = roiValues[i];
        }
        return volume;
    }
}
