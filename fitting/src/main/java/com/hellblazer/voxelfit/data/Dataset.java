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

import com.hellblazer.voxelfit.balancing.WorkRange;

import java.nio.FloatBuffer;
import java.util.Objects;

/**
 * Measurements of every voxel of a fit, stored voxel major: the measurements of one voxel are contiguous.
 *
 * <p>Immutable. Every voxel carries the same number of measurements.
 *
 * @author hal.hildebrand
 */
public final class Dataset {

    private final int     voxelCount;
    private final int     measurementCount;
    private final float[] values;

    public Dataset(int voxelCount, int measurementCount, float[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (voxelCount < 0 || measurementCount < 0) {
            throw new IllegalArgumentException(
            String.format("Invalid dimensions %d x %d", voxelCount, measurementCount));
        }
        if ((long) voxelCount * measurementCount != values.length) {
            throw new IllegalArgumentException(
            String.format("Expected %d values for %d voxels of %d measurements, got %d",
                          (long) voxelCount * measurementCount, voxelCount, measurementCount, values.length));
        }
        this.voxelCount = voxelCount;
        this.measurementCount = measurementCount;
        this.values = values.clone();
    }

    /**
     * Build a dataset from one measurement vector per voxel.
     */
    public static Dataset of(float[][] voxels) {
        int measurements = voxels.length == 0 ? 0 : voxels[0].length;
        var values = new float[voxels.length * measurements];
        for (int v = 0; v < voxels.length; v++) {
            if (voxels[v].length != measurements) {
                throw new IllegalArgumentException(
                String.format("Voxel %d has %d measurements, expected %d", v, voxels[v].length, measurements));
            }
            System.arraycopy(voxels[v], 0, values, v * measurements, measurements);
        }
        return new Dataset(voxels.length, measurements, values);
    }

    public int voxelCount() {
        return voxelCount;
    }

    public int measurementCount() {
        return measurementCount;
    }

    public float get(int voxel, int measurement) {
        Objects.checkIndex(voxel, voxelCount);
        Objects.checkIndex(measurement, measurementCount);
        return values[voxel * measurementCount + measurement];
    }

    public float[] voxel(int voxel) {
        Objects.checkIndex(voxel, voxelCount);
        var result = new float[measurementCount];
        System.arraycopy(values, voxel * measurementCount, result, 0, measurementCount);
        return result;
    }

    /**
     * A dataset holding only the given measurements of every voxel, in the given order.
     */
    public Dataset subset(int[] measurementIndices) {
        for (int m : measurementIndices) {
            Objects.checkIndex(m, measurementCount);
        }
        int width = measurementIndices.length;
        var selected = new float[voxelCount * width];
        for (int v = 0; v < voxelCount; v++) {
            int source = v * measurementCount;
            int target = v * width;
            for (int i = 0; i < width; i++) {
                selected[target + i] = values[source + measurementIndices[i]];
            }
        }
        return new Dataset(voxelCount, width, selected);
    }

    /**
     * Copy the measurements of the voxels in {@code range} into {@code target}, starting at its current position.
     *
     * @throws java.nio.BufferOverflowException if the target has insufficient space
     */
    public void copyRange(WorkRange range, FloatBuffer target) {
        if (range.end() > voxelCount) {
            throw new IndexOutOfBoundsException("Range " + range + " exceeds " + voxelCount + " voxels");
        }
        target.put(values, range.start() * measurementCount, range.size() * measurementCount);
    }

    @Override
    public String toString() {
        return String.format("Dataset[voxels=%d, measurements=%d]", voxelCount, measurementCount);
    }
}
