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

import com.hellblazer.voxelfit.balancing.WorkRange;
import com.hellblazer.voxelfit.protocol.ColumnTable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable per-chunk output of model fits, keyed by model path, e.g. {@code S0} or {@code ADC (Cascade)/S0}.
 *
 * <p>A chunk is either absent or completely written. Each model path has a single writer at a time.
 *
 * @author hal.hildebrand
 */
public interface ResultStore {

    boolean exists(String modelPath, WorkRange chunk);

    /**
     * Durably record the values of a chunk.
     *
     * @param values map name to one value per voxel of the chunk
     */
    void write(String modelPath, WorkRange chunk, Map<String, double[]> values);

    /**
     * The stored chunks of the model path, ordered by start.
     */
    List<WorkRange> chunks(String modelPath);

    /**
     * @throws IllegalStateException if the chunk does not exist
     */
    Map<String, double[]> read(String modelPath, WorkRange chunk);

    /**
     * Merge every stored chunk of the model path into one map per name, whatever chunk layout wrote them.
     *
     * @throws IllegalStateException if the stored chunks do not cover {@code [0, voxelCount)} exactly once or lack a
     *                               name
     */
    default Map<String, double[]> readAll(String modelPath, List<String> names, int voxelCount) {
        var merged = new LinkedHashMap<String, double[]>();
        for (var name : names) {
            merged.put(name, new double[voxelCount]);
        }
        int covered = 0;
        for (var chunk : chunks(modelPath)) {
            if (chunk.start() != covered || chunk.end() > voxelCount) {
                throw new IllegalStateException(
                String.format("Stored chunks of %s do not tile [0, %d): found %s after %d", modelPath, voxelCount,
                              chunk, covered));
            }
            var values = read(modelPath, chunk);
            for (var name : names) {
                var chunkValues = values.get(name);
                if (chunkValues == null || chunkValues.length != chunk.size()) {
                    throw new IllegalStateException(
                    String.format("Stored chunk %s of %s lacks %d values for %s", chunk, modelPath, chunk.size(),
                                  name));
                }
                System.arraycopy(chunkValues, 0, merged.get(name), chunk.start(), chunk.size());
            }
            covered = chunk.end();
        }
        if (covered != voxelCount) {
            throw new IllegalStateException(
            String.format("Stored chunks of %s cover %d of %d voxels", modelPath, covered, voxelCount));
        }
        return merged;
    }

    /**
     * Remove every chunk and the recorded protocol of the model path.
     */
    void invalidate(String modelPath);

    /**
     * Record the protocol the model was fitted with, marking its output complete.
     */
    void writeColumnTable(String modelPath, ColumnTable table);

    /**
     * True once a fit of the model path has completed and recorded its protocol.
     */
    boolean isComplete(String modelPath);
}
