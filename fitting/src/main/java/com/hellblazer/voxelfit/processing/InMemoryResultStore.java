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
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Result store held in memory, for tests and single session runs.
 */
public class InMemoryResultStore implements ResultStore {

    private final Map<String, Map<WorkRange, Map<String, double[]>>> chunks    = new ConcurrentHashMap<>();
    private final Map<String, ColumnTable>                           protocols = new ConcurrentHashMap<>();

    @Override
    public boolean exists(String modelPath, WorkRange chunk) {
        var model = chunks.get(modelPath);
        return model != null && model.containsKey(chunk);
    }

    @Override
    public void write(String modelPath, WorkRange chunk, Map<String, double[]> values) {
        chunks.computeIfAbsent(modelPath, k -> new ConcurrentHashMap<>()).put(chunk, deepCopy(values));
    }

    @Override
    public List<WorkRange> chunks(String modelPath) {
        var model = chunks.get(modelPath);
        return model == null ? List.of() : model.keySet().stream().sorted().toList();
    }

    @Override
    public Map<String, double[]> read(String modelPath, WorkRange chunk) {
        var model = chunks.get(modelPath);
        var values = model == null ? null : model.get(chunk);
        if (values == null) {
            throw new IllegalStateException("No chunk " + chunk + " stored for " + modelPath);
        }
        return deepCopy(values);
    }

    @Override
    public void invalidate(String modelPath) {
        chunks.remove(modelPath);
        protocols.remove(modelPath);
    }

    @Override
    public void writeColumnTable(String modelPath, ColumnTable table) {
        protocols.put(modelPath, table.copy());
    }

    @Override
    public boolean isComplete(String modelPath) {
        return protocols.containsKey(modelPath);
    }

    public Optional<ColumnTable> getColumnTable(String modelPath) {
        return Optional.ofNullable(protocols.get(modelPath)).map(ColumnTable::copy);
    }

    public int chunkCount(String modelPath) {
        var model = chunks.get(modelPath);
        return model == null ? 0 : model.size();
    }

    private static Map<String, double[]> deepCopy(Map<String, double[]> values) {
        var copy = new LinkedHashMap<String, double[]>();
        values.forEach((name, v) -> copy.put(name, v.clone()));
        return copy;
    }
}
