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

package com.hellblazer.voxelfit.cascade;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The maps produced by one fit: parameter or derived map name to one value per voxel.
 *
 * <p>Arrays are copied on the way in and on the way out, so a result cannot change once recorded.
 *
 * @param name the fitted model
 * @param maps values by map name, all of equal length
 * @author hal.hildebrand
 */
public record StageResult(String name, Map<String, double[]> maps) {

    public StageResult {
        Objects.requireNonNull(name, "name cannot be null");
        var copy = new LinkedHashMap<String, double[]>();
        int length = -1;
        for (var entry : maps.entrySet()) {
            if (length >= 0 && entry.getValue().length != length) {
                throw new IllegalArgumentException(
                String.format("Map %s has %d values, expected %d", entry.getKey(), entry.getValue().length, length));
            }
            length = entry.getValue().length;
            copy.put(entry.getKey(), entry.getValue().clone());
        }
        maps = Collections.unmodifiableMap(copy);
    }

    @Override
    public Map<String, double[]> maps() {
        var copy = new LinkedHashMap<String, double[]>();
        maps.forEach((mapName, values) -> copy.put(mapName, values.clone()));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * @throws IllegalArgumentException if there is no such map
     */
    public double[] get(String mapName) {
        return find(mapName).orElseThrow(
        () -> new IllegalArgumentException("No map " + mapName + " in results of " + name + ": " + maps.keySet()));
    }

    public Optional<double[]> find(String mapName) {
        return Optional.ofNullable(maps.get(mapName)).map(double[]::clone);
    }

    public List<String> mapNames() {
        return List.copyOf(maps.keySet());
    }

    public int voxelCount() {
        return maps.isEmpty() ? 0 : maps.values().iterator().next().length;
    }

    /**
     * These results with an additional map.
     */
    public StageResult with(String mapName, double[] values) {
        var extended = new LinkedHashMap<>(this.maps);
        extended.put(mapName, values);
        return new StageResult(name, extended);
    }
}
