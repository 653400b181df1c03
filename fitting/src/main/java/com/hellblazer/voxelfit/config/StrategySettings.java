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

package com.hellblazer.voxelfit.config;

import com.hellblazer.voxelfit.ConfigurationException;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A processing strategy by name, with its options.
 *
 * @param name    strategy name, e.g. {@code VoxelRange} or {@code MemoryBudget}
 * @param options strategy options, e.g. {@code max_nmr_voxels}
 */
public record StrategySettings(String name, Map<String, Object> options) {

    public StrategySettings {
        Objects.requireNonNull(name, "name cannot be null");
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static StrategySettings of(String name) {
        return new StrategySettings(name, Map.of());
    }

    public int intOption(String key, int defaultValue) {
        return number(key).map(Number::intValue).orElse(defaultValue);
    }

    public double doubleOption(String key, double defaultValue) {
        return number(key).map(Number::doubleValue).orElse(defaultValue);
    }

    private Optional<Number> number(String key) {
        var value = options.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number n) {
            return Optional.of(n);
        }
        throw new ConfigurationException(
        String.format("Option %s of processing strategy %s must be numeric, was %s", key, name, value));
    }
}
