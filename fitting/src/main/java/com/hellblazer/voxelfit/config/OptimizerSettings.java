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

import java.util.Map;
import java.util.Objects;

/**
 * One optimization routine to run for a model: its name, patience and routine specific options.
 *
 * @param name     optimizer name, e.g. {@code Powell}
 * @param patience iteration budget multiplier; larger values allow more iterations before giving up
 * @param options  routine specific options
 */
public record OptimizerSettings(String name, int patience, Map<String, Object> options) {

    public static final int DEFAULT_PATIENCE = 2;

    public OptimizerSettings {
        Objects.requireNonNull(name, "name cannot be null");
        if (patience <= 0) {
            throw new IllegalArgumentException("patience must be positive: " + patience);
        }
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public OptimizerSettings(String name, int patience) {
        this(name, patience, Map.of());
    }
}
