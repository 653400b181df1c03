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

package com.hellblazer.voxelfit.protocol;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * The closed set of columns a {@link ColumnTable} can estimate from its real columns.
 *
 * <p>Each constant is a pure function of the table. Lookup is by exact column name.
 */
public enum VirtualColumn {
    B("b", table -> SequenceTimings.estimate(table).bValues()),
    BIG_DELTA("Delta", table -> SequenceTimings.estimate(table).bigDelta()),
    SMALL_DELTA("delta", table -> SequenceTimings.estimate(table).smallDelta()),
    G("G", table -> SequenceTimings.estimate(table).gradientAmplitude());

    private final String                          columnName;
    private final Function<ColumnTable, double[]> generator;

    VirtualColumn(String columnName, Function<ColumnTable, double[]> generator) {
        this.columnName = columnName;
        this.generator = generator;
    }

    public static Optional<VirtualColumn> forName(String name) {
        return Arrays.stream(values()).filter(v -> v.columnName.equals(name)).findFirst();
    }

    public String columnName() {
        return columnName;
    }

    /**
     * Derive this column from the real columns of the table.
     *
     * @throws com.hellblazer.voxelfit.InsufficientDataException if the dependencies cannot be resolved
     */
    public double[] generate(ColumnTable table) {
        return generator.apply(table);
    }
}
