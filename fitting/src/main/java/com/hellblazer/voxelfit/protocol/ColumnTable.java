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

import com.hellblazer.voxelfit.InsufficientDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * The acquisition protocol: a table of named columns holding one scalar per measurement.
 *
 * <p>Columns are either <em>real</em>, explicitly supplied, or <em>virtual</em>, derived on demand by a
 * {@link VirtualColumn} from the real columns. A real column always shadows a virtual column of the same name, and
 * resolving a virtual column never changes the table.
 *
 * <p>All real columns share one length, fixed by the first array column added. Scalars are stored once and
 * broadcast to the table length when read.
 *
 * <p>Tables are populated before a run and then only read; they are not safe for concurrent mutation.
 *
 * @author hal.hildebrand
 */
public final class ColumnTable {
    /**
     * b values (s/m^2) below this are considered unweighted
     */
    public static final double UNWEIGHTED_THRESHOLD = 25e6;

    private static final Logger       log              = LoggerFactory.getLogger(ColumnTable.class);
    private static final List<String> PREFERRED_ORDER  = List.of("gx", "gy", "gz", "G", "Delta", "delta", "TE",
                                                                 "T1", "b", "q", "maxG");
    private static final double       GRADIENT_NORM_MIN = 0.99;

    private final Map<String, double[]> columns = new LinkedHashMap<>();
    private final Map<String, Double>   scalars = new LinkedHashMap<>();
    private       int                   length  = -1;

    public ColumnTable() {
    }

    public ColumnTable(Map<String, double[]> columns) {
        columns.forEach(this::addColumn);
    }

    /**
     * Add or replace a real column.
     *
     * <p>The first column fixes the table length. Longer columns are truncated to it, shorter ones are rejected.
     *
     * @throws IllegalArgumentException if the column is shorter than the table
     */
    public ColumnTable addColumn(String name, double[] values) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (length < 0) {
            length = values.length;
        }
        if (values.length < length) {
            throw new IllegalArgumentException(
            String.format("Column %s has %d rows, the table requires %d", name, values.length, length));
        }
        if (values.length > length) {
            log.info("Column {} has {} rows, truncating to the table length {}", name, values.length, length);
        }
        scalars.remove(name);
        columns.put(name, Arrays.copyOf(values, length));
        return this;
    }

    /**
     * Add or replace a real column with a single value for every row.
     */
    public ColumnTable addColumn(String name, double value) {
        Objects.requireNonNull(name, "name cannot be null");
        columns.remove(name);
        scalars.put(name, value);
        return this;
    }

    /**
     * Add a multi-wide column. A three-wide {@code g} is split into {@code gx}, {@code gy} and {@code gz}; a one-wide
     * column is added as is.
     */
    public ColumnTable addColumn(String name, double[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        int width = rows.length == 0 ? 0 : rows[0].length;
        if (width == 1) {
            return addColumn(name, Arrays.stream(rows).mapToDouble(r -> r[0]).toArray());
        }
        if (!"g".equals(name) || width != 3) {
            throw new IllegalArgumentException(
            String.format("Column %s must be one wide, or three wide for g, was %d", name, width));
        }
        for (int axis = 0; axis < 3; axis++) {
            final int a = axis;
            addColumn("g" + "xyz".charAt(axis), Arrays.stream(rows).mapToDouble(r -> r[a]).toArray());
        }
        return this;
    }

    public ColumnTable removeColumn(String name) {
        columns.remove(name);
        scalars.remove(name);
        if ("g".equals(name)) {
            List.of("gx", "gy", "gz").forEach(columns::remove);
        }
        return this;
    }

    /**
     * Number of rows, zero while no array column has been added.
     */
    public int length() {
        return Math.max(length, 0);
    }

    /**
     * Resolve a column, real first, then virtual.
     *
     * @throws InsufficientDataException if the column is neither real nor derivable
     */
    public double[] getColumn(String name) {
        var real = getRealColumn(name);
        if (real.isPresent()) {
            return real.get();
        }
        var virtual = VirtualColumn.forName(name);
        if (virtual.isEmpty()) {
            throw new InsufficientDataException("Column " + name + " is not available and cannot be estimated");
        }
        return virtual.get().generate(this);
    }

    /**
     * The real column of that name, without consulting the virtual columns.
     */
    public Optional<double[]> getRealColumn(String name) {
        var values = columns.get(name);
        if (values != null) {
            return Optional.of(values.clone());
        }
        var scalar = scalars.get(name);
        if (scalar != null) {
            var broadcast = new double[length()];
            Arrays.fill(broadcast, scalar);
            return Optional.of(broadcast);
        }
        return Optional.empty();
    }

    /**
     * The gradient directions as rows of (gx, gy, gz), if all three are real.
     */
    public Optional<double[][]> getGradientDirections() {
        if (!isColumnReal("gx") || !isColumnReal("gy") || !isColumnReal("gz")) {
            return Optional.empty();
        }
        var gx = getColumn("gx");
        var gy = getColumn("gy");
        var gz = getColumn("gz");
        var rows = new double[length()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = new double[] { gx[i], gy[i], gz[i] };
        }
        return Optional.of(rows);
    }

    public boolean isColumnReal(String name) {
        return columns.containsKey(name) || scalars.containsKey(name);
    }

    /**
     * True if the column is real or can be estimated from the real columns.
     */
    public boolean hasColumn(String name) {
        if (isColumnReal(name)) {
            return true;
        }
        try {
            getColumn(name);
            return true;
        } catch (InsufficientDataException e) {
            return false;
        }
    }

    /**
     * Real column names, in preferred order first and then in insertion order.
     */
    public List<String> columnNames() {
        var names = new ArrayList<String>();
        for (var preferred : PREFERRED_ORDER) {
            if (isColumnReal(preferred)) {
                names.add(preferred);
            }
        }
        columns.keySet().stream().filter(n -> !names.contains(n)).forEach(names::add);
        scalars.keySet().stream().filter(n -> !names.contains(n)).forEach(names::add);
        return names;
    }

    /**
     * Names of the virtual columns that can currently be estimated and are not shadowed by a real column.
     */
    public List<String> estimatedColumnNames() {
        var names = new ArrayList<String>();
        for (var virtual : VirtualColumn.values()) {
            if (!isColumnReal(virtual.columnName()) && hasColumn(virtual.columnName())) {
                names.add(virtual.columnName());
            }
        }
        return names;
    }

    /**
     * Rows acquired without diffusion weighting. Without a resolvable {@code b} every row counts as unweighted.
     */
    public int[] unweightedIndices() {
        double[] b;
        try {
            b = getColumn("b");
        } catch (InsufficientDataException e) {
            return IntStream.range(0, length()).toArray();
        }
        var gradients = getGradientDirections();
        return IntStream.range(0, length()).filter(i -> {
            if (b[i] < UNWEIGHTED_THRESHOLD) {
                return true;
            }
            return gradients.map(g -> norm(g[i]) < GRADIENT_NORM_MIN).orElse(false);
        }).toArray();
    }

    /**
     * Rows acquired with diffusion weighting.
     *
     * @throws InsufficientDataException if {@code b} cannot be resolved
     */
    public int[] weightedIndices() {
        getColumn("b");
        var unweighted = unweightedIndices();
        return IntStream.range(0, length()).filter(i -> Arrays.binarySearch(unweighted, i) < 0).toArray();
    }

    /**
     * The distinct b values of the weighted rows, ascending.
     */
    public double[] bValueShells() {
        var b = getColumn("b");
        return Arrays.stream(weightedIndices()).mapToDouble(i -> b[i]).distinct().sorted().toArray();
    }

    /**
     * Rows whose b value lies in {@code [start, end]}.
     */
    public int[] indicesInBValueRange(double start, double end) {
        var b = getColumn("b");
        return IntStream.range(0, length()).filter(i -> start <= b[i] && b[i] <= end).toArray();
    }

    /**
     * A new table holding only the given rows, in the given order.
     */
    public ColumnTable subset(int[] rows) {
        var subset = new ColumnTable();
        for (var entry : columns.entrySet()) {
            var values = entry.getValue();
            subset.addColumn(entry.getKey(), Arrays.stream(rows).mapToDouble(r -> values[r]).toArray());
        }
        if (subset.length < 0) {
            subset.length = rows.length;
        }
        scalars.forEach(subset::addColumn);
        return subset;
    }

    public ColumnTable copy() {
        var copy = new ColumnTable();
        copy.length = length;
        columns.forEach((name, values) -> copy.columns.put(name, values.clone()));
        copy.scalars.putAll(scalars);
        return copy;
    }

    /**
     * All resolvable columns, real and virtual, by name. Used to record the protocol a model was fitted with.
     */
    public Map<String, double[]> toMap() {
        var map = new LinkedHashMap<String, double[]>();
        for (var name : columnNames()) {
            map.put(name, getColumn(name));
        }
        for (var name : estimatedColumnNames()) {
            map.put(name, getColumn(name));
        }
        return map;
    }

    private static double norm(double[] v) {
        return Math.sqrt(v[0] * v[0] + v[1] * v[1] + v[2] * v[2]);
    }

    @Override
    public String toString() {
        return String.format("ColumnTable[length=%d, real=%s]", length(), columnNames());
    }
}
