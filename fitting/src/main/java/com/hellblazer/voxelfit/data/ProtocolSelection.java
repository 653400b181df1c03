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

import com.hellblazer.voxelfit.InsufficientDataException;
import com.hellblazer.voxelfit.protocol.ColumnTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Restricts the protocol rows a model is fitted with, e.g. only low b values for a tensor or only unweighted volumes
 * for S0.
 *
 * @param useWeighted   keep weighted rows
 * @param useUnweighted keep unweighted rows
 * @param bValueRanges  inclusive {@code [start, end]} b value ranges the weighted rows must fall in; empty for all
 * @author hal.hildebrand
 */
public record ProtocolSelection(boolean useWeighted, boolean useUnweighted, List<BValueRange> bValueRanges) {
    private static final Logger log = LoggerFactory.getLogger(ProtocolSelection.class);

    public ProtocolSelection {
        bValueRanges = List.copyOf(bValueRanges);
    }

    /**
     * Keeps every row.
     */
    public static ProtocolSelection all() {
        return new ProtocolSelection(true, true, List.of());
    }

    public boolean isIdentity() {
        return useWeighted && useUnweighted && bValueRanges.isEmpty();
    }

    /**
     * The rows of the table this selection keeps, ascending.
     */
    public int[] rows(ColumnTable table) {
        if (isIdentity()) {
            return IntStream.range(0, table.length()).toArray();
        }
        var rows = new TreeSet<Integer>();
        if (useUnweighted) {
            for (int i : table.unweightedIndices()) {
                rows.add(i);
            }
        }
        if (useWeighted) {
            int[] weighted;
            try {
                weighted = table.weightedIndices();
            } catch (InsufficientDataException e) {
                log.debug("No b values, protocol has no weighted rows: {}", e.getMessage());
                weighted = new int[0];
            }
            var b = weighted.length == 0 ? new double[0] : table.getColumn("b");
            for (int i : weighted) {
                if (bValueRanges.isEmpty() || bValueRanges.stream().anyMatch(r -> r.contains(b[i]))) {
                    rows.add(i);
                }
            }
        }
        return rows.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Apply this selection to the protocol and measurements.
     */
    public ProblemData apply(ProblemData data) {
        if (isIdentity()) {
            return data;
        }
        var rows = rows(data.protocol());
        log.info("Using {} of {} protocol rows", rows.length, data.protocol().length());
        return data.selectMeasurements(rows);
    }

    /**
     * Inclusive b value range in s/m^2.
     */
    public record BValueRange(double start, double end) {
        public BValueRange {
            if (end < start) {
                throw new IllegalArgumentException(String.format("Invalid b value range [%s, %s]", start, end));
            }
        }

        public boolean contains(double b) {
            return start <= b && b <= end;
        }
    }
}
