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

package com.hellblazer.voxelfit.balancing;

/**
 * Half-open interval {@code [start, end)} over voxel indices.
 *
 * @author hal.hildebrand
 */
public record WorkRange(int start, int end) implements Comparable<WorkRange> {

    public WorkRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(String.format("Invalid range [%d, %d)", start, end));
        }
    }

    public static WorkRange of(int start, int end) {
        return new WorkRange(start, end);
    }

    public int size() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int index) {
        return index >= start && index < end;
    }

    public boolean encloses(WorkRange other) {
        return other.start >= start && other.end <= end;
    }

    /**
     * Shift this range by {@code offset}, mapping a chunk local range to dataset indices.
     */
    public WorkRange offset(int offset) {
        return new WorkRange(start + offset, end + offset);
    }

    @Override
    public int compareTo(WorkRange o) {
        int c = Integer.compare(start, o.start);
        return c != 0 ? c : Integer.compare(end, o.end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
