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

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property based tests for work partitioning
 */
class WorkPartitionerPropertyTest {

    @Provide
    Arbitrary<List<DeviceDescriptor>> devices() {
        return Arbitraries.doubles().between(0.01, 100.0).list().ofMinSize(1).ofMaxSize(8).map(weights -> {
            var devices = new ArrayList<DeviceDescriptor>();
            for (int i = 0; i < weights.size(); i++) {
                devices.add(new DeviceDescriptor(i, "device-" + i, weights.get(i), 1024));
            }
            return devices;
        });
    }

    @Property
    @Label("Weighted ranges tile [0, n) exactly once")
    void weightedRangesTile(@ForAll @IntRange(min = 0, max = 100_000) int n,
                            @ForAll("devices") List<DeviceDescriptor> devices) {
        assertTiles(n, new WeightedDistribution().partition(n, devices));
    }

    @Property
    @Label("Even ranges tile [0, n) exactly once")
    void evenRangesTile(@ForAll @IntRange(min = 0, max = 100_000) int n,
                        @ForAll("devices") List<DeviceDescriptor> devices) {
        assertTiles(n, new EvenDistribution().partition(n, devices));
    }

    @Property
    @Label("Bounded ranges tile [0, n) and respect the bound")
    void boundedRangesTile(@ForAll @IntRange(min = 0, max = 10_000) int n,
                           @ForAll @IntRange(min = 1, max = 500) int maxRangeSize,
                           @ForAll("devices") List<DeviceDescriptor> devices) {
        var assignments = new WeightedDistribution(maxRangeSize).partition(n, devices);
        assertTiles(n, assignments);
        assignments.forEach(a -> assertTrue(a.range().size() <= maxRangeSize));
    }

    @Property
    @Label("Devices receive contiguous blocks in device order")
    void devicesInOrder(@ForAll @IntRange(min = 1, max = 10_000) int n,
                        @ForAll("devices") List<DeviceDescriptor> devices) {
        var assignments = new WeightedDistribution().partition(n, devices);
        for (int i = 1; i < assignments.size(); i++) {
            assertTrue(assignments.get(i - 1).device().index() < assignments.get(i).device().index(),
                       "Each device receives at most one block, in order");
        }
    }

    private static void assertTiles(int n, List<Assignment> assignments) {
        int expectedStart = 0;
        for (var assignment : assignments) {
            var range = assignment.range();
            assertEquals(expectedStart, range.start(), "Ranges must be contiguous and disjoint");
            assertFalse(range.isEmpty(), "Empty ranges must not be assigned");
            expectedStart = range.end();
        }
        assertEquals(n, expectedStart, "Ranges must cover [0, n)");
    }
}
