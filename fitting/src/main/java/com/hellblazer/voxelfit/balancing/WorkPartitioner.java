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

import com.hellblazer.voxelfit.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Divides {@code [0, n)} among compute devices.
 *
 * <p>The returned ranges are pairwise disjoint, cover {@code [0, n)} exactly once and are laid out in device order,
 * each device receiving one contiguous block (possibly split into several ranges when a maximum range size is set).
 * Implementations only differ in how they weigh devices and are pure functions of their arguments.
 *
 * @author hal.hildebrand
 */
public abstract class WorkPartitioner {

    private final int maxRangeSize;

    protected WorkPartitioner(int maxRangeSize) {
        if (maxRangeSize <= 0) {
            throw new IllegalArgumentException("maxRangeSize must be positive: " + maxRangeSize);
        }
        this.maxRangeSize = maxRangeSize;
    }

    /**
     * Partition {@code [0, n)} over the devices.
     *
     * @throws ConfigurationException if {@code n > 0} and there are no devices, or a device has a non-positive weight
     */
    public List<Assignment> partition(int n, List<DeviceDescriptor> devices) {
        if (n < 0) {
            throw new IllegalArgumentException("Work size must be non-negative: " + n);
        }
        if (n == 0) {
            return List.of();
        }
        validate(n, devices);

        var shares = shares(n, weights(devices));
        var assignments = new ArrayList<Assignment>();
        int start = 0;
        for (int i = 0; i < devices.size(); i++) {
            int end = start + shares[i];
            int s = start;
            while (s < end) {
                int e = (int) Math.min(end, (long) s + maxRangeSize);
                assignments.add(new Assignment(devices.get(i), new WorkRange(s, e)));
                s = e;
            }
            start = end;
        }
        return assignments;
    }

    /**
     * The largest work size, at most {@code upper}, whose partition gives no device more than its capacity.
     *
     * @param capacities the number of work items each device can hold, in device order
     * @return the work size, 0 if not even a single item fits
     */
    public int largestFitting(int upper, List<DeviceDescriptor> devices, long[] capacities) {
        if (upper < 0) {
            throw new IllegalArgumentException("Upper bound must be non-negative: " + upper);
        }
        validate(upper, devices);
        if (capacities.length != devices.size()) {
            throw new IllegalArgumentException(
            String.format("%d capacities for %d devices", capacities.length, devices.size()));
        }
        var weights = weights(devices);
        double total = 0;
        for (var w : weights) {
            total += w;
        }
        // no exact quota may exceed its capacity; rounding can still add one item to a share
        long bound = upper;
        for (int i = 0; i < weights.length; i++) {
            bound = Math.min(bound, (long) Math.floor(Math.max(0, capacities[i]) * (total / weights[i])));
        }
        for (int n = (int) bound; n > 0; n--) {
            if (fits(shares(n, weights), capacities)) {
                return n;
            }
        }
        return 0;
    }

    public int getMaxRangeSize() {
        return maxRangeSize;
    }

    private static void validate(int n, List<DeviceDescriptor> devices) {
        if (devices == null || devices.isEmpty()) {
            throw new ConfigurationException("No compute devices available for " + n + " voxels");
        }
        for (var device : devices) {
            if (!(device.weight() > 0)) {
                throw new ConfigurationException(
                String.format("Device %s has non-positive weight %s", device.name(), device.weight()));
            }
        }
    }

    private static boolean fits(int[] shares, long[] capacities) {
        for (int i = 0; i < shares.length; i++) {
            if (shares[i] > capacities[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * The relative weight of each device; all positive.
     */
    protected abstract double[] weights(List<DeviceDescriptor> devices);

    /**
     * Largest remainder apportionment of {@code n} by weight. Ties in remainder go to the earlier device.
     */
    static int[] shares(int n, double[] weights) {
        double total = 0;
        for (var w : weights) {
            total += w;
        }
        var shares = new int[weights.length];
        var remainders = new double[weights.length];
        int assigned = 0;
        for (int i = 0; i < weights.length; i++) {
            double exact = n * (weights[i] / total);
            shares[i] = (int) Math.floor(exact);
            remainders[i] = exact - shares[i];
            assigned += shares[i];
        }
        while (assigned < n) {
            int best = 0;
            for (int i = 1; i < remainders.length; i++) {
                if (remainders[i] > remainders[best]) {
                    best = i;
                }
            }
            shares[best]++;
            remainders[best] = -1;
            assigned++;
        }
        return shares;
    }
}
