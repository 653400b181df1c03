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

package com.hellblazer.voxelfit.compute;

import com.hellblazer.voxelfit.SyntheticData;
import com.hellblazer.voxelfit.balancing.DeviceDescriptor;
import com.hellblazer.voxelfit.balancing.WorkRange;
import com.hellblazer.voxelfit.data.Dataset;
import com.hellblazer.voxelfit.resource.DeviceMemoryExhaustedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ComputeWorker buffer ownership and kernel execution
 *
 * @author hal.hildebrand
 */
public class ComputeWorkerTest {

    private static final VoxelKernel INDEX_AND_SUM = (voxel, observations, parameters) -> {
        parameters[0] = voxel;
        double sum = 0;
        for (float o : observations) {
            sum += o;
        }
        parameters[1] = sum;
    };

    private ComputeEnvironment environment;
    private Dataset            dataset;

    @BeforeEach
    public void setUp() {
        environment = new ComputeEnvironment(new DeviceDescriptor(0, "worker-test", 1.0, 1 << 20));
        dataset = SyntheticData.dataset(10);
    }

    @AfterEach
    public void tearDown() {
        environment.close();
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    public void testCalculateAndRead() throws Exception {
        var results = new double[2][10];
        try (var worker = new ComputeWorker(environment, WorkRange.of(2, 8), dataset, INDEX_AND_SUM, 2)) {
            assertEquals(WorkRange.of(2, 8), worker.calculate(WorkRange.of(2, 8)).get());
            worker.readResults(WorkRange.of(2, 8), results, 0);
        }

        for (int voxel = 2; voxel < 8; voxel++) {
            assertEquals(voxel, results[0][voxel]);
            double sum = 0;
            for (float o : dataset.voxel(voxel)) {
                sum += o;
            }
            assertEquals(sum, results[1][voxel], Math.ulp((float) sum) * 8);
        }
        assertEquals(0.0, results[0][0], "Voxels outside the range are untouched");
        assertEquals(0, environment.getMemory().getAllocatedBytes());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    public void testBuffersAreExclusiveAndAccounted() {
        var worker = new ComputeWorker(environment, WorkRange.of(0, 4), dataset, INDEX_AND_SUM, 2);
        long measurements = 4L * dataset.measurementCount() * Float.BYTES;
        long parameters = 4L * 2 * Double.BYTES;
        assertEquals(measurements + parameters, environment.getMemory().getAllocatedBytes());
        assertEquals(2, environment.getMemory().getTracker().getActiveCount());

        worker.release();
        worker.release();
        assertTrue(worker.isReleased());
        assertEquals(0, environment.getMemory().getAllocatedBytes());
        assertEquals(0, environment.getMemory().getTracker().getLeakCount());
        assertThrows(IllegalStateException.class, () -> worker.calculate(WorkRange.of(0, 4)));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    public void testKernelFailureStillReleases() {
        VoxelKernel failing = (voxel, observations, parameters) -> {
            throw new ArithmeticException("diverged at " + voxel);
        };
        var worker = new ComputeWorker(environment, WorkRange.of(0, 3), dataset, failing, 1);
        try {
            var ex = assertThrows(ExecutionException.class, () -> worker.calculate(WorkRange.of(0, 3)).get());
            assertInstanceOf(ArithmeticException.class, ex.getCause());
        } finally {
            worker.release();
        }
        assertEquals(0, environment.getMemory().getAllocatedBytes());
    }

    @Test
    public void testSubRangeMustBeInsideWorkerRange() {
        try (var worker = new ComputeWorker(environment, WorkRange.of(2, 5), dataset, INDEX_AND_SUM, 2)) {
            assertThrows(IllegalArgumentException.class, () -> worker.calculate(WorkRange.of(4, 6)));
            assertThrows(IllegalArgumentException.class,
                         () -> worker.readResults(WorkRange.of(0, 3), new double[2][10], 0));
        }
    }

    @Test
    public void testFailedAllocationReleasesInput() {
        int measurements = dataset.measurementCount();
        // room for the measurements of 6 voxels, not for their parameters as well
        long capacity = 6L * measurements * Float.BYTES + 4;
        try (var small = new ComputeEnvironment(new DeviceDescriptor(1, "small", 1.0, capacity))) {
            assertThrows(DeviceMemoryExhaustedException.class,
                         () -> new ComputeWorker(small, WorkRange.of(0, 6), dataset, INDEX_AND_SUM, 2));
            assertEquals(0, small.getMemory().getAllocatedBytes());
            assertEquals(0, small.getMemory().getTracker().getActiveCount());
        }
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    public void testDiscardedWorkerIsReclaimed() throws InterruptedException {
        createAndDrop();

        var memory = environment.getMemory();
        while (memory.getAllocatedBytes() != 0) {
            System.gc();
            Thread.sleep(50);
        }
        assertEquals(2, memory.getTracker().getLeakCount());
        assertEquals(0, memory.getTracker().getActiveCount());
    }

    private void createAndDrop() {
        new ComputeWorker(environment, WorkRange.of(0, 10), dataset, INDEX_AND_SUM, 2);
        assertTrue(environment.getMemory().getAllocatedBytes() > 0);
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    public void testResultsKeepDoublePrecision() throws Exception {
        double precise = 1.0 + 1e-12;
        VoxelKernel fine = (voxel, observations, parameters) -> parameters[0] = precise * voxel;
        var results = new double[1][10];
        try (var worker = new ComputeWorker(environment, WorkRange.of(0, 10), dataset, fine, 1)) {
            worker.calculate(WorkRange.of(0, 10)).get();
            worker.readResults(WorkRange.of(0, 10), results, 0);
        }
        assertEquals(precise * 3, results[0][3], 0.0, "Fitted values are not narrowed to float");
    }
}
