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

package com.hellblazer.voxelfit.fit;

import com.hellblazer.voxelfit.SyntheticData;
import com.hellblazer.voxelfit.balancing.WeightedDistribution;
import com.hellblazer.voxelfit.compute.ChunkDispatcher;
import com.hellblazer.voxelfit.compute.ComputeEnvironment;
import com.hellblazer.voxelfit.compute.KernelContext;
import com.hellblazer.voxelfit.config.OptimizerSettings;
import com.hellblazer.voxelfit.model.standard.AdcModel;
import com.hellblazer.voxelfit.processing.InMemoryResultStore;
import com.hellblazer.voxelfit.processing.ProcessingContext;
import com.hellblazer.voxelfit.processing.VoxelRangeStrategy;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for fitting one model
 */
public class SingleModelFitTest {

    @Test
    void testFitAppliesModifiersAndRecordsProtocol() {
        var data = SyntheticData.problem(6);
        var store = new InMemoryResultStore();
        var environments = ComputeEnvironment.forDevices(SyntheticData.onDevices(1, 1 << 20).devices());
        try {
            var context = new ProcessingContext(environments, new WeightedDistribution(), new ChunkDispatcher(),
                                                new KernelContext(data.protocol(),
                                                                  List.of(new OptimizerSettings("Powell", 2)), 0));
            var result = new SingleModelFit(new AdcModel(), data, store, "ADC", new VoxelRangeStrategy(4), context,
                                            false, List.of(AdcModel.NAME)).run();

            assertEquals(List.of("S0.s0", AdcModel.D, AdcModel.DECAY_B1000), result.mapNames());
            assertTrue(store.isComplete("ADC"));
            assertEquals(2, store.chunkCount("ADC"));
            assertNull(MDC.get(SingleModelFit.MDC_MODEL), "Log context is restored after the fit");
            assertNull(MDC.get(SingleModelFit.MDC_CASCADE));
        } finally {
            ComputeEnvironment.closeAll(environments);
        }
    }

    @Test
    void testRuntimeFormat() {
        assertEquals("00:00:05", SingleModelFit.formatRuntime(Duration.ofMillis(5_400)));
        assertEquals("01:02:03", SingleModelFit.formatRuntime(Duration.ofSeconds(3723)));
        assertEquals("27:00:00", SingleModelFit.formatRuntime(Duration.ofHours(27)));
    }
}
