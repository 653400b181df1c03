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

import com.hellblazer.voxelfit.ConfigurationException;
import com.hellblazer.voxelfit.InsufficientDataException;
import com.hellblazer.voxelfit.PartialFailureException;
import com.hellblazer.voxelfit.SyntheticData;
import com.hellblazer.voxelfit.compute.ChunkDispatcher;
import com.hellblazer.voxelfit.compute.KernelContext;
import com.hellblazer.voxelfit.compute.VoxelKernel;
import com.hellblazer.voxelfit.config.ConfigOverrideTable;
import com.hellblazer.voxelfit.config.ConfigurationHolder;
import com.hellblazer.voxelfit.config.FittingConfiguration;
import com.hellblazer.voxelfit.config.OptimizerSettings;
import com.hellblazer.voxelfit.config.StrategySettings;
import com.hellblazer.voxelfit.data.ProblemData;
import com.hellblazer.voxelfit.data.ProtocolSelection;
import com.hellblazer.voxelfit.data.VoxelMask;
import com.hellblazer.voxelfit.model.AbstractModel;
import com.hellblazer.voxelfit.model.CascadeDefinition;
import com.hellblazer.voxelfit.model.Fittable;
import com.hellblazer.voxelfit.model.standard.AdcCascade;
import com.hellblazer.voxelfit.model.standard.AdcModel;
import com.hellblazer.voxelfit.model.standard.S0Model;
import com.hellblazer.voxelfit.processing.InMemoryResultStore;
import com.hellblazer.voxelfit.protocol.ColumnTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for fitting single models and cascades
 *
 * @author hal.hildebrand
 */
@Timeout(value = 60, unit = TimeUnit.SECONDS)
public class ModelFitTest {

    private static final int VOXELS = 20;

    private ProblemData          data;
    private InMemoryResultStore  store;
    private FittingConfiguration configuration;

    @BeforeEach
    public void setUp() {
        data = SyntheticData.problem(VOXELS);
        store = new InMemoryResultStore();
        configuration = SyntheticData.onDevices(2, 1 << 20);
    }

    private ModelFit.Builder fit(Fittable target) {
        return ModelFit.builder(target, data, store).configuration(configuration);
    }

    @Test
    public void testCascadeFitsEveryStage() {
        var result = fit(AdcCascade.create()).build().run();

        assertEquals(AdcModel.NAME, result.name());
        var s0 = result.get(S0Model.S0);
        var d = result.get(AdcModel.D);
        for (int v = 0; v < VOXELS; v++) {
            assertEquals(SyntheticData.s0(v), s0[v], 1e-4 * SyntheticData.s0(v));
            assertEquals(SyntheticData.adc(v), d[v], 1e-4 * SyntheticData.adc(v));
        }
        assertEquals(Math.exp(-1e9 * d[3]), result.get(AdcModel.DECAY_B1000)[3], 1e-12);
        assertTrue(store.isComplete(S0Model.NAME));
        assertTrue(store.isComplete(AdcModel.NAME));
        assertTrue(ModelFit.outputExists(AdcCascade.create(), store, false));
    }

    @Test
    public void testCascadeSubdirectory() {
        fit(AdcCascade.create()).cascadeSubdir(true).build().run();

        assertTrue(store.isComplete(AdcCascade.NAME + "/" + S0Model.NAME));
        assertTrue(store.isComplete(AdcCascade.NAME + "/" + AdcModel.NAME));
        assertFalse(store.isComplete(AdcModel.NAME));
        assertTrue(ModelFit.outputExists(AdcCascade.create(), store, true));
        assertFalse(ModelFit.outputExists(AdcCascade.create(), store, false));
    }

    @Test
    public void testOnlyLastStageIsRecalculated() {
        fit(AdcCascade.create()).build().run();
        var spyStore = spy(store);

        ModelFit.builder(AdcCascade.create(), data, spyStore)
                .configuration(configuration)
                .recalculate(true)
                .onlyRecalculateLast(true)
                .build()
                .run();

        verify(spyStore, never()).invalidate(S0Model.NAME);
        verify(spyStore).invalidate(AdcModel.NAME);
    }

    @Test
    public void testRecalculateEveryStage() {
        fit(AdcCascade.create()).build().run();
        var spyStore = spy(store);

        ModelFit.builder(AdcCascade.create(), data, spyStore).configuration(configuration).recalculate(true).build()
                .run();

        verify(spyStore).invalidate(S0Model.NAME);
        verify(spyStore).invalidate(AdcModel.NAME);
    }

    @Test
    public void testWithoutRecalculateNothingIsInvalidated() {
        fit(new S0Model()).build().run();
        var spyStore = spy(store);

        ModelFit.builder(new S0Model(), data, spyStore).configuration(configuration).build().run();

        verify(spyStore, never()).invalidate(anyString());
        verify(spyStore, never()).write(anyString(), any(), anyMap());
    }

    @Test
    public void testProtocolOptionsSelectRows() {
        var options = ConfigOverrideTable.<ProtocolSelection>builder()
                                         .add("^S0$", new ProtocolSelection(false, true, List.of()))
                                         .build();
        fit(new S0Model()).protocolOptions(options).build().run();
        assertEquals(2, store.getColumnTable(S0Model.NAME).orElseThrow().length());

        var unrestricted = new InMemoryResultStore();
        ModelFit.builder(new S0Model(), data, unrestricted)
                .configuration(configuration)
                .protocolOptions(options)
                .useProtocolOptions(false)
                .build()
                .run();
        assertEquals(7, unrestricted.getColumnTable(S0Model.NAME).orElseThrow().length());
    }

    @Test
    public void testInsufficientProtocol() {
        var unweighted = new ColumnTable().addColumn("b", new double[7]);
        var b0 = new ProblemData(data.dataset(), unweighted, VoxelMask.all(VOXELS));

        var ex = assertThrows(InsufficientDataException.class,
                              () -> ModelFit.builder(new AdcModel(), b0, store).build());
        assertEquals(AdcModel.NAME, ex.getModelName());
        assertEquals(List.of("No weighted measurements"), ex.getProblems());

        var cascade = ModelFit.builder(AdcCascade.create(), b0, store).configuration(configuration).build();
        var stageFailure = assertThrows(InsufficientDataException.class, cascade::run);
        assertEquals(List.of(AdcCascade.NAME, AdcModel.NAME), stageFailure.getChain());
        assertTrue(store.isComplete(S0Model.NAME), "Stages before the insufficient one are kept");
    }

    @Test
    public void testFailureNamesModelAndChainPosition() {
        var broken = new AbstractModel("Broken", List.of("Broken.x"), List.of()) {
            @Override
            public VoxelKernel createKernel(KernelContext context) {
                return (voxel, observations, parameters) -> {
                    throw new ArithmeticException("singular");
                };
            }
        };
        var cascade = CascadeDefinition.builder("Pipeline").stage(new S0Model()).stage(broken).build();

        var ex = assertThrows(PartialFailureException.class, () -> fit(cascade).build().run());
        assertEquals("Broken", ex.getModelName());
        assertEquals(List.of("Pipeline", "Broken"), ex.getChain());
        assertEquals(1, ex.getChainPosition());
        assertTrue(ex.getMessage().contains("Broken"));
        assertTrue(ex.getSuppressed().length > 0);
        assertFalse(store.isComplete("Broken"));
    }

    @Test
    public void testDeviceSelection() {
        var threeDevices = SyntheticData.onDevices(3, 1 << 20);
        var result = ModelFit.builder(new S0Model(), data, store)
                             .configuration(threeDevices)
                             .deviceIndices(List.of(2, 0))
                             .build()
                             .run();
        assertEquals(SyntheticData.s0(VOXELS - 1), result.get(S0Model.S0)[VOXELS - 1], 1e-3);

        var outOfRange = ModelFit.builder(new S0Model(), data, new InMemoryResultStore())
                                 .configuration(threeDevices)
                                 .deviceIndices(List.of(3))
                                 .build();
        assertThrows(ConfigurationException.class, outOfRange::run);
    }

    @Test
    public void testCompleteOutputIsReadBackAfterDevicesChange() {
        // 7 float measurements and 1 double parameter: 36 bytes per voxel, 10 voxels in half of 720 bytes
        var budgeted = StrategySettings.of("MemoryBudget");
        var first = ModelFit.builder(new S0Model(), data, store)
                            .configuration(SyntheticData.onDevices(1, 720).withStrategy(budgeted))
                            .build()
                            .run();
        assertEquals(2, store.chunkCount(S0Model.NAME));

        var dispatcher = spy(new ChunkDispatcher());
        var second = ModelFit.builder(new S0Model(), data, store)
                             .configuration(SyntheticData.onDevices(3, 720).withStrategy(budgeted))
                             .dispatcher(dispatcher)
                             .build()
                             .run();

        verify(dispatcher, never()).process(any(), any(), any(), anyInt(), any(), any());
        assertArrayEquals(first.get(S0Model.S0), second.get(S0Model.S0));
        assertEquals(2, store.chunkCount(S0Model.NAME), "Stored chunks are left as written");
    }

    @Test
    public void testOverrideScopeAppliesToRun() {
        var seen = new ArrayList<String>();
        var recording = new AbstractModel("Recording", List.of("Recording.value"), List.of("b")) {
            @Override
            public VoxelKernel createKernel(KernelContext kernelContext) {
                seen.add(kernelContext.optimizers().get(0).name());
                return (voxel, observations, parameters) -> parameters[0] = voxel;
            }
        };
        var holder = new ConfigurationHolder(configuration);
        String configured = configuration.optimizers().get(0).name();

        try (var scope = holder.override(c -> c.withOptimizers(List.of(new OptimizerSettings("Nelder-Mead", 3))))) {
            ModelFit.builder(recording, data, store).configuration(holder).recalculate(true).build().run();
        }
        ModelFit.builder(recording, data, store).configuration(holder).recalculate(true).build().run();

        assertEquals("Nelder-Mead", seen.get(0));
        assertEquals(configured, seen.get(seen.size() - 1), "The configuration is restored once the scope closes");
        assertSame(configuration, holder.get());
    }
}
