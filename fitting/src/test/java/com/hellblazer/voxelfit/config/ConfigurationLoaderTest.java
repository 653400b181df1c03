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

import com.hellblazer.voxelfit.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for loading layered YAML configuration
 */
public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigurationLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader(tempDir.resolve("missing.yaml"));
    }

    @Test
    void testBuiltInDefaults() {
        var config = loader.load();

        assertEquals("Powell", config.optimizers().get(0).name());
        assertEquals(2, config.optimizers().get(0).patience());
        assertEquals(0, config.extraOptimRuns());
        assertEquals("VoxelRange", config.strategy().name());
        assertEquals(10_000, config.strategy().intOption("max_nmr_voxels", -1));
        assertEquals(1, config.devices().size());
        assertEquals("cpu-0", config.devices().get(0).name());

        var s0 = config.protocolSelectionFor(List.of("ADC (Cascade)", "S0"));
        assertFalse(s0.useWeighted(), "S0 fits only the unweighted measurements by default");
        assertTrue(config.protocolSelectionFor(List.of("ADC")).isIdentity());
    }

    @Test
    void testUserFileOverridesDefaults() throws IOException {
        var userFile = tempDir.resolve("voxelfit.yaml");
        Files.writeString(userFile, """
                                    optimization:
                                      general:
                                        optimizers:
                                          - name: LevenbergMarquardt
                                            patience: 5
                                    """);
        var config = new ConfigurationLoader(userFile).load();

        assertEquals("LevenbergMarquardt", config.optimizers().get(0).name());
        assertEquals(5, config.optimizers().get(0).patience());
        assertEquals("VoxelRange", config.strategy().name(), "Untouched sections keep their defaults");
    }

    @Test
    void testModelSpecificEntries() {
        var config = loader.apply(FittingConfiguration.defaultConfig(), """
                                  optimization:
                                    model_specific:
                                      - match: ['^BallStick$', '^S0$']
                                        optimizers:
                                          - name: NMSimplex
                                      - match: '^S0$'
                                        optimizers:
                                          - name: Powell
                                            patience: 7
                                  processing_strategies:
                                    optimization:
                                      model_specific:
                                        - match: '^NODDI'
                                          name: MemoryBudget
                                          options:
                                            memory_fraction: 0.25
                                  """);

        assertEquals("NMSimplex", config.optimizersFor(List.of("BallStick", "S0")).get(0).name());
        assertEquals(7, config.optimizersFor(List.of("Tensor", "S0")).get(0).patience());
        assertEquals("Powell", config.optimizersFor(List.of("Tensor")).get(0).name());
        assertEquals(2, config.optimizersFor(List.of("Tensor")).get(0).patience());

        var strategy = config.strategyFor(List.of("NODDI"));
        assertEquals("MemoryBudget", strategy.name());
        assertEquals(0.25, strategy.doubleOption("memory_fraction", 0.5), 1e-12);
        assertEquals("VoxelRange", config.strategyFor(List.of("Tensor")).name());
    }

    @Test
    void testLaterLayersWinTies() {
        var first = loader.apply(FittingConfiguration.defaultConfig(), """
                                 model_protocol_options:
                                   - match: '^ADC$'
                                     b_value_ranges: [[0, 1.5e9]]
                                 """);
        var second = loader.apply(first, """
                                  model_protocol_options:
                                    - match: '^ADC$'
                                      use_unweighted: false
                                  """);

        var selection = second.protocolSelectionFor(List.of("ADC"));
        assertFalse(selection.useUnweighted());
        assertTrue(selection.bValueRanges().isEmpty());
        assertEquals(2, second.protocolOptions().size());
    }

    @Test
    void testDevices() {
        var config = loader.apply(FittingConfiguration.defaultConfig(), """
                                  devices:
                                    - name: fast
                                      weight: 3
                                      memory_bytes: 1048576
                                    - name: slow
                                  """);

        assertEquals(2, config.devices().size());
        assertEquals(0, config.devices().get(0).index());
        assertEquals(3.0, config.devices().get(0).weight(), 0.0);
        assertEquals(1_048_576L, config.devices().get(0).memoryBytes());
        assertEquals(1, config.devices().get(1).index());
        assertEquals(1.0, config.devices().get(1).weight(), 0.0);
    }

    @Test
    void testLoadExplicitFile() throws IOException {
        var file = tempDir.resolve("run.yaml");
        Files.writeString(file, "optimization:\n  general:\n    extra_optim_runs: 3\n");

        assertEquals(3, loader.load(file).extraOptimRuns());
    }

    @Test
    void testInvalidConfiguration() {
        var base = FittingConfiguration.defaultConfig();
        assertThrows(ConfigurationException.class, () -> loader.apply(base, "sampling: {}"));
        assertThrows(ConfigurationException.class,
                     () -> loader.apply(base, "processing_strategies:\n  sampling: {}"));
        assertThrows(ConfigurationException.class,
                     () -> loader.apply(base, "optimization:\n  model_specific:\n    - optimizers: []"));
        assertThrows(ConfigurationException.class,
                     () -> loader.apply(base, "optimization:\n  general:\n    optimizers: []"));
        assertThrows(ConfigurationException.class,
                     () -> loader.apply(base, "model_protocol_options:\n  - match: '(bad'"));
        assertThrows(ConfigurationException.class, () -> loader.apply(base, "devices:\n  - name: x\n    memory_bytes: 0"));
        assertThrows(ConfigurationException.class, () -> loader.apply(base, "optimization: [unclosed"));
        assertThrows(ConfigurationException.class, () -> loader.load(tempDir.resolve("absent.yaml")));
    }

    @Test
    void testInvalidValuesAreConfigurationErrors() {
        var base = FittingConfiguration.defaultConfig();
        var negativeRuns = "optimization:\n  general:\n    extra_optim_runs: -1";
        var ex = assertThrows(ConfigurationException.class, () -> loader.apply(base, negativeRuns));
        assertTrue(ex.getMessage().contains("extra_optim_runs"));

        var emptyStrategyOption = "processing_strategies:\n  optimization:\n    general:\n      name: VoxelRange\n"
                                  + "      options:\n        max_nmr_voxels: ~";
        ex = assertThrows(ConfigurationException.class, () -> loader.apply(base, emptyStrategyOption));
        assertTrue(ex.getMessage().contains("max_nmr_voxels"));

        var emptyOptimizerOption = "optimization:\n  general:\n    optimizers:\n      - name: Powell\n"
                                   + "        options:\n          tolerance:";
        assertThrows(ConfigurationException.class, () -> loader.apply(base, emptyOptimizerOption));
    }
}
