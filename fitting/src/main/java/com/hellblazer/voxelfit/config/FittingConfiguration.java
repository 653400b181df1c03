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

import com.hellblazer.voxelfit.balancing.DeviceDescriptor;
import com.hellblazer.voxelfit.data.ProtocolSelection;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The settings of a fitting run.
 *
 * <p>General values apply to every model; model specific overrides are resolved per model chain through
 * {@link ModelChainMatcher}. Immutable: derive changed configurations with the {@code with} methods and scope them
 * with {@link ConfigurationHolder#override}.
 *
 * @author hal.hildebrand
 */
public final class FittingConfiguration {

    public static final String DEFAULT_OPTIMIZER       = "Powell";
    public static final String DEFAULT_STRATEGY        = "VoxelRange";
    public static final int    DEFAULT_MAX_NMR_VOXELS  = 10_000;

    private final List<OptimizerSettings>                      optimizers;
    private final int                                          extraOptimRuns;
    private final ConfigOverrideTable<List<OptimizerSettings>> optimizerOverrides;
    private final StrategySettings                             strategy;
    private final ConfigOverrideTable<StrategySettings>        strategyOverrides;
    private final ConfigOverrideTable<ProtocolSelection>       protocolOptions;
    private final List<DeviceDescriptor>                       devices;

    public FittingConfiguration(List<OptimizerSettings> optimizers, int extraOptimRuns,
                                ConfigOverrideTable<List<OptimizerSettings>> optimizerOverrides,
                                StrategySettings strategy, ConfigOverrideTable<StrategySettings> strategyOverrides,
                                ConfigOverrideTable<ProtocolSelection> protocolOptions,
                                List<DeviceDescriptor> devices) {
        Objects.requireNonNull(optimizers, "optimizers cannot be null");
        if (optimizers.isEmpty()) {
            throw new IllegalArgumentException("At least one optimizer is required");
        }
        if (extraOptimRuns < 0) {
            throw new IllegalArgumentException("extraOptimRuns must be non-negative: " + extraOptimRuns);
        }
        this.optimizers = List.copyOf(optimizers);
        this.extraOptimRuns = extraOptimRuns;
        this.optimizerOverrides = Objects.requireNonNull(optimizerOverrides, "optimizerOverrides cannot be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy cannot be null");
        this.strategyOverrides = Objects.requireNonNull(strategyOverrides, "strategyOverrides cannot be null");
        this.protocolOptions = Objects.requireNonNull(protocolOptions, "protocolOptions cannot be null");
        this.devices = List.copyOf(Objects.requireNonNull(devices, "devices cannot be null"));
    }

    /**
     * Powell optimization, voxel range processing and a single host device.
     */
    public static FittingConfiguration defaultConfig() {
        return new FittingConfiguration(List.of(new OptimizerSettings(DEFAULT_OPTIMIZER,
                                                                      OptimizerSettings.DEFAULT_PATIENCE)), 0,
                                        ConfigOverrideTable.empty(),
                                        new StrategySettings(DEFAULT_STRATEGY,
                                                             Map.of("max_nmr_voxels", DEFAULT_MAX_NMR_VOXELS)),
                                        ConfigOverrideTable.empty(), ConfigOverrideTable.empty(),
                                        List.of(DeviceDescriptor.host()));
    }

    /**
     * The optimizers to run for the model at the end of the chain.
     */
    public List<OptimizerSettings> optimizersFor(List<String> chain) {
        return ModelChainMatcher.resolve(chain, optimizerOverrides).orElse(optimizers);
    }

    public StrategySettings strategyFor(List<String> chain) {
        return ModelChainMatcher.resolve(chain, strategyOverrides).orElse(strategy);
    }

    public ProtocolSelection protocolSelectionFor(List<String> chain) {
        return ModelChainMatcher.resolve(chain, protocolOptions).orElse(ProtocolSelection.all());
    }

    public List<OptimizerSettings> optimizers() {
        return optimizers;
    }

    public int extraOptimRuns() {
        return extraOptimRuns;
    }

    public ConfigOverrideTable<List<OptimizerSettings>> optimizerOverrides() {
        return optimizerOverrides;
    }

    public StrategySettings strategy() {
        return strategy;
    }

    public ConfigOverrideTable<StrategySettings> strategyOverrides() {
        return strategyOverrides;
    }

    public ConfigOverrideTable<ProtocolSelection> protocolOptions() {
        return protocolOptions;
    }

    public List<DeviceDescriptor> devices() {
        return devices;
    }

    public FittingConfiguration withOptimizers(List<OptimizerSettings> newOptimizers) {
        return new FittingConfiguration(newOptimizers, extraOptimRuns, optimizerOverrides, strategy,
                                        strategyOverrides, protocolOptions, devices);
    }

    public FittingConfiguration withExtraOptimRuns(int newExtraOptimRuns) {
        return new FittingConfiguration(optimizers, newExtraOptimRuns, optimizerOverrides, strategy,
                                        strategyOverrides, protocolOptions, devices);
    }

    /**
     * Add optimizer overrides that take precedence over the current ones.
     */
    public FittingConfiguration withOptimizerOverrides(ConfigOverrideTable<List<OptimizerSettings>> overrides) {
        return new FittingConfiguration(optimizers, extraOptimRuns, optimizerOverrides.overriddenBy(overrides),
                                        strategy, strategyOverrides, protocolOptions, devices);
    }

    public FittingConfiguration withStrategy(StrategySettings newStrategy) {
        return new FittingConfiguration(optimizers, extraOptimRuns, optimizerOverrides, newStrategy,
                                        strategyOverrides, protocolOptions, devices);
    }

    /**
     * Add processing strategy overrides that take precedence over the current ones.
     */
    public FittingConfiguration withStrategyOverrides(ConfigOverrideTable<StrategySettings> overrides) {
        return new FittingConfiguration(optimizers, extraOptimRuns, optimizerOverrides, strategy,
                                        strategyOverrides.overriddenBy(overrides), protocolOptions, devices);
    }

    /**
     * Add protocol options that take precedence over the current ones.
     */
    public FittingConfiguration withProtocolOptions(ConfigOverrideTable<ProtocolSelection> overrides) {
        return new FittingConfiguration(optimizers, extraOptimRuns, optimizerOverrides, strategy,
                                        strategyOverrides, protocolOptions.overriddenBy(overrides), devices);
    }

    public FittingConfiguration withDevices(List<DeviceDescriptor> newDevices) {
        return new FittingConfiguration(optimizers, extraOptimRuns, optimizerOverrides, strategy,
                                        strategyOverrides, protocolOptions, newDevices);
    }

    @Override
    public String toString() {
        return String.format("FittingConfiguration[optimizers=%s, strategy=%s, devices=%d, overrides=%d/%d/%d]",
                             optimizers, strategy, devices.size(), optimizerOverrides.size(),
                             strategyOverrides.size(), protocolOptions.size());
    }
}
