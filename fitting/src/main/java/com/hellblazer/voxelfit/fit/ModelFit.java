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
import com.hellblazer.voxelfit.balancing.DeviceDescriptor;
import com.hellblazer.voxelfit.balancing.EvenDistribution;
import com.hellblazer.voxelfit.balancing.WeightedDistribution;
import com.hellblazer.voxelfit.balancing.WorkPartitioner;
import com.hellblazer.voxelfit.cascade.CascadeState;
import com.hellblazer.voxelfit.cascade.StageResult;
import com.hellblazer.voxelfit.compute.ChunkDispatcher;
import com.hellblazer.voxelfit.compute.ComputeEnvironment;
import com.hellblazer.voxelfit.compute.KernelContext;
import com.hellblazer.voxelfit.config.ConfigOverrideTable;
import com.hellblazer.voxelfit.config.ConfigurationHolder;
import com.hellblazer.voxelfit.config.FittingConfiguration;
import com.hellblazer.voxelfit.data.ProblemData;
import com.hellblazer.voxelfit.data.ProtocolSelection;
import com.hellblazer.voxelfit.model.CascadeDefinition;
import com.hellblazer.voxelfit.model.Fittable;
import com.hellblazer.voxelfit.model.Model;
import com.hellblazer.voxelfit.processing.ProcessingContext;
import com.hellblazer.voxelfit.processing.ProcessingStrategyFactory;
import com.hellblazer.voxelfit.processing.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Fits a model or a cascade of models.
 *
 * <p>The configuration is read from its {@link ConfigurationHolder} when {@link #run()} starts and stays fixed for
 * the rest of that run.
 *
 * <p>Cascades are fitted stage by stage, each stage seeded from the results of the stages before it. The model chain
 * leading to each single model, e.g. {@code ["ADC (Cascade)", "S0"]}, selects its optimizers, processing strategy
 * and protocol rows from the configuration.
 *
 * <p>With {@code recalculate} and {@code onlyRecalculateLast}, only the final stage of the top level cascade is
 * recomputed; earlier stages reuse stored output. Nested cascades recompute fully when their parent recomputes.
 *
 * @author hal.hildebrand
 */
public class ModelFit {
    private static final Logger log = LoggerFactory.getLogger(ModelFit.class);

    private final Fittable                               target;
    private final ProblemData                            data;
    private final ResultStore                            store;
    private final ConfigurationHolder                    configuration;
    private final ConfigOverrideTable<ProtocolSelection> protocolOptions;
    private final boolean                                recalculate;
    private final boolean                                onlyRecalculateLast;
    private final boolean                                useProtocolOptions;
    private final String                                 pathPrefix;
    private final List<Integer>                          deviceIndices;
    private final ChunkDispatcher                        dispatcher;

    private ModelFit(Builder builder) {
        this.target = builder.target;
        this.data = builder.data;
        this.store = builder.store;
        this.configuration = builder.configuration;
        this.protocolOptions = builder.protocolOptions;
        this.recalculate = builder.recalculate;
        this.onlyRecalculateLast = builder.onlyRecalculateLast;
        this.useProtocolOptions = builder.useProtocolOptions;
        this.pathPrefix = pathPrefix(target, builder.cascadeSubdir);
        this.deviceIndices = builder.deviceIndices;
        this.dispatcher = builder.dispatcher;

        if (target instanceof Model model) {
            var problems = model.problems(data.protocol());
            if (!problems.isEmpty()) {
                throw new InsufficientDataException("The protocol is insufficient for this model.", model.name(),
                                                    List.of(model.name()), problems);
            }
        }
    }

    public static Builder builder(Fittable target, ProblemData data, ResultStore store) {
        return new Builder(target, data, store);
    }

    /**
     * True if the stored output of the target is complete: for a cascade, that of its final stage.
     */
    public static boolean outputExists(Fittable target, ResultStore store, boolean cascadeSubdir) {
        var prefix = pathPrefix(target, cascadeSubdir);
        if (target instanceof CascadeDefinition cascade) {
            return store.isComplete(prefix + cascade.lastStageName());
        }
        return store.isComplete(prefix + target.name());
    }

    private static String pathPrefix(Fittable target, boolean cascadeSubdir) {
        return cascadeSubdir && target instanceof CascadeDefinition ? target.name() + "/" : "";
    }

    /**
     * Fit the target.
     *
     * @return the results of the model, or of the final stage of a cascade
     */
    public StageResult run() {
        var current = configuration.get();
        if (!protocolOptions.isEmpty()) {
            current = current.withProtocolOptions(protocolOptions);
        }
        var devices = selectDevices(current);
        WorkPartitioner partitioner = deviceIndices == null ? new WeightedDistribution() : new EvenDistribution();
        var environments = ComputeEnvironment.forDevices(devices);
        var session = new Session(current, environments, partitioner);
        try {
            return fit(target, recalculate, onlyRecalculateLast, new ArrayDeque<>(), session);
        } finally {
            ComputeEnvironment.closeAll(environments);
        }
    }

    private StageResult fit(Fittable fittable, boolean recalc, boolean onlyLast, Deque<String> chain,
                            Session session) {
        chain.addLast(fittable.name());
        try {
            if (fittable instanceof CascadeDefinition cascade) {
                var results = new LinkedHashMap<String, StageResult>();
                StageResult last = null;
                var state = CascadeState.start(cascade);
                while (state.hasNext()) {
                    var step = state.next(results);
                    boolean subRecalculate = recalc && (!onlyLast || !step.following().hasNext());
                    last = fit(step.stage(), subRecalculate, recalc, chain, session);
                    results.put(step.stage().name(), last);
                    state = step.following();
                }
                return last;
            }
            if (fittable instanceof Model model) {
                return fitSingle(model, recalc, List.copyOf(chain), session);
            }
            throw new ConfigurationException("Cannot fit " + fittable.name() + " of type " + fittable.getClass());
        } finally {
            chain.removeLast();
        }
    }

    private StageResult fitSingle(Model model, boolean recalc, List<String> chain, Session session) {
        log.info("Preparing for model {}", model.name());
        log.info("Current cascade: {}", chain);

        var configuration = session.configuration();
        var selection = useProtocolOptions ? configuration.protocolSelectionFor(chain) : ProtocolSelection.all();
        var problemData = selection.apply(data);
        var strategy = ProcessingStrategyFactory.create(configuration.strategyFor(chain));
        var kernelContext = new KernelContext(problemData.protocol(), configuration.optimizersFor(chain),
                                              configuration.extraOptimRuns());
        var context = new ProcessingContext(session.environments(), session.partitioner(), dispatcher,
                                            kernelContext);

        return new SingleModelFit(model, problemData, store, pathPrefix + model.name(), strategy, context, recalc,
                                  chain).run();
    }

    private List<DeviceDescriptor> selectDevices(FittingConfiguration configuration) {
        var configured = configuration.devices();
        if (deviceIndices == null) {
            return configured;
        }
        var selected = new ArrayList<DeviceDescriptor>();
        for (int index : deviceIndices) {
            if (index < 0 || index >= configured.size()) {
                throw new ConfigurationException(
                String.format("Device index %d out of range, %d devices configured", index, configured.size()));
            }
            selected.add(configured.get(index));
        }
        return selected;
    }

    /**
     * What one run resolved before fitting: the configuration in effect and the devices it runs on.
     */
    private record Session(FittingConfiguration configuration, List<ComputeEnvironment> environments,
                           WorkPartitioner partitioner) {
    }

    public static final class Builder {
        private final Fittable                               target;
        private final ProblemData                            data;
        private final ResultStore                            store;
        private ConfigurationHolder                          configuration       = new ConfigurationHolder(
        FittingConfiguration.defaultConfig());
        private ConfigOverrideTable<ProtocolSelection>       protocolOptions     = ConfigOverrideTable.empty();
        private boolean                                      recalculate         = false;
        private boolean                                      onlyRecalculateLast = false;
        private boolean                                      useProtocolOptions  = true;
        private boolean                                      cascadeSubdir       = false;
        private List<Integer>                                deviceIndices       = null;
        private ChunkDispatcher                              dispatcher          = new ChunkDispatcher();

        private Builder(Fittable target, ProblemData data, ResultStore store) {
            this.target = Objects.requireNonNull(target, "target cannot be null");
            this.data = Objects.requireNonNull(data, "data cannot be null");
            this.store = Objects.requireNonNull(store, "store cannot be null");
        }

        public Builder configuration(FittingConfiguration configuration) {
            this.configuration = new ConfigurationHolder(
            Objects.requireNonNull(configuration, "configuration cannot be null"));
            return this;
        }

        /**
         * Read the configuration from the holder when the fit runs, so an override scope open at that time applies.
         */
        public Builder configuration(ConfigurationHolder configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
            return this;
        }

        /**
         * Protocol options taking precedence over those of the configuration.
         */
        public Builder protocolOptions(ConfigOverrideTable<ProtocolSelection> protocolOptions) {
            this.protocolOptions = Objects.requireNonNull(protocolOptions, "protocolOptions cannot be null");
            return this;
        }

        public Builder recalculate(boolean recalculate) {
            this.recalculate = recalculate;
            return this;
        }

        public Builder onlyRecalculateLast(boolean onlyRecalculateLast) {
            this.onlyRecalculateLast = onlyRecalculateLast;
            return this;
        }

        public Builder useProtocolOptions(boolean useProtocolOptions) {
            this.useProtocolOptions = useProtocolOptions;
            return this;
        }

        /**
         * Write the stages of a top level cascade under a directory named after the cascade, instead of sharing
         * the output of equally named models across cascades.
         */
        public Builder cascadeSubdir(boolean cascadeSubdir) {
            this.cascadeSubdir = cascadeSubdir;
            return this;
        }

        /**
         * Run on these configured devices only, splitting work evenly among them.
         */
        public Builder deviceIndices(List<Integer> deviceIndices) {
            this.deviceIndices = deviceIndices == null ? null : List.copyOf(deviceIndices);
            return this;
        }

        public Builder dispatcher(ChunkDispatcher dispatcher) {
            this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher cannot be null");
            return this;
        }

        /**
         * @throws InsufficientDataException if the target is a single model the protocol cannot support
         */
        public ModelFit build() {
            return new ModelFit(this);
        }
    }
}
