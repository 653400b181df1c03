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

import com.hellblazer.voxelfit.InsufficientDataException;
import com.hellblazer.voxelfit.PartialFailureException;
import com.hellblazer.voxelfit.config.ConfigOverrideTable;
import com.hellblazer.voxelfit.config.ConfigurationHolder;
import com.hellblazer.voxelfit.config.FittingConfiguration;
import com.hellblazer.voxelfit.data.ProtocolSelection;
import com.hellblazer.voxelfit.model.Fittable;
import com.hellblazer.voxelfit.model.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Fits a list of models on every subject of a batch.
 *
 * <p>A subject whose every model output already exists is skipped unless recalculating. A model the subject's
 * protocol cannot support, or whose chunk fails on a device, is logged and skipped; the remaining models and
 * subjects still run. Configuration and resource errors abort the batch.
 *
 * @author hal.hildebrand
 */
public class BatchFitting {
    private static final Logger log = LoggerFactory.getLogger(BatchFitting.class);

    private final List<SubjectInfo>                      subjects;
    private final List<String>                           models;
    private final ModelRegistry                          registry;
    private final ConfigurationHolder                    configuration;
    private final ConfigOverrideTable<ProtocolSelection> protocolOptions;
    private final boolean                                recalculate;
    private final boolean                                cascadeSubdir;
    private final List<Integer>                          deviceIndices;

    private BatchFitting(Builder builder) {
        this.subjects = List.copyOf(builder.subjects);
        this.models = List.copyOf(builder.models);
        this.registry = builder.registry;
        this.configuration = builder.configuration;
        this.protocolOptions = builder.protocolOptions;
        this.recalculate = builder.recalculate;
        this.cascadeSubdir = builder.cascadeSubdir;
        this.deviceIndices = builder.deviceIndices;
        // unknown model names fail before any subject is touched
        models.forEach(registry::get);
    }

    public static Builder builder(List<SubjectInfo> subjects, List<String> models) {
        return new Builder(subjects, models);
    }

    public List<BatchOutcome> run() {
        log.info("Running computations on {} subjects", subjects.size());
        var outcomes = new ArrayList<BatchOutcome>(subjects.size());
        for (var subject : subjects) {
            outcomes.add(run(subject));
        }
        return outcomes;
    }

    private BatchOutcome run(SubjectInfo subject) {
        var targets = new ArrayList<Fittable>();
        models.forEach(name -> targets.add(registry.get(name)));
        if (!recalculate && targets.stream()
                                   .allMatch(t -> ModelFit.outputExists(t, subject.output(), cascadeSubdir))) {
            log.info("Skipping subject {}, output exists", subject.subjectId());
            return BatchOutcome.skipped(subject.subjectId());
        }

        log.info("Loading the data of subject {}", subject.subjectId());
        var data = subject.loader().load();
        var fitted = new ArrayList<String>();
        var failed = new LinkedHashMap<String, String>();
        long start = System.nanoTime();
        for (var target : targets) {
            log.info("Going to fit model {} on subject {}", target.name(), subject.subjectId());
            try {
                ModelFit.builder(target, data, subject.output())
                        .configuration(configuration)
                        .protocolOptions(protocolOptions)
                        .recalculate(recalculate)
                        .onlyRecalculateLast(true)
                        .cascadeSubdir(cascadeSubdir)
                        .deviceIndices(deviceIndices)
                        .build()
                        .run();
                fitted.add(target.name());
                log.info("Done fitting model {} on subject {}", target.name(), subject.subjectId());
            } catch (InsufficientDataException e) {
                log.info("Could not fit model {} on subject {} due to protocol problems. {}", target.name(),
                         subject.subjectId(), e.getMessage());
                failed.put(target.name(), e.getMessage());
            } catch (PartialFailureException e) {
                log.warn("Fitting model {} on subject {} failed: {}", target.name(), subject.subjectId(),
                         e.getMessage(), e);
                failed.put(target.name(), e.getMessage());
            }
        }
        log.info("Fitted all models on subject {} in time {} (h:m:s)", subject.subjectId(),
                 SingleModelFit.formatRuntime(Duration.ofNanos(System.nanoTime() - start)));
        return new BatchOutcome(subject.subjectId(), false, fitted, failed);
    }

    public static final class Builder {
        private final List<SubjectInfo>                subjects;
        private final List<String>                     models;
        private ModelRegistry                          registry        = ModelRegistry.standard();
        private ConfigurationHolder                    configuration   = new ConfigurationHolder(
        FittingConfiguration.defaultConfig());
        private ConfigOverrideTable<ProtocolSelection> protocolOptions = ConfigOverrideTable.empty();
        private boolean                                recalculate     = false;
        private boolean                                cascadeSubdir   = false;
        private List<Integer>                          deviceIndices   = null;

        private Builder(List<SubjectInfo> subjects, List<String> models) {
            this.subjects = Objects.requireNonNull(subjects, "subjects cannot be null");
            this.models = Objects.requireNonNull(models, "models cannot be null");
        }

        public Builder registry(ModelRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry cannot be null");
            return this;
        }

        public Builder configuration(FittingConfiguration configuration) {
            this.configuration = new ConfigurationHolder(
            Objects.requireNonNull(configuration, "configuration cannot be null"));
            return this;
        }

        /**
         * Each model fit reads the configuration from the holder as it starts.
         */
        public Builder configuration(ConfigurationHolder configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
            return this;
        }

        public Builder protocolOptions(ConfigOverrideTable<ProtocolSelection> protocolOptions) {
            this.protocolOptions = Objects.requireNonNull(protocolOptions, "protocolOptions cannot be null");
            return this;
        }

        public Builder recalculate(boolean recalculate) {
            this.recalculate = recalculate;
            return this;
        }

        public Builder cascadeSubdir(boolean cascadeSubdir) {
            this.cascadeSubdir = cascadeSubdir;
            return this;
        }

        public Builder deviceIndices(List<Integer> deviceIndices) {
            this.deviceIndices = deviceIndices == null ? null : List.copyOf(deviceIndices);
            return this;
        }

        public BatchFitting build() {
            return new BatchFitting(this);
        }
    }
}
