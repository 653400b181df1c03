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
import com.hellblazer.voxelfit.cascade.StageResult;
import com.hellblazer.voxelfit.data.ProblemData;
import com.hellblazer.voxelfit.model.Model;
import com.hellblazer.voxelfit.processing.ProcessingContext;
import com.hellblazer.voxelfit.processing.ProcessingStrategy;
import com.hellblazer.voxelfit.processing.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Fits one (non cascade) model with a processing strategy and records the protocol it used.
 *
 * <p>Log output of the fit carries the model name and cascade chain in the MDC keys {@code model} and
 * {@code cascade}.
 *
 * @author hal.hildebrand
 */
public class SingleModelFit {
    private static final Logger log = LoggerFactory.getLogger(SingleModelFit.class);

    public static final String MDC_MODEL   = "model";
    public static final String MDC_CASCADE = "cascade";

    private final Model              model;
    private final ProblemData        data;
    private final ResultStore        store;
    private final String             modelPath;
    private final ProcessingStrategy strategy;
    private final ProcessingContext  context;
    private final boolean            recalculate;
    private final List<String>       chain;

    /**
     * @throws InsufficientDataException if the protocol cannot support the model
     */
    public SingleModelFit(Model model, ProblemData data, ResultStore store, String modelPath,
                          ProcessingStrategy strategy, ProcessingContext context, boolean recalculate,
                          List<String> chain) {
        this.model = Objects.requireNonNull(model, "model cannot be null");
        this.data = Objects.requireNonNull(data, "data cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.modelPath = Objects.requireNonNull(modelPath, "modelPath cannot be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy cannot be null");
        this.context = Objects.requireNonNull(context, "context cannot be null");
        this.recalculate = recalculate;
        this.chain = List.copyOf(chain);

        var problems = model.problems(data.protocol());
        if (!problems.isEmpty()) {
            throw new InsufficientDataException("The protocol is insufficient for this model.", model.name(),
                                                this.chain, problems);
        }
    }

    public StageResult run() {
        try (var m = MDC.putCloseable(MDC_MODEL, model.name());
             var c = MDC.putCloseable(MDC_CASCADE, String.join(" > ", chain))) {
            if (!recalculate && store.isComplete(modelPath)) {
                log.info("Not recalculating {} model, reading stored results", model.name());
                return withModifiers(new StageResult(model.name(), store.readAll(modelPath, model.parameterNames(),
                                                                                 data.voxelCount())));
            }
            log.info("Fitting {} model", model.name());
            long start = System.nanoTime();

            StageResult result;
            try {
                result = strategy.run(model, data, store, modelPath, recalculate, context);
            } catch (PartialFailureException e) {
                throw e.forModel(model.name(), chain);
            }
            result = withModifiers(result);
            store.writeColumnTable(modelPath, data.protocol());

            log.info("Fitted {} model with runtime {} (h:m:s)", model.name(),
                     formatRuntime(Duration.ofNanos(System.nanoTime() - start)));
            return result;
        }
    }

    private StageResult withModifiers(StageResult result) {
        for (var modifier : model.modifiers()) {
            result = result.with(modifier.name(), modifier.apply(result.maps()));
        }
        return result;
    }

    static String formatRuntime(Duration runtime) {
        long seconds = runtime.getSeconds();
        return String.format("%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
