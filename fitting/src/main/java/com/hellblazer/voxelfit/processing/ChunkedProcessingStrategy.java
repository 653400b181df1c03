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

package com.hellblazer.voxelfit.processing;

import com.hellblazer.voxelfit.balancing.DeviceDescriptor;
import com.hellblazer.voxelfit.balancing.WorkPartitioner;
import com.hellblazer.voxelfit.balancing.WorkRange;
import com.hellblazer.voxelfit.cascade.StageResult;
import com.hellblazer.voxelfit.data.ProblemData;
import com.hellblazer.voxelfit.model.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Processes voxels in consecutive chunks, strictly one after another: a chunk is written to the store before the
 * next one starts. Subclasses decide the chunk size.
 *
 * <p>Stored chunks are reused only when they belong to the current chunk layout. Chunks left by a different layout,
 * e.g. after the devices changed, invalidate the model path.
 *
 * @author hal.hildebrand
 */
public abstract class ChunkedProcessingStrategy implements ProcessingStrategy {
    private static final Logger log = LoggerFactory.getLogger(ChunkedProcessingStrategy.class);

    @Override
    public StageResult run(Model model, ProblemData data, ResultStore store, String modelPath, boolean recalculate,
                           ProcessingContext context) {
        if (recalculate) {
            store.invalidate(modelPath);
        }
        int voxels = data.voxelCount();
        var names = model.parameterNames();
        var merged = new double[names.size()][voxels];
        if (voxels == 0) {
            return toResult(model, names, merged);
        }

        int preferred = chunkSize(model, data, context.devices(), context.partitioner());
        int chunkSize = Math.max(minimumChunkSize(), Math.min(preferred, voxels));
        var layout = new ArrayList<WorkRange>();
        for (int start = 0; start < voxels; start += chunkSize) {
            layout.add(new WorkRange(start, Math.min(voxels, start + chunkSize)));
        }
        if (!recalculate) {
            var stale = new ArrayList<>(store.chunks(modelPath));
            stale.removeAll(layout);
            if (!stale.isEmpty()) {
                log.info("{} stored chunk(s) of {} were written with another chunk layout, recomputing", stale.size(),
                         modelPath);
                store.invalidate(modelPath);
            }
        }
        int chunks = layout.size();
        log.info("Processing {} voxels of {} in {} chunk(s) of at most {}", voxels, modelPath, chunks, chunkSize);

        int index = 0;
        for (var chunk : layout) {
            index++;
            Map<String, double[]> values;
            if (!recalculate && store.exists(modelPath, chunk)) {
                log.debug("Chunk {} of {} already computed, reading", chunk, modelPath);
                values = store.read(modelPath, chunk);
            } else {
                var computed = context.dispatcher()
                                      .process(chunk, () -> model.createKernel(context.kernelContext()),
                                               data.dataset(), names.size(), context.environments(),
                                               context.partitioner());
                values = new LinkedHashMap<>();
                for (int p = 0; p < names.size(); p++) {
                    values.put(names.get(p), computed[p]);
                }
                store.write(modelPath, chunk, values);
            }
            merge(names, values, chunk, merged);
            log.info("Finished chunk {} of {} ({} voxels, {}%)", index, chunks, chunk.end(),
                     String.format("%.1f", 100.0 * chunk.end() / voxels));
        }
        return toResult(model, names, merged);
    }

    /**
     * The preferred number of voxels per chunk; clamped to {@code [minimumChunkSize, voxelCount]}.
     */
    protected abstract int chunkSize(Model model, ProblemData data, List<DeviceDescriptor> devices,
                                     WorkPartitioner partitioner);

    protected int minimumChunkSize() {
        return 1;
    }

    private static void merge(List<String> names, Map<String, double[]> values, WorkRange chunk, double[][] merged) {
        for (int p = 0; p < names.size(); p++) {
            var chunkValues = values.get(names.get(p));
            if (chunkValues == null || chunkValues.length != chunk.size()) {
                throw new IllegalStateException(
                String.format("Stored chunk %s lacks %d values for %s", chunk, chunk.size(), names.get(p)));
            }
            System.arraycopy(chunkValues, 0, merged[p], chunk.start(), chunk.size());
        }
    }

    private static StageResult toResult(Model model, List<String> names, double[][] merged) {
        var maps = new LinkedHashMap<String, double[]>();
        for (int p = 0; p < names.size(); p++) {
            maps.put(names.get(p), merged[p]);
        }
        return new StageResult(model.name(), maps);
    }
}
