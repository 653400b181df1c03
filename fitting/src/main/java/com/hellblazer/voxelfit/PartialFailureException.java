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

package com.hellblazer.voxelfit;

import com.hellblazer.voxelfit.balancing.WorkRange;

import java.util.List;
import java.util.Map;

/**
 * One or more compute workers of a chunk failed. The chunk is neither recorded nor merged; the causes of the
 * individual worker failures are attached as suppressed exceptions.
 */
public class PartialFailureException extends FittingException {

    private final WorkRange       chunk;
    private final List<WorkRange> failedRanges;

    public PartialFailureException(WorkRange chunk, Map<WorkRange, Throwable> failures) {
        super(String.format("%d worker(s) failed processing chunk %s: %s", failures.size(), chunk,
                            failures.keySet()));
        this.chunk = chunk;
        this.failedRanges = List.copyOf(failures.keySet());
        failures.values().forEach(this::addSuppressed);
    }

    private PartialFailureException(PartialFailureException source, String modelName, List<String> chain) {
        super(source.getRawMessage(), modelName, chain, null);
        this.chunk = source.chunk;
        this.failedRanges = source.failedRanges;
        for (var suppressed : source.getSuppressed()) {
            addSuppressed(suppressed);
        }
    }

    /**
     * The same failure annotated with the model and cascade chain it occurred in.
     */
    public PartialFailureException forModel(String modelName, List<String> chain) {
        return new PartialFailureException(this, modelName, chain);
    }

    public WorkRange getChunk() {
        return chunk;
    }

    public List<WorkRange> getFailedRanges() {
        return failedRanges;
    }

    private String getRawMessage() {
        return String.format("%d worker(s) failed processing chunk %s: %s", failedRanges.size(), chunk,
                             failedRanges);
    }
}
