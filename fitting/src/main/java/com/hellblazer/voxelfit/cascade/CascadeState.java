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

package com.hellblazer.voxelfit.cascade;

import com.hellblazer.voxelfit.model.CascadeDefinition;
import com.hellblazer.voxelfit.model.Fittable;

import java.util.Map;
import java.util.Objects;

/**
 * Position of a traversal through a cascade.
 *
 * <p>The state is an immutable value: {@link #next} returns the stage to run together with the state following it,
 * and never holds on to stage results. Callers keep the results and pass those accumulated so far to each step.
 *
 * <pre>{@code
 * var state = CascadeState.start(cascade);
 * while (state.hasNext()) {
 *     var step = state.next(results);
 *     results.put(step.stage().name(), fit(step.stage()));
 *     state = step.following();
 * }
 * }</pre>
 *
 * @param cascade  the cascade being traversed
 * @param position index of the next stage to produce
 * @author hal.hildebrand
 */
public record CascadeState(CascadeDefinition cascade, int position) {

    public enum Status {
        PENDING, RUNNING, EXHAUSTED
    }

    public CascadeState {
        Objects.requireNonNull(cascade, "cascade cannot be null");
        if (position < 0 || position > cascade.stageCount()) {
            throw new IllegalArgumentException(
            String.format("Position %d outside cascade %s of %d stages", position, cascade.name(),
                          cascade.stageCount()));
        }
    }

    public static CascadeState start(CascadeDefinition cascade) {
        return new CascadeState(cascade, 0);
    }

    public Status status() {
        if (position == 0) {
            return Status.PENDING;
        }
        return position == cascade.stageCount() ? Status.EXHAUSTED : Status.RUNNING;
    }

    public boolean hasNext() {
        return position < cascade.stageCount();
    }

    /**
     * True if the next stage is the final one.
     */
    public boolean isLast() {
        return position == cascade.stageCount() - 1;
    }

    /**
     * Build the next stage from the results produced so far.
     *
     * @param priorResults results of earlier stages by stage name
     * @throws IllegalStateException if every stage has been produced
     */
    public Step next(Map<String, StageResult> priorResults) {
        if (!hasNext()) {
            throw new IllegalStateException("Cascade " + cascade.name() + " is exhausted");
        }
        var stage = cascade.stages().get(position).create(Map.copyOf(priorResults));
        return new Step(stage, new CascadeState(cascade, position + 1));
    }

    /**
     * A pending state for the same cascade.
     */
    public CascadeState reset() {
        return start(cascade);
    }

    /**
     * @param stage     the stage to run
     * @param following the state after this stage
     */
    public record Step(Fittable stage, CascadeState following) {
    }
}
