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

package com.hellblazer.voxelfit.model;

import com.hellblazer.voxelfit.cascade.StageResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * An ordered chain of fits where later stages may be seeded from the results of earlier ones, e.g. S0 followed by an
 * ADC fit initialized with the S0 map.
 *
 * <p>Stages may themselves be cascades. Stages are traversed with {@link com.hellblazer.voxelfit.cascade.CascadeState}.
 *
 * @author hal.hildebrand
 */
public final class CascadeDefinition implements Fittable {

    private final String      name;
    private final List<Stage> stages;

    private CascadeDefinition(String name, List<Stage> stages) {
        this.name = name;
        this.stages = List.copyOf(stages);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String name() {
        return name;
    }

    public List<Stage> stages() {
        return stages;
    }

    public int stageCount() {
        return stages.size();
    }

    /**
     * The name of the final stage; its results are the results of the cascade.
     */
    public String lastStageName() {
        return stages.get(stages.size() - 1).name();
    }

    @Override
    public String toString() {
        return "Cascade[" + name + ": " + stages.stream().map(Stage::name).toList() + "]";
    }

    /**
     * One stage: its name, and how to build it from the results of the stages before it, keyed by stage name.
     */
    public record Stage(String name, Function<Map<String, StageResult>, ? extends Fittable> factory) {
        public Stage {
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(factory, "factory cannot be null");
        }

        public Fittable create(Map<String, StageResult> priorResults) {
            return Objects.requireNonNull(factory.apply(priorResults), "stage " + name + " produced nothing");
        }
    }

    public static final class Builder {
        private final String      name;
        private final List<Stage> stages = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name cannot be null");
        }

        /**
         * A stage that does not depend on earlier results.
         */
        public Builder stage(Fittable fittable) {
            stages.add(new Stage(fittable.name(), priors -> fittable));
            return this;
        }

        /**
         * A stage built from the results of earlier stages.
         */
        public Builder stage(String stageName, Function<Map<String, StageResult>, ? extends Fittable> factory) {
            stages.add(new Stage(stageName, factory));
            return this;
        }

        public CascadeDefinition build() {
            if (stages.isEmpty()) {
                throw new IllegalArgumentException("Cascade " + name + " has no stages");
            }
            return new CascadeDefinition(name, stages);
        }
    }
}
