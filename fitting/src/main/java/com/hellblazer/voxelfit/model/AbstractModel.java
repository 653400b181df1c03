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

import com.hellblazer.voxelfit.protocol.ColumnTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base for models whose protocol requirement is a set of columns, real or estimable.
 *
 * @author hal.hildebrand
 */
public abstract class AbstractModel implements Model {

    private final String       name;
    private final List<String> parameterNames;
    private final List<String> requiredColumns;

    protected AbstractModel(String name, List<String> parameterNames, List<String> requiredColumns) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.parameterNames = List.copyOf(parameterNames);
        this.requiredColumns = List.copyOf(requiredColumns);
        if (this.parameterNames.isEmpty()) {
            throw new IllegalArgumentException("Model " + name + " has no parameters");
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> parameterNames() {
        return parameterNames;
    }

    public List<String> requiredColumns() {
        return requiredColumns;
    }

    @Override
    public List<String> problems(ColumnTable protocol) {
        var problems = new ArrayList<String>();
        for (var column : requiredColumns) {
            if (!protocol.hasColumn(column)) {
                problems.add("Missing column " + column);
            }
        }
        if (problems.isEmpty()) {
            problems.addAll(additionalProblems(protocol));
        }
        return problems;
    }

    /**
     * Problems beyond missing columns, checked once all required columns resolve.
     */
    protected List<String> additionalProblems(ColumnTable protocol) {
        return List.of();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
