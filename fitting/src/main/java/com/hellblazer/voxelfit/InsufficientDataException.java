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

import java.util.List;

/**
 * A model's required columns cannot be resolved, real or virtual, from the given column table.
 *
 * <p>Batch fitting treats this as "skip this model" and continues with the next one.
 */
public class InsufficientDataException extends FittingException {

    private final List<String> problems;

    public InsufficientDataException(String message) {
        super(message);
        this.problems = List.of();
    }

    public InsufficientDataException(String message, String modelName, List<String> chain, List<String> problems) {
        super(message + (problems.isEmpty() ? "" : " " + problems), modelName, chain, null);
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
