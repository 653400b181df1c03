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

/**
 * The smallest allowed chunk does not fit the smallest single-device budget. Fatal to the current run.
 */
public class ResourceExhaustionException extends FittingException {

    private final long requiredBytes;
    private final long budgetBytes;

    public ResourceExhaustionException(String message, long requiredBytes, long budgetBytes) {
        super(String.format("%s (required %d bytes, budget %d bytes)", message, requiredBytes, budgetBytes));
        this.requiredBytes = requiredBytes;
        this.budgetBytes = budgetBytes;
    }

    public long getRequiredBytes() {
        return requiredBytes;
    }

    public long getBudgetBytes() {
        return budgetBytes;
    }
}
