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

package com.hellblazer.voxelfit.config;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds the configuration payload that best fits a model chain, e.g. {@code ["BallStick", "S0"]} for the S0 stage of
 * a BallStick cascade.
 *
 * <p>Keys are tried shortest first, and in table order among keys of equal length, in three passes:
 * <ol>
 * <li>a key of the chain's length matching every element</li>
 * <li>a single pattern key matching the last model of the chain</li>
 * <li>a tuple key any of whose suffixes matches the whole chain</li>
 * </ol>
 *
 * @author hal.hildebrand
 */
public final class ModelChainMatcher {

    private ModelChainMatcher() {
    }

    public static <T> Optional<T> resolve(List<String> chain, ConfigOverrideTable<T> table) {
        if (chain == null || chain.isEmpty() || table.isEmpty()) {
            return Optional.empty();
        }
        // List.sort is stable, preserving table order among keys of equal length
        var ascending = new ArrayList<>(table.entries());
        ascending.sort(Comparator.comparingInt(e -> e.key().length()));

        for (var entry : ascending) {
            if (entry.key().matches(chain)) {
                return Optional.of(entry.payload());
            }
        }

        var last = List.of(chain.get(chain.size() - 1));
        for (var entry : ascending) {
            if (!entry.key().isTuple() && entry.key().matches(last)) {
                return Optional.of(entry.payload());
            }
        }

        for (var entry : ascending) {
            var key = entry.key();
            if (!key.isTuple()) {
                continue;
            }
            for (int from = 0; from < key.length(); from++) {
                if (key.matches(chain, from)) {
                    return Optional.of(entry.payload());
                }
            }
        }
        return Optional.empty();
    }
}
