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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What batch fitting did for one subject.
 *
 * @param subjectId the subject
 * @param skipped   true if every output already existed and nothing was fitted
 * @param fitted    models fitted, in order
 * @param failed    models not fitted, with the reason, in the order they failed
 */
public record BatchOutcome(String subjectId, boolean skipped, List<String> fitted, Map<String, String> failed) {

    public BatchOutcome {
        fitted = List.copyOf(fitted);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }

    static BatchOutcome skipped(String subjectId) {
        return new BatchOutcome(subjectId, true, List.of(), Map.of());
    }
}
