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
import com.hellblazer.voxelfit.model.standard.AdcCascade;
import com.hellblazer.voxelfit.model.standard.AdcModel;
import com.hellblazer.voxelfit.model.standard.S0Model;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for traversing cascades
 *
 * @author hal.hildebrand
 */
public class CascadeStateTest {

    private static StageResult s0Result(double... values) {
        return new StageResult(S0Model.NAME, Map.of(S0Model.S0, values));
    }

    @Test
    public void testTwoStageTraversal() {
        var state = CascadeState.start(AdcCascade.create());
        assertEquals(CascadeState.Status.PENDING, state.status());
        assertTrue(state.hasNext());

        var results = new HashMap<String, StageResult>();
        var first = state.next(results);
        assertEquals(S0Model.NAME, first.stage().name());
        assertEquals(CascadeState.Status.RUNNING, first.following().status());
        assertTrue(first.following().hasNext());
        assertTrue(first.following().isLast());
        results.put(S0Model.NAME, s0Result(100, 200));

        var second = first.following().next(results);
        assertEquals(AdcModel.NAME, second.stage().name());
        assertFalse(second.following().hasNext());
        assertEquals(CascadeState.Status.EXHAUSTED, second.following().status());
        assertThrows(IllegalStateException.class, () -> second.following().next(results));
    }

    @Test
    public void testLaterStagesSeeTheirPriors() {
        var seen = new HashMap<String, StageResult>();
        var cascade = CascadeDefinition.builder("Seeded").stage(new S0Model()).stage(AdcModel.NAME, priors -> {
            seen.putAll(priors);
            return new AdcModel(priors.get(S0Model.NAME).get(S0Model.S0));
        }).build();

        var state = CascadeState.start(cascade);
        var step = state.next(Map.of());
        step.following().next(Map.of(S0Model.NAME, s0Result(5)));

        assertEquals(List.of(S0Model.NAME), List.copyOf(seen.keySet()));
        assertArrayEquals(new double[] { 5 }, seen.get(S0Model.NAME).get(S0Model.S0));
    }

    @Test
    public void testResetRestartsWithoutDiscardingResults() {
        var cascade = AdcCascade.create();
        var results = new HashMap<String, StageResult>();
        var state = CascadeState.start(cascade);
        var step = state.next(results);
        results.put(S0Model.NAME, s0Result(1));
        state = step.following().next(results).following();
        assertFalse(state.hasNext());

        var restarted = state.reset();
        assertEquals(CascadeState.Status.PENDING, restarted.status());
        assertEquals(S0Model.NAME, restarted.next(results).stage().name());
        assertTrue(results.containsKey(S0Model.NAME), "Results held by the caller survive a reset");
    }

    @Test
    public void testStatesAreValues() {
        var cascade = AdcCascade.create();
        var state = CascadeState.start(cascade);
        var step = state.next(Map.of());
        assertEquals(0, state.position(), "Advancing does not mutate the original state");
        assertEquals(new CascadeState(cascade, 1), step.following());
        assertThrows(IllegalArgumentException.class, () -> new CascadeState(cascade, 3));
    }

    @Test
    public void testStageResult() {
        var result = new StageResult("ADC", Map.of("ADC.d", new double[] { 1, 2 }));
        assertEquals(2, result.voxelCount());
        assertTrue(result.find("ADC.s0").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> result.get("ADC.s0"));
        assertEquals(List.of("ADC.d", "extra"), result.with("extra", new double[] { 3, 4 }).mapNames());
        assertThrows(IllegalArgumentException.class, () -> result.with("short", new double[] { 1 }));
    }

    @Test
    public void testStageResultIsImmutable() {
        var values = new double[] { 1, 2 };
        var result = new StageResult("ADC", Map.of("ADC.d", values));

        values[0] = -1;
        assertEquals(1.0, result.get("ADC.d")[0], "Recorded values do not follow the caller's array");
        result.get("ADC.d")[1] = -2;
        result.maps().get("ADC.d")[1] = -2;
        assertEquals(2.0, result.get("ADC.d")[1], "Returned arrays are copies");
    }
}
