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
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the reporting of fitting errors
 */
public class FittingExceptionTest {

    @Test
    void testMessageNamesModelAndPosition() {
        var ex = new FittingException("diverged", "ADC", List.of("ADC (Cascade)", "ADC"),
                                      new ArithmeticException("NaN residual"));
        assertEquals(1, ex.getChainPosition());
        assertEquals("[ADC (position 1 in [ADC (Cascade), ADC])] diverged: NaN residual", ex.getMessage());
    }

    @Test
    void testWithoutModel() {
        var ex = new ConfigurationException("Unknown model: NODDI");
        assertNull(ex.getModelName());
        assertEquals(-1, ex.getChainPosition());
        assertEquals("Unknown model: NODDI", ex.getMessage());
    }

    @Test
    void testPartialFailureKeepsWorkerCauses() {
        var failures = new LinkedHashMap<WorkRange, Throwable>();
        failures.put(WorkRange.of(0, 5), new IllegalStateException("device lost"));
        failures.put(WorkRange.of(5, 10), new ArithmeticException("singular"));
        var ex = new PartialFailureException(WorkRange.of(0, 10), failures);

        var annotated = ex.forModel("S0", List.of("S0"));
        assertEquals(List.of(WorkRange.of(0, 5), WorkRange.of(5, 10)), annotated.getFailedRanges());
        assertEquals(WorkRange.of(0, 10), annotated.getChunk());
        assertEquals(2, annotated.getSuppressed().length);
        assertEquals("S0", annotated.getModelName());
        assertTrue(annotated.getMessage().startsWith("[S0 (position 0 in [S0])] 2 worker(s) failed"));
    }
}
