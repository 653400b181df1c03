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

package com.hellblazer.voxelfit.protocol;

import com.hellblazer.voxelfit.InsufficientDataException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for estimating gradient amplitude and pulse timings
 */
public class SequenceTimingsTest {

    private static final double[] G           = { 0, 0.02, 0.03, 0.04 };
    private static final double[] BIG_DELTA   = { 0.035, 0.035, 0.035, 0.035 };
    private static final double[] SMALL_DELTA = { 0.0, 0.012, 0.012, 0.012 };

    private static double[] expectedB() {
        var b = new double[G.length];
        for (int i = 0; i < b.length; i++) {
            b[i] = SequenceTimings.GAMMA_H * SequenceTimings.GAMMA_H * G[i] * G[i] * SMALL_DELTA[i]
                   * SMALL_DELTA[i] * (BIG_DELTA[i] - SMALL_DELTA[i] / 3.0);
        }
        return b;
    }

    @Test
    void testBFromCompleteTimings() {
        var table = new ColumnTable().addColumn("G", G).addColumn("Delta", BIG_DELTA).addColumn("delta", SMALL_DELTA);
        var b = table.getColumn("b");
        var expected = expectedB();
        for (int i = 0; i < b.length; i++) {
            assertEquals(expected[i], b[i], expected[i] * 1e-12);
        }
    }

    @Test
    void testSmallDeltaFromCubic() {
        var b = expectedB();
        var table = new ColumnTable().addColumn("b", b).addColumn("Delta", BIG_DELTA).addColumn("G", G);
        var smallDelta = table.getColumn("delta");

        assertEquals(0.0, smallDelta[0], "Unweighted rows have no pulse");
        for (int i = 1; i < b.length; i++) {
            assertEquals(SMALL_DELTA[i], smallDelta[i], 1e-9);
            assertEquals(b[i], SequenceTimings.bValue(G[i], BIG_DELTA[i], smallDelta[i]), b[i] * 1e-6);
        }
    }

    @Test
    void testGradientFromBAndTimings() {
        var table = new ColumnTable().addColumn("b", expectedB())
                                     .addColumn("Delta", BIG_DELTA)
                                     .addColumn("delta", SMALL_DELTA);
        var g = table.getColumn("G");
        assertEquals(0.0, g[0]);
        for (int i = 1; i < g.length; i++) {
            assertEquals(G[i], g[i], 1e-9);
        }
    }

    @Test
    void testBigDeltaFromBAndGradient() {
        var b = expectedB();
        var table = new ColumnTable().addColumn("b", b).addColumn("G", G).addColumn("delta", SMALL_DELTA);
        var bigDelta = table.getColumn("Delta");
        assertEquals(0.0, bigDelta[0], "Undefined timings are replaced by zero");
        for (int i = 1; i < b.length; i++) {
            assertEquals(BIG_DELTA[i], bigDelta[i], 1e-9);
        }
    }

    @Test
    void testBulkTimingsFromBAlone() {
        var b = new double[] { 0, 1e9, 3e9 };
        var table = new ColumnTable().addColumn("b", b);
        var timings = SequenceTimings.estimate(table);

        assertEquals(SequenceTimings.DEFAULT_MAX_G, timings.gradientAmplitude()[2], 1e-15);
        assertEquals(0.0, timings.gradientAmplitude()[0]);
        assertEquals(timings.bigDelta()[1], timings.smallDelta()[1]);
        var implied = timings.bValues();
        for (int i = 0; i < b.length; i++) {
            assertEquals(b[i], implied[i], 1e-3 * Math.max(1, b[i]));
        }
    }

    @Test
    void testBulkTimingsUseMaxG() {
        var table = new ColumnTable().addColumn("b", new double[] { 0, 2e9 }).addColumn("maxG", 0.08);
        assertEquals(0.08, table.getColumn("G")[1], 1e-15);
    }

    @Test
    void testNothingToEstimateFrom() {
        var table = new ColumnTable().addColumn("Delta", BIG_DELTA).addColumn("delta", SMALL_DELTA);
        assertThrows(InsufficientDataException.class, () -> SequenceTimings.estimate(table));
    }

    @Test
    void testCubicWithoutRoot() {
        assertTrue(Double.isNaN(SequenceTimings.solveCubic(0.01, 1.0)));
        assertEquals(0.0, SequenceTimings.solveCubic(0.01, 0.0), 1e-6);
    }
}
