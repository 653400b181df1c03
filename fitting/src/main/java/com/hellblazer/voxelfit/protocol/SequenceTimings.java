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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Gradient amplitude and pulse timings of a diffusion acquisition, per measurement.
 *
 * <p>{@link #estimate(ColumnTable)} uses whatever real columns the table has, in decreasing order of fidelity:
 * <ol>
 * <li>G, Delta and delta, verbatim</li>
 * <li>b, Delta and delta: G from the b value equation</li>
 * <li>b, Delta and G: delta as the root of the cubic {@code -d^3/3 + Delta d^2 - b/(gamma^2 G^2) = 0}</li>
 * <li>b, G and delta: Delta solved from the b value equation</li>
 * <li>b alone: bulk timings assuming the maximum gradient amplitude at the largest shell</li>
 * </ol>
 *
 * @param gradientAmplitude G in T/m
 * @param bigDelta          Delta in s
 * @param smallDelta        delta in s
 * @author hal.hildebrand
 */
public record SequenceTimings(double[] gradientAmplitude, double[] bigDelta, double[] smallDelta) {
    /**
     * Gyromagnetic ratio of hydrogen, rad s^-1 T^-1
     */
    public static final double GAMMA_H       = 267.5987e6;
    /**
     * Maximum gradient amplitude assumed when no maxG column is given, T/m
     */
    public static final double DEFAULT_MAX_G = 0.04;

    private static final Logger log             = LoggerFactory.getLogger(SequenceTimings.class);
    private static final int    MAX_ITERATIONS  = 100;
    private static final double ROOT_TOLERANCE  = 1e-15;

    public SequenceTimings {
        if (gradientAmplitude.length != bigDelta.length || bigDelta.length != smallDelta.length) {
            throw new IllegalArgumentException("Timing columns must have equal length");
        }
    }

    /**
     * Estimate the timings from the real columns of the table.
     *
     * @throws InsufficientDataException if neither the complete timings nor {@code b} are real
     */
    public static SequenceTimings estimate(ColumnTable table) {
        var g = table.getRealColumn("G");
        var bigDelta = table.getRealColumn("Delta");
        var smallDelta = table.getRealColumn("delta");
        if (g.isPresent() && bigDelta.isPresent() && smallDelta.isPresent()) {
            return new SequenceTimings(g.get(), bigDelta.get(), smallDelta.get());
        }

        var b = table.getRealColumn("b").orElseThrow(() -> new InsufficientDataException(
        "Sequence timings need either G, Delta and delta or at least b"));

        if (bigDelta.isPresent() && smallDelta.isPresent()) {
            return new SequenceTimings(gradientFromTimings(b, bigDelta.get(), smallDelta.get(),
                                                           table.unweightedIndices()), bigDelta.get(),
                                       smallDelta.get());
        }
        if (bigDelta.isPresent() && g.isPresent()) {
            return new SequenceTimings(g.get(), bigDelta.get(), smallDeltaFromCubic(b, bigDelta.get(), g.get()));
        }
        if (g.isPresent() && smallDelta.isPresent()) {
            return new SequenceTimings(g.get(), bigDeltaFromTimings(b, g.get(), smallDelta.get()), smallDelta.get());
        }
        return bulk(table, b);
    }

    /**
     * {@code b = gamma^2 G^2 delta^2 (Delta - delta/3)}
     */
    public static double bValue(double g, double bigDelta, double smallDelta) {
        return GAMMA_H * GAMMA_H * g * g * smallDelta * smallDelta * (bigDelta - smallDelta / 3.0);
    }

    /**
     * b values implied by these timings.
     */
    public double[] bValues() {
        var b = new double[gradientAmplitude.length];
        for (int i = 0; i < b.length; i++) {
            b[i] = bValue(gradientAmplitude[i], bigDelta[i], smallDelta[i]);
        }
        return b;
    }

    public int length() {
        return gradientAmplitude.length;
    }

    private static double[] gradientFromTimings(double[] b, double[] bigDelta, double[] smallDelta,
                                                int[] unweighted) {
        var g = new double[b.length];
        for (int i = 0; i < b.length; i++) {
            double denominator = GAMMA_H * GAMMA_H * smallDelta[i] * smallDelta[i] * (bigDelta[i]
                                                                                    - smallDelta[i] / 3.0);
            g[i] = Math.sqrt(b[i] / denominator);
        }
        for (int i : unweighted) {
            g[i] = 0;
        }
        return replaceNonFinite(g);
    }

    private static double[] bigDeltaFromTimings(double[] b, double[] g, double[] smallDelta) {
        var bigDelta = new double[b.length];
        for (int i = 0; i < b.length; i++) {
            double scale = GAMMA_H * GAMMA_H * g[i] * g[i];
            double d = smallDelta[i];
            bigDelta[i] = (b[i] + scale * d * d * d / 3.0) / (scale * d * d);
        }
        return replaceNonFinite(bigDelta);
    }

    private static double[] smallDeltaFromCubic(double[] b, double[] bigDelta, double[] g) {
        var smallDelta = new double[b.length];
        for (int i = 0; i < b.length; i++) {
            if (b[i] == 0) {
                continue;
            }
            smallDelta[i] = solveCubic(bigDelta[i], b[i] / (GAMMA_H * GAMMA_H * g[i] * g[i]));
        }
        return replaceNonFinite(smallDelta);
    }

    /**
     * Root of {@code f(d) = -d^3/3 + Delta d^2 - c} on {@code [0, 2 Delta]}, where f is monotonically increasing.
     * Newton steps are kept inside the bracket, falling back to bisection when they leave it.
     */
    static double solveCubic(double bigDelta, double c) {
        double lo = 0;
        double hi = 2 * bigDelta;
        if (!Double.isFinite(c) || bigDelta <= 0 || cubic(hi, bigDelta, c) < 0) {
            log.debug("No delta root in [0, {}] for c={}", hi, c);
            return Double.NaN;
        }
        double d = bigDelta;
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double f = cubic(d, bigDelta, c);
            if (Math.abs(f) <= ROOT_TOLERANCE * Math.max(1, c)) {
                return d;
            }
            if (f < 0) {
                lo = d;
            } else {
                hi = d;
            }
            double derivative = d * (2 * bigDelta - d);
            double next = derivative > 0 ? d - f / derivative : Double.NaN;
            d = (next > lo && next < hi) ? next : (lo + hi) / 2;
            if (hi - lo <= Math.ulp(hi)) {
                return d;
            }
        }
        return d;
    }

    private static double cubic(double d, double bigDelta, double c) {
        return -d * d * d / 3.0 + bigDelta * d * d - c;
    }

    private static SequenceTimings bulk(ColumnTable table, double[] b) {
        var maxG = table.getRealColumn("maxG").orElseGet(() -> {
            var defaults = new double[b.length];
            Arrays.fill(defaults, DEFAULT_MAX_G);
            return defaults;
        });
        var weighted = table.weightedIndices();
        double bMax = weighted.length == 0 ? 1 : Arrays.stream(weighted).mapToDouble(i -> b[i]).max().orElse(1);

        var g = new double[b.length];
        var timing = new double[b.length];
        for (int i = 0; i < b.length; i++) {
            timing[i] = Math.cbrt(3 * bMax / (2 * GAMMA_H * GAMMA_H * maxG[i] * maxG[i]));
            g[i] = Math.sqrt(b[i] / bMax) * maxG[i];
        }
        log.debug("Estimated bulk sequence timings from b, bmax={}", bMax);
        return new SequenceTimings(g, timing, timing.clone());
    }

    private static double[] replaceNonFinite(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                values[i] = 0;
            }
        }
        return values;
    }
}
