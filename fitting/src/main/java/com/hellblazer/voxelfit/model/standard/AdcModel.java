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

package com.hellblazer.voxelfit.model.standard;

import com.hellblazer.voxelfit.compute.KernelContext;
import com.hellblazer.voxelfit.compute.VoxelKernel;
import com.hellblazer.voxelfit.config.OptimizerSettings;
import com.hellblazer.voxelfit.model.AbstractModel;
import com.hellblazer.voxelfit.model.ResultModifier;
import com.hellblazer.voxelfit.protocol.ColumnTable;

import java.util.Arrays;
import java.util.List;

/**
 * Mono-exponential decay {@code S = S0 exp(-b d)} with the apparent diffusion coefficient {@code d}.
 *
 * <p>Each voxel starts from a log-linear fit, or from a prior S0 map when one is given, and is refined with
 * Gauss-Newton steps. Every configured optimizer adds {@code patience * (parameters + 1)} steps, and the optimizer
 * sequence is repeated for every extra optimization run.
 *
 * @author hal.hildebrand
 */
public class AdcModel extends AbstractModel {

    public static final String NAME        = "ADC";
    public static final String D           = "ADC.d";
    public static final String DECAY_B1000 = "ADC.decay_b1000";

    // b in units of 1e9 s/m^2 and d in units of 1e-9 m^2/s keep the normal equations well scaled
    private static final double B_SCALE = 1e-9;

    private final double[] priorS0;

    public AdcModel() {
        this(null);
    }

    /**
     * @param priorS0 initial S0 per voxel, or null to start from the log-linear fit
     */
    public AdcModel(double[] priorS0) {
        super(NAME, List.of(S0Model.S0, D), List.of("b"));
        this.priorS0 = priorS0;
    }

    @Override
    protected List<String> additionalProblems(ColumnTable protocol) {
        return protocol.weightedIndices().length == 0 ? List.of("No weighted measurements") : List.of();
    }

    @Override
    public List<ResultModifier> modifiers() {
        return List.of(ResultModifier.of(DECAY_B1000,
                                         maps -> Arrays.stream(maps.get(D)).map(d -> Math.exp(-1e9 * d)).toArray()));
    }

    @Override
    public VoxelKernel createKernel(KernelContext context) {
        var b = Arrays.stream(context.protocol().getColumn("b")).map(v -> v * B_SCALE).toArray();
        int steps = 0;
        for (OptimizerSettings optimizer : context.optimizers()) {
            steps += optimizer.patience() * (parameterNames().size() + 1);
        }
        final int iterations = steps * (context.extraOptimRuns() + 1);
        return (voxel, observations, parameters) -> {
            var start = logLinear(b, observations);
            double s0 = priorS0 != null && priorS0[voxel] > 0 ? priorS0[voxel] : start[0];
            var fitted = refine(b, observations, s0, start[1], iterations);
            parameters[0] = fitted[0];
            parameters[1] = fitted[1] * 1e-9;
        };
    }

    /**
     * Least squares line through {@code (b, ln S)} over the positive measurements.
     */
    static double[] logLinear(double[] b, float[] observations) {
        double n = 0, sx = 0, sy = 0, sxx = 0, sxy = 0, mean = 0;
        for (int i = 0; i < b.length; i++) {
            mean += observations[i];
            if (observations[i] > 0) {
                double y = Math.log(observations[i]);
                n++;
                sx += b[i];
                sy += y;
                sxx += b[i] * b[i];
                sxy += b[i] * y;
            }
        }
        mean /= Math.max(1, b.length);
        double denominator = n * sxx - sx * sx;
        if (n < 2 || Math.abs(denominator) < 1e-12) {
            return new double[] { mean, 0 };
        }
        double slope = (n * sxy - sx * sy) / denominator;
        double intercept = (sy - slope * sx) / n;
        return new double[] { Math.exp(intercept), -slope };
    }

    static double[] refine(double[] b, float[] observations, double s0, double d, int iterations) {
        for (int iteration = 0; iteration < iterations; iteration++) {
            double a11 = 0, a12 = 0, a22 = 0, g1 = 0, g2 = 0;
            for (int i = 0; i < b.length; i++) {
                double e = Math.exp(-b[i] * d);
                double r = observations[i] - s0 * e;
                double j1 = e;
                double j2 = -s0 * b[i] * e;
                a11 += j1 * j1;
                a12 += j1 * j2;
                a22 += j2 * j2;
                g1 += j1 * r;
                g2 += j2 * r;
            }
            double det = a11 * a22 - a12 * a12;
            if (!(Math.abs(det) > 1e-18)) {
                break;
            }
            double ds0 = (a22 * g1 - a12 * g2) / det;
            double dd = (a11 * g2 - a12 * g1) / det;
            if (!Double.isFinite(ds0) || !Double.isFinite(dd)) {
                break;
            }
            s0 += ds0;
            d += dd;
            if (Math.abs(ds0) <= 1e-10 * Math.max(1, Math.abs(s0))
                && Math.abs(dd) <= 1e-10 * Math.max(1, Math.abs(d))) {
                break;
            }
        }
        return new double[] { s0, d };
    }
}
