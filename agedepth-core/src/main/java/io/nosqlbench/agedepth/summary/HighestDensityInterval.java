package io.nosqlbench.agedepth.summary;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.Arrays;

/// Narrowest interval of a sample that holds a given share of it.
///
/// Over the sorted sample `x[0..n)` the interval spans `gap` order statistics,
/// with `gap = max(1, min(n - 1, round(n * mass)))`, and starts at the index
/// that minimizes `x[i + gap] - x[i]`. Ties go to the lowest start.
///
/// | n | result |
/// |---|--------|
/// | 0 | `[NaN, NaN]` |
/// | 1 | `[x0, x0]` |
/// | ≥ 2 | narrowest window as above |
///
/// @param lower lower bound
/// @param upper upper bound
public record HighestDensityInterval(double lower, double upper) {

    public static final double DEFAULT_MASS = 0.95;

    /// Width of the interval.
    public double width() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    /// Computes the interval of finite values.
    ///
    /// @param values the sample; not modified
    /// @param mass share of the sample to cover, in (0, 1)
    /// @return the narrowest covering interval
    public static HighestDensityInterval of(double[] values, double mass) {
        if (!(mass > 0.0 && mass < 1.0)) {
            throw new IllegalArgumentException("mass must lie in (0, 1): " + mass);
        }
        int n = values.length;
        if (n == 0) {
            return new HighestDensityInterval(Double.NaN, Double.NaN);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        if (n == 1) {
            return new HighestDensityInterval(sorted[0], sorted[0]);
        }

        int gap = (int) Math.max(1, Math.min(n - 1, Math.round(n * mass)));
        int best = 0;
        double bestWidth = sorted[gap] - sorted[0];
        for (int start = 1; start + gap < n; start++) {
            double width = sorted[start + gap] - sorted[start];
            if (width < bestWidth) {
                bestWidth = width;
                best = start;
            }
        }
        return new HighestDensityInterval(sorted[best], sorted[best + gap]);
    }

    public static HighestDensityInterval of(double[] values) {
        return of(values, DEFAULT_MASS);
    }
}
