package io.nosqlbench.agedepth.model;

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

import java.util.Objects;

/// Thermal-subsidence age curve, inverted to give age as a function of height.
///
/// ## Formula
///
/// ```text
///   age(h; a, b) = a + (tau / T) · ln( 1 − (h / E0) · (π / b) / sin(π / b) )
/// ```
///
/// - `a` is the age at height zero
/// - `b` is the lithospheric stretch factor
/// - `tau / T` and `E0` come from [PhysicalConstants]
///
/// ## Domain
///
/// The curve is only defined for `b > 0` and a positive logarithm argument.
/// Outside that domain the result is NaN or negative infinity; callers are
/// expected to carry such values along rather than fail, since extreme posterior
/// draws produce them occasionally.
public final class SubsidenceCurve {

    private final PhysicalConstants constants;
    private final double decayAge;
    private final double correction;

    public SubsidenceCurve(PhysicalConstants constants) {
        this.constants = Objects.requireNonNull(constants, "constants cannot be null");
        this.decayAge = constants.thermalDecayAge();
        this.correction = constants.subsidenceCorrection();
    }

    public PhysicalConstants constants() {
        return constants;
    }

    /// Mean age at the given height.
    ///
    /// @param height stratigraphic height
    /// @param a age intercept
    /// @param b stretch factor
    /// @return the age, or a non-finite value outside the curve's domain
    public double meanAge(double height, double a, double b) {
        if (!(b > 0)) {
            return Double.NaN;
        }
        double stretch = Math.PI / b;
        double argument = 1.0 - (height / correction) * stretch / Math.sin(stretch);
        if (!(argument > 0)) {
            return argument == 0 ? Double.NEGATIVE_INFINITY : Double.NaN;
        }
        return a + decayAge * Math.log(argument);
    }

    /// Mean ages for several heights under one parameter pair.
    public double[] meanAges(double[] heights, double a, double b) {
        double[] ages = new double[heights.length];
        for (int i = 0; i < heights.length; i++) {
            ages[i] = meanAge(heights[i], a, b);
        }
        return ages;
    }

    /// Height at which the logarithm argument reaches zero for the given stretch
    /// factor; the curve is undefined at and beyond it.
    ///
    /// @param b stretch factor
    /// @return the limiting height, or positive infinity when the curve does not
    ///     bend toward a limit (for example when `sin(π/b)` is negative)
    public double heightLimit(double b) {
        if (!(b > 0)) {
            return Double.NaN;
        }
        double stretch = Math.PI / b;
        double scale = stretch / Math.sin(stretch);
        if (!(scale > 0) || !Double.isFinite(scale)) {
            return Double.POSITIVE_INFINITY;
        }
        return correction / scale;
    }
}
