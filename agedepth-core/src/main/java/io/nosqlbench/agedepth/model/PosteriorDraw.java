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

import com.google.gson.annotations.SerializedName;

/// One sample of the subsidence-curve parameters.
///
/// @param a age intercept at height zero
/// @param b stretch factor
/// @param sigma residual standard deviation of ages around the curve
public record PosteriorDraw(
    @SerializedName("a") double a,
    @SerializedName("b") double b,
    @SerializedName("sigma") double sigma
) {

    /// Returns the draw as an `{a, b, sigma}` vector.
    public double[] toArray() {
        return new double[]{a, b, sigma};
    }

    public static PosteriorDraw fromArray(double[] values) {
        if (values.length != 3) {
            throw new IllegalArgumentException("expected 3 values (a, b, sigma), got " + values.length);
        }
        return new PosteriorDraw(values[0], values[1], values[2]);
    }

    /// Mean age this draw implies at the given height.
    public double ageAt(SubsidenceCurve curve, double height) {
        return curve.meanAge(height, a, b);
    }
}
