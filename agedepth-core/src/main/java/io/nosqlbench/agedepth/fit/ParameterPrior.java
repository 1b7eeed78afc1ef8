package io.nosqlbench.agedepth.fit;

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

import io.nosqlbench.agedepth.model.PosteriorDraw;

import java.util.ArrayList;
import java.util.List;

/// Gaussian priors on the curve parameters `a` and `b`.
///
/// The means drift from one bootstrap iteration to the next, taking the values
/// of the previous iteration's draw; the spreads stay fixed for the whole run.
/// The residual `sigma` has its own fixed uniform prior, configured on the
/// fitter rather than here.
///
/// @param aMean prior mean of the age intercept
/// @param aSigma prior standard deviation of the age intercept
/// @param bMean prior mean of the stretch factor
/// @param bSigma prior standard deviation of the stretch factor
public record ParameterPrior(double aMean, double aSigma, double bMean, double bSigma) {

    public static final double DEFAULT_A_MEAN = 817.0;
    public static final double DEFAULT_A_SIGMA = 5.0;
    public static final double DEFAULT_B_MEAN = 1.3;
    public static final double DEFAULT_B_SIGMA = 0.2;

    public static ParameterPrior defaults() {
        return new ParameterPrior(DEFAULT_A_MEAN, DEFAULT_A_SIGMA, DEFAULT_B_MEAN, DEFAULT_B_SIGMA);
    }

    /// Returns the prior for the next iteration: means taken from the draw,
    /// spreads unchanged.
    ///
    /// @param draw the accepted posterior draw
    /// @return the drifted prior
    public ParameterPrior driftTo(PosteriorDraw draw) {
        return new ParameterPrior(draw.a(), aSigma, draw.b(), bSigma);
    }

    /// Lists every unusable value.
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (!Double.isFinite(aMean)) {
            problems.add("prior a_mean must be finite: " + aMean);
        }
        if (!Double.isFinite(bMean)) {
            problems.add("prior b_mean must be finite: " + bMean);
        }
        if (!(aSigma > 0) || !Double.isFinite(aSigma)) {
            problems.add("prior a_sigma must be finite and positive: " + aSigma);
        }
        if (!(bSigma > 0) || !Double.isFinite(bSigma)) {
            problems.add("prior b_sigma must be finite and positive: " + bSigma);
        }
        return problems;
    }
}
