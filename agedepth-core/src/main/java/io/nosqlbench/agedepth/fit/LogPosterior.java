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

import io.nosqlbench.agedepth.model.ResampledDraw;
import io.nosqlbench.agedepth.model.SubsidenceCurve;

import java.util.List;
import java.util.Objects;

/// Joint log-posterior of `(a, b, sigma)` for one filtered section.
///
/// ## Model
///
/// ```text
///   age_i ~ Normal(curve(h_i; a, b), sigma)
///   a     ~ Normal(aMean, aSigma)
///   b     ~ Normal(bMean, bSigma)
///   sigma ~ Uniform(0, sigmaUpper)
/// ```
///
/// [#value(double[])] is the full log density and is negative infinity outside
/// the support or where the curve is undefined. [#smooth(double[])] drops the
/// uniform term, which is constant inside the support, and is what the
/// curvature is taken from.
public final class LogPosterior {

    private static final double LOG_SQRT_2PI = 0.5 * Math.log(2.0 * Math.PI);

    private final SubsidenceCurve curve;
    private final double[] heights;
    private final double[] ages;
    private final ParameterPrior prior;
    private final double sigmaUpper;
    private final double logSigmaUpper;

    public LogPosterior(SubsidenceCurve curve, List<ResampledDraw> points, ParameterPrior prior, double sigmaUpper) {
        this.curve = Objects.requireNonNull(curve, "curve cannot be null");
        this.prior = Objects.requireNonNull(prior, "prior cannot be null");
        if (!(sigmaUpper > 0)) {
            throw new IllegalArgumentException("sigmaUpper must be positive, got: " + sigmaUpper);
        }
        this.sigmaUpper = sigmaUpper;
        this.logSigmaUpper = Math.log(sigmaUpper);
        this.heights = new double[points.size()];
        this.ages = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            heights[i] = points.get(i).height();
            ages[i] = points.get(i).age();
        }
    }

    /// Number of data points in the likelihood.
    public int pointCount() {
        return heights.length;
    }

    public double sigmaUpper() {
        return sigmaUpper;
    }

    /// Full log-posterior (up to a constant) at `{a, b, sigma}`.
    public double value(double[] parameters) {
        double sigma = parameters[2];
        if (!(sigma > 0) || sigma > sigmaUpper) {
            return Double.NEGATIVE_INFINITY;
        }
        return smooth(parameters) - logSigmaUpper;
    }

    /// Log-likelihood plus the Gaussian priors, without the uniform sigma term.
    ///
    /// Defined for any positive sigma, so finite differences may step across the
    /// uniform prior's upper bound.
    public double smooth(double[] parameters) {
        double a = parameters[0];
        double b = parameters[1];
        double sigma = parameters[2];
        if (!(sigma > 0)) {
            return Double.NEGATIVE_INFINITY;
        }

        double total = logNormal(a, prior.aMean(), prior.aSigma())
            + logNormal(b, prior.bMean(), prior.bSigma());
        for (int i = 0; i < heights.length; i++) {
            double mean = curve.meanAge(heights[i], a, b);
            if (!Double.isFinite(mean)) {
                return Double.NEGATIVE_INFINITY;
            }
            total += logNormal(ages[i], mean, sigma);
        }
        return Double.isNaN(total) ? Double.NEGATIVE_INFINITY : total;
    }

    /// True when the curve is defined at every data height for this stretch factor.
    public boolean curveDefined(double a, double b) {
        for (double height : heights) {
            if (!Double.isFinite(curve.meanAge(height, a, b))) {
                return false;
            }
        }
        return true;
    }

    static double logNormal(double x, double mean, double sd) {
        double z = (x - mean) / sd;
        return -LOG_SQRT_2PI - Math.log(sd) - 0.5 * z * z;
    }
}
