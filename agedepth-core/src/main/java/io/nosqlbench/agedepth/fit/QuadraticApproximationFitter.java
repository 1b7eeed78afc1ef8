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

import io.nosqlbench.agedepth.filter.SuperpositionFilter;
import io.nosqlbench.agedepth.model.PosteriorDraw;
import io.nosqlbench.agedepth.model.ResampledDraw;
import io.nosqlbench.agedepth.model.SubsidenceCurve;
import io.nosqlbench.agedepth.sample.RandomSources;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/// Bayesian fit of the subsidence curve by quadratic (Laplace) approximation.
///
/// ## Algorithm
///
/// ```text
///   filtered points ─► mode search ─► curvature at mode ─► one Gaussian draw
///                         │                  │
///                         │                  └─ Σ = (−∇² log p)⁻¹  (Cholesky)
///                         └─ max over b of the profile  max_{a,σ} log p(a, b, σ)
/// ```
///
/// ### Mode search
///
/// For a fixed stretch factor `b` the curve is `a + g(h; b)`, so the best `a`
/// is a precision-weighted mean of the residuals and the best `sigma` is their
/// root mean square clamped to `[sigmaFloor, sigmaUpper]`. Alternating these two
/// closed-form updates gives the profile log-posterior of `b`. That profile is
/// scanned on a grid spanning the prior and the curve's domain, then refined
/// with Brent's method inside the best grid cell.
///
/// The lower end of the `b` range is where the curve stops being defined at the
/// highest fitted point. Starting values outside the domain are moved into it.
///
/// ### Curvature
///
/// The Hessian of the log-posterior is taken by central differences at the mode.
/// When the mode lies on a sigma bound only the `(a, b)` block is used and sigma
/// stays at the bound, so every draw keeps sigma inside `[sigmaFloor, sigmaUpper]`.
///
/// ## Randomness
///
/// The only random numbers used are the standard normals of the final draw,
/// taken from the run's shared provider.
public final class QuadraticApproximationFitter {

    private static final Logger logger = LogManager.getLogger(QuadraticApproximationFitter.class);

    private static final int GRID_CELLS = 48;
    private static final double PRIOR_SPAN = 8.0;
    private static final int PROFILE_ITERATIONS = 500;
    private static final double PROFILE_TOLERANCE = 1e-13;
    private static final double HESSIAN_STEP = 1e-4;

    private final SubsidenceCurve curve;
    private final FitSettings settings;

    public QuadraticApproximationFitter(SubsidenceCurve curve, FitSettings settings) {
        this.curve = Objects.requireNonNull(curve, "curve cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
    }

    public FitSettings settings() {
        return settings;
    }

    /// Fits outside of a bootstrap run; failures report iteration 0.
    public QuadraticFit fit(List<ResampledDraw> points, ParameterPrior prior, UniformRandomProvider rng) {
        return fit(points, prior, rng, 0);
    }

    /// Fits the curve to a filtered section and draws one posterior sample.
    ///
    /// @param points filtered draws, at least [SuperpositionFilter#MINIMUM_LENGTH]
    /// @param prior current parameter prior
    /// @param rng the run's shared random provider
    /// @param iteration 1-based bootstrap iteration, used in failure messages
    /// @return the fit with its single posterior draw
    /// @throws FitConvergenceException if no mode or no usable curvature is found
    public QuadraticFit fit(List<ResampledDraw> points, ParameterPrior prior, UniformRandomProvider rng, int iteration) {
        Objects.requireNonNull(points, "points cannot be null");
        Objects.requireNonNull(prior, "prior cannot be null");
        Objects.requireNonNull(rng, "rng cannot be null");
        if (points.size() < SuperpositionFilter.MINIMUM_LENGTH) {
            throw new IllegalArgumentException("at least " + SuperpositionFilter.MINIMUM_LENGTH
                + " points are needed to fit, got " + points.size());
        }

        LogPosterior posterior = new LogPosterior(curve, points, prior, settings.sigmaUpper());
        ProfileSearch search = new ProfileSearch(points, prior);

        double maxHeight = points.stream().mapToDouble(ResampledDraw::height).max().orElseThrow();
        double lower = lowestDefinedStretch(maxHeight, iteration);
        double upper = Math.max(Math.max(lower, prior.bMean()), settings.start().b()) + PRIOR_SPAN * prior.bSigma();

        Profile best = search.maximize(lower, upper, iteration);
        PosteriorDraw mode = new PosteriorDraw(best.a, best.b, best.sigma);
        double modeValue = posterior.value(mode.toArray());
        if (!Double.isFinite(modeValue)) {
            throw new FitConvergenceException(iteration, "log-posterior is not finite at the mode " + mode);
        }
        logger.trace("iteration {}: mode {} (log-posterior {}) after {} evaluations",
            iteration, mode, modeValue, search.evaluations);

        return approximate(posterior, mode, modeValue, search.evaluations, rng, iteration);
    }

    private QuadraticFit approximate(LogPosterior posterior, PosteriorDraw mode, double modeValue,
                                     int evaluations, UniformRandomProvider rng, int iteration) {
        double[] x = mode.toArray();
        double[][] negativeHessian = negativeHessian(posterior, x, iteration);

        boolean onSigmaBound = mode.sigma() <= settings.sigmaFloor() * (1 + 1e-9)
            || mode.sigma() >= settings.sigmaUpper() * (1 - 1e-9);

        // sigma is held at its bound; only (a, b) vary
        int dimensions = onSigmaBound ? 2 : 3;
        double[][] factored = negativeHessian;
        if (onSigmaBound) {
            factored = new double[][]{
                {negativeHessian[0][0], negativeHessian[0][1]},
                {negativeHessian[1][0], negativeHessian[1][1]}
            };
            logger.debug("iteration {}: sigma at bound {}, using conditional (a, b) approximation",
                iteration, mode.sigma());
        }

        CholeskyDecomposition cholesky;
        try {
            cholesky = new CholeskyDecomposition(new Array2DRowRealMatrix(factored));
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            throw new FitConvergenceException(iteration, "curvature of " + (onSigmaBound ? "(a, b)" : "(a, b, sigma)")
                + " at the mode " + mode + " is not negative definite", e);
        }

        RealMatrix inverse = cholesky.getSolver().getInverse();
        double[][] covariance = new double[3][3];
        for (int i = 0; i < dimensions; i++) {
            for (int j = 0; j < dimensions; j++) {
                covariance[i][j] = inverse.getEntry(i, j);
            }
        }

        // negH = L·Lᵀ, so Lᵀ·δ = z gives δ with covariance negH⁻¹
        NormalizedGaussianSampler normal = RandomSources.standardNormal(rng);
        RealVector offset = new ArrayRealVector(dimensions);
        for (int i = 0; i < dimensions; i++) {
            offset.setEntry(i, normal.sample());
        }
        MatrixUtils.solveUpperTriangularSystem(cholesky.getLT(), offset);

        double[] drawn = x.clone();
        for (int i = 0; i < dimensions; i++) {
            drawn[i] += offset.getEntry(i);
        }
        return new QuadraticFit(mode, modeValue, covariance, PosteriorDraw.fromArray(drawn),
            evaluations, posterior.pointCount());
    }

    private double[][] negativeHessian(LogPosterior posterior, double[] x, int iteration) {
        int n = x.length;
        double[] steps = new double[n];
        steps[0] = HESSIAN_STEP * Math.max(Math.abs(x[0]), 1.0);
        steps[1] = HESSIAN_STEP * Math.max(Math.abs(x[1]), 1.0);
        steps[2] = HESSIAN_STEP * x[2];

        double center = posterior.smooth(x);
        double[][] result = new double[n][n];
        for (int i = 0; i < n; i++) {
            double plus = posterior.smooth(shift(x, i, steps[i], -1, 0));
            double minus = posterior.smooth(shift(x, i, -steps[i], -1, 0));
            result[i][i] = -(plus - 2 * center + minus) / (steps[i] * steps[i]);
            for (int j = 0; j < i; j++) {
                double pp = posterior.smooth(shift(x, i, steps[i], j, steps[j]));
                double pm = posterior.smooth(shift(x, i, steps[i], j, -steps[j]));
                double mp = posterior.smooth(shift(x, i, -steps[i], j, steps[j]));
                double mm = posterior.smooth(shift(x, i, -steps[i], j, -steps[j]));
                double value = -(pp - pm - mp + mm) / (4 * steps[i] * steps[j]);
                result[i][j] = value;
                result[j][i] = value;
            }
        }
        for (double[] row : result) {
            for (double value : row) {
                if (!Double.isFinite(value)) {
                    throw new FitConvergenceException(iteration,
                        "curvature at the mode is not finite; the mode is too close to the curve's domain limit");
                }
            }
        }
        return result;
    }

    private static double[] shift(double[] x, int i, double di, int j, double dj) {
        double[] shifted = x.clone();
        shifted[i] += di;
        if (j >= 0) {
            shifted[j] += dj;
        }
        return shifted;
    }

    /// Smallest stretch factor above 1 for which the curve is defined at `maxHeight`.
    private double lowestDefinedStretch(double maxHeight, int iteration) {
        double floor = 1.0 + 1e-9;
        if (curve.heightLimit(floor) > maxHeight) {
            return floor;
        }
        double limit = curve.constants().subsidenceCorrection();
        if (maxHeight >= limit) {
            throw new FitConvergenceException(iteration, String.format(
                "highest point %.3f is at or above the subsidence limit %.3f; the curve is undefined for every b",
                maxHeight, limit));
        }
        double lo = 1.0;
        double hi = 2.0;
        while (curve.heightLimit(hi) <= maxHeight) {
            lo = hi;
            hi *= 2;
        }
        for (int i = 0; i < 200 && hi - lo > 1e-14 * hi; i++) {
            double mid = 0.5 * (lo + hi);
            if (curve.heightLimit(mid) > maxHeight) {
                hi = mid;
            } else {
                lo = mid;
            }
        }
        return hi * (1 + 1e-9);
    }

    /// Parameters maximizing the log-posterior for one stretch factor.
    private static final class Profile {
        final double a;
        final double b;
        final double sigma;
        final double value;

        Profile(double a, double b, double sigma, double value) {
            this.a = a;
            this.b = b;
            this.sigma = sigma;
            this.value = value;
        }

        boolean betterThan(Profile other) {
            return other == null || (Double.isFinite(value) && value > other.value);
        }
    }

    private final class ProfileSearch {
        private final double[] heights;
        private final double[] ages;
        private final double[] offsets;
        private final ParameterPrior prior;
        private int evaluations;

        ProfileSearch(List<ResampledDraw> points, ParameterPrior prior) {
            this.prior = prior;
            this.heights = new double[points.size()];
            this.ages = new double[points.size()];
            this.offsets = new double[points.size()];
            for (int i = 0; i < points.size(); i++) {
                heights[i] = points.get(i).height();
                ages[i] = points.get(i).age();
            }
        }

        Profile maximize(double lower, double upper, int iteration) {
            double width = (upper - lower) / GRID_CELLS;
            Profile best = null;
            int bestCell = -1;
            for (int k = 0; k <= GRID_CELLS; k++) {
                Profile candidate = profile(lower + k * width);
                if (Double.isFinite(candidate.value) && candidate.betterThan(best)) {
                    best = candidate;
                    bestCell = k;
                }
            }
            if (best == null) {
                throw new FitConvergenceException(iteration, String.format(
                    "log-posterior is not finite anywhere on b in [%.6f, %.6f]", lower, upper));
            }

            double from = lower + Math.max(bestCell - 1, 0) * width;
            double to = lower + Math.min(bestCell + 1, GRID_CELLS) * width;
            double start = Math.min(Math.max(settings.start().b(), from), to);
            if (start == from || start == to) {
                start = best.b;
            }

            BrentOptimizer brent = new BrentOptimizer(settings.relativeTolerance(), 1e-14);
            try {
                UnivariatePointValuePair refined = brent.optimize(
                    new MaxEval(settings.maxEvaluations()),
                    new UnivariateObjectiveFunction(b -> {
                        double value = profile(b).value;
                        return Double.isFinite(value) ? value : -Double.MAX_VALUE;
                    }),
                    GoalType.MAXIMIZE,
                    new SearchInterval(from, to, start));
                Profile polished = profile(refined.getPoint());
                if (polished.betterThan(best)) {
                    best = polished;
                }
            } catch (TooManyEvaluationsException e) {
                throw new FitConvergenceException(iteration,
                    "stretch factor search did not converge within " + settings.maxEvaluations() + " evaluations", e);
            }
            return best;
        }

        Profile profile(double b) {
            evaluations++;
            int n = heights.length;
            for (int i = 0; i < n; i++) {
                offsets[i] = curve.meanAge(heights[i], 0.0, b);
                if (!Double.isFinite(offsets[i])) {
                    return new Profile(Double.NaN, b, Double.NaN, Double.NEGATIVE_INFINITY);
                }
            }

            double aPrecision = 1.0 / (prior.aSigma() * prior.aSigma());
            double residualSum = 0;
            for (int i = 0; i < n; i++) {
                residualSum += ages[i] - offsets[i];
            }

            double sigma = clampSigma(settings.start().sigma());
            double a = prior.aMean();
            for (int iter = 0; iter < PROFILE_ITERATIONS; iter++) {
                double dataPrecision = 1.0 / (sigma * sigma);
                a = (dataPrecision * residualSum + aPrecision * prior.aMean()) / (n * dataPrecision + aPrecision);
                double ssr = 0;
                for (int i = 0; i < n; i++) {
                    double r = ages[i] - offsets[i] - a;
                    ssr += r * r;
                }
                double next = clampSigma(Math.sqrt(ssr / n));
                boolean converged = Math.abs(next - sigma) <= PROFILE_TOLERANCE * sigma;
                sigma = next;
                if (converged) {
                    break;
                }
            }

            double value = LogPosterior.logNormal(a, prior.aMean(), prior.aSigma())
                + LogPosterior.logNormal(b, prior.bMean(), prior.bSigma())
                - Math.log(settings.sigmaUpper());
            for (int i = 0; i < n; i++) {
                value += LogPosterior.logNormal(ages[i], a + offsets[i], sigma);
            }
            return new Profile(a, b, sigma, value);
        }

        private double clampSigma(double sigma) {
            if (!(sigma > settings.sigmaFloor())) {
                return settings.sigmaFloor();
            }
            return Math.min(sigma, settings.sigmaUpper());
        }
    }
}
