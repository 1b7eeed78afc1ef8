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
import java.util.Objects;

/// Fixed settings of the quadratic-approximation fit, shared by every iteration.
///
/// @param start starting point of the mode search
/// @param sigmaUpper upper bound of the uniform prior on sigma
/// @param sigmaFloor smallest sigma the mode search may reach; the uniform prior
///     starts at zero, but the likelihood is unbounded there when the curve can
///     pass through every point
/// @param maxEvaluations objective evaluations allowed for the stretch-factor search
/// @param relativeTolerance relative tolerance of the stretch-factor search
public record FitSettings(
    PosteriorDraw start,
    double sigmaUpper,
    double sigmaFloor,
    int maxEvaluations,
    double relativeTolerance
) {

    public static final PosteriorDraw DEFAULT_START = new PosteriorDraw(817.0, 1.3, 5.0);
    public static final double DEFAULT_SIGMA_UPPER = 10.0;
    public static final double DEFAULT_SIGMA_FLOOR = 1e-3;
    public static final int DEFAULT_MAX_EVALUATIONS = 10_000;
    public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-12;

    public FitSettings {
        Objects.requireNonNull(start, "start cannot be null");
    }

    public static FitSettings defaults() {
        return new FitSettings(DEFAULT_START, DEFAULT_SIGMA_UPPER, DEFAULT_SIGMA_FLOOR,
            DEFAULT_MAX_EVALUATIONS, DEFAULT_RELATIVE_TOLERANCE);
    }

    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (!(sigmaUpper > 0) || !Double.isFinite(sigmaUpper)) {
            problems.add("sigma_upper must be finite and positive: " + sigmaUpper);
        }
        if (!(sigmaFloor > 0) || !(sigmaFloor < sigmaUpper)) {
            problems.add("sigma_floor must lie in (0, sigma_upper): " + sigmaFloor);
        }
        if (!Double.isFinite(start.a()) || !Double.isFinite(start.b())) {
            problems.add("start a and b must be finite: " + start);
        }
        if (!(start.b() > 0)) {
            problems.add("start b must be positive: " + start.b());
        }
        if (!(start.sigma() > 0) || start.sigma() > sigmaUpper) {
            problems.add("start sigma must lie in (0, " + sigmaUpper + "]: " + start.sigma());
        }
        if (maxEvaluations < 100) {
            problems.add("max_evaluations must be at least 100: " + maxEvaluations);
        }
        if (!(relativeTolerance > 0) || relativeTolerance >= 1e-3) {
            problems.add("relative_tolerance must lie in (0, 1e-3): " + relativeTolerance);
        }
        return problems;
    }
}
