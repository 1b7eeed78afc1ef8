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

/// Outcome of one quadratic-approximation fit.
///
/// @param mode maximum a posteriori parameters
/// @param logPosterior log-posterior at the mode
/// @param covariance covariance of the Gaussian approximation, ordered (a, b, sigma)
/// @param draw the single sample drawn from the approximation
/// @param evaluations objective evaluations spent finding the mode
/// @param pointCount number of filtered points fitted
public record QuadraticFit(
    PosteriorDraw mode,
    double logPosterior,
    double[][] covariance,
    PosteriorDraw draw,
    int evaluations,
    int pointCount
) {

    /// Marginal standard deviation of parameter `index` (0 = a, 1 = b, 2 = sigma).
    public double standardError(int index) {
        return Math.sqrt(covariance[index][index]);
    }
}
