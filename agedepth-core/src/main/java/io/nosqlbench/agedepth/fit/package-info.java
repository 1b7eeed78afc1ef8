/// Bayesian fit of the subsidence curve to one filtered resample.
///
/// The posterior over (a, b, sigma) combines Gaussian priors on a and b, a
/// flat prior on sigma in (0, upper] and a Gaussian likelihood of the ages
/// around the curve. Its mode is found by profiling a and sigma out in closed
/// form and searching b, then the posterior is replaced by a Gaussian with the
/// inverse negative Hessian as covariance, and one draw is taken from it.
///
/// ## Key Components
///
/// - {@link io.nosqlbench.agedepth.fit.LogPosterior}: the objective
/// - {@link io.nosqlbench.agedepth.fit.QuadraticApproximationFitter}: mode search and Gaussian draw
/// - {@link io.nosqlbench.agedepth.fit.ParameterPrior}: priors that drift between iterations
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
