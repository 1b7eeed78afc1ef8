package io.nosqlbench.agedepth.bootstrap;

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

import io.nosqlbench.agedepth.fit.ParameterPrior;
import io.nosqlbench.agedepth.model.CompositePosterior;

import java.util.Objects;

/// Everything a finished bootstrap run produces.
///
/// @param posterior one parameter draw per iteration, in iteration order
/// @param diagnostics run counters
/// @param finalPrior the prior that the next iteration would have used
/// @param seed the seed the run was started with
public record CalibrationResult(
    CompositePosterior posterior,
    BootstrapDiagnostics diagnostics,
    ParameterPrior finalPrior,
    long seed
) {

    public CalibrationResult {
        Objects.requireNonNull(posterior, "posterior cannot be null");
        Objects.requireNonNull(diagnostics, "diagnostics cannot be null");
        Objects.requireNonNull(finalPrior, "finalPrior cannot be null");
    }
}
