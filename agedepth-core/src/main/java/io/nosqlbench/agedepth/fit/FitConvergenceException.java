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

import io.nosqlbench.agedepth.CalibrationException;

/// Thrown when the posterior mode cannot be found or the curvature at the mode
/// does not define a Gaussian approximation.
public class FitConvergenceException extends CalibrationException {

    public FitConvergenceException(int iteration, String message) {
        super(iteration, String.format("Iteration %d: %s", iteration, message));
    }

    public FitConvergenceException(int iteration, String message, Throwable cause) {
        super(iteration, String.format("Iteration %d: %s", iteration, message), cause);
    }
}
