package io.nosqlbench.agedepth.filter;

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

/// Thrown when too few resampled points are consistent with superposition to
/// fit the subsidence curve.
public class SuperpositionException extends CalibrationException {

    private final int survivorCount;
    private final int drawCount;

    public SuperpositionException(int iteration, int survivorCount, int drawCount) {
        super(iteration, String.format(
            "Iteration %d: only %d of %d resampled points satisfy superposition, at least %d are needed to fit",
            iteration, survivorCount, drawCount, SuperpositionFilter.MINIMUM_LENGTH));
        this.survivorCount = survivorCount;
        this.drawCount = drawCount;
    }

    public int getSurvivorCount() {
        return survivorCount;
    }

    public int getDrawCount() {
        return drawCount;
    }
}
