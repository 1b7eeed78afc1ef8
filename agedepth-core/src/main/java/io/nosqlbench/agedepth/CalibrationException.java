package io.nosqlbench.agedepth;

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

/// Failure of a single bootstrap iteration.
///
/// Carries the 1-based iteration index so an aborted run can be traced back to
/// the iteration that could not be completed. An index of 0 means the failure
/// happened outside the bootstrap loop. When the run gives up on an iteration
/// the number of attempts is recorded with [#abortedAfter(int)] and appended to
/// the message.
public class CalibrationException extends RuntimeException {

    private final int iteration;
    private int attempts;

    public CalibrationException(int iteration, String message) {
        super(message);
        this.iteration = iteration;
    }

    public CalibrationException(int iteration, String message, Throwable cause) {
        super(message, cause);
        this.iteration = iteration;
    }

    /// The 1-based bootstrap iteration that failed, or 0 when not known.
    public int getIteration() {
        return iteration;
    }

    /// Attempts made at the iteration before the run was aborted, or 0 when
    /// the failure did not abort a run.
    public int getAttempts() {
        return attempts;
    }

    /// Records that the run aborted after `attempts` failed attempts at this iteration.
    ///
    /// @return this exception, for rethrowing
    public CalibrationException abortedAfter(int attempts) {
        this.attempts = attempts;
        return this;
    }

    @Override
    public String getMessage() {
        if (attempts == 0) {
            return super.getMessage();
        }
        return super.getMessage() + " (aborted after " + attempts + " attempt" + (attempts == 1 ? "" : "s") + ")";
    }
}
