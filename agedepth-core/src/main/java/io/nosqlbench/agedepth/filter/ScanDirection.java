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

/// Direction in which the superposition filter walks a sorted draw.
public enum ScanDirection {

    /// Bottom to top; the lowest draw is always kept.
    UPWARD,

    /// Top to bottom; the highest draw is always kept.
    DOWNWARD;

    /// Direction used for a 1-based bootstrap iteration: odd iterations scan
    /// upward, even iterations scan downward.
    ///
    /// @param iteration 1-based iteration index
    /// @return the scan direction
    public static ScanDirection forIteration(int iteration) {
        return (iteration & 1) == 1 ? UPWARD : DOWNWARD;
    }
}
