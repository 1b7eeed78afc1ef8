package io.nosqlbench.agedepth.summary;

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

import com.google.gson.annotations.SerializedName;

/// Median and 95% highest-density interval of a posterior quantity.
///
/// @param median sample median of the finite values
/// @param lower95 lower interval bound
/// @param upper95 upper interval bound
/// @param included finite values summarized
/// @param excluded non-finite values left out
public record AgeInterval(
    @SerializedName("median") double median,
    @SerializedName("lower_95") double lower95,
    @SerializedName("upper_95") double upper95,
    @SerializedName("included") int included,
    @SerializedName("excluded") int excluded
) {

    public double width() {
        return upper95 - lower95;
    }

    /// True when at least one draw gave a non-finite value.
    public boolean hasExclusions() {
        return excluded > 0;
    }
}
