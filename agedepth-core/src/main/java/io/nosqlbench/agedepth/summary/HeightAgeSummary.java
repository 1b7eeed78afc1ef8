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

/// One row of the height-to-age table.
///
/// @param height query height
/// @param medianAge posterior median age
/// @param ageMin lower 95% bound
/// @param ageMax upper 95% bound
public record HeightAgeSummary(
    @SerializedName("height") double height,
    @SerializedName("median_age") double medianAge,
    @SerializedName("age_min") double ageMin,
    @SerializedName("age_max") double ageMax
) {

    static HeightAgeSummary of(double height, AgeInterval interval) {
        return new HeightAgeSummary(height, interval.median(), interval.lower95(), interval.upper95());
    }
}
