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

/// Age estimates bracketing a stratigraphic interval, with its duration.
///
/// The duration is taken per posterior draw, so it keeps the correlation
/// between the onset and end ages.
///
/// @param onsetHeight base of the interval
/// @param endHeight top of the interval
/// @param onset age at the base
/// @param end age at the top
/// @param duration onset age minus end age
public record AnomalyDuration(
    @SerializedName("onset_height") double onsetHeight,
    @SerializedName("end_height") double endHeight,
    @SerializedName("onset") AgeInterval onset,
    @SerializedName("end") AgeInterval end,
    @SerializedName("duration") AgeInterval duration
) {
}
