package io.nosqlbench.agedepth.model;

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

import java.util.Comparator;

/// A single (height, age) point drawn from an observation's uncertainty for one
/// bootstrap iteration.
///
/// @param height resampled height
/// @param age resampled age
public record ResampledDraw(double height, double age) {

    /// Orders draws from the bottom of the section to the top.
    public static final Comparator<ResampledDraw> BY_HEIGHT = Comparator.comparingDouble(ResampledDraw::height);

    /// Section order: ascending height, and older first among equal heights.
    public static final Comparator<ResampledDraw> SECTION_ORDER =
        BY_HEIGHT.thenComparing(Comparator.comparingDouble(ResampledDraw::age).reversed());
}
