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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// One dated horizon in a stratigraphic column.
///
/// ## Fields
///
/// | Field | Table column | Meaning |
/// |-------|--------------|---------|
/// | height | `height` | stratigraphic position above the section base |
/// | heightUncertainty | `range` | 95% half-width of the position |
/// | heightShape | `type` | distribution the position is drawn from |
/// | age | `age` | measured age (Ma) |
/// | ageUncertainty | `ageUnc` | 95% half-width of the age, always Gaussian |
/// | label | any display column | carried for reporting only |
///
/// Instances are immutable. Validation is not done in the constructor so that a
/// whole table can be checked at once; see [#problems()] and [ObservationSet].
///
/// @param height stratigraphic height
/// @param heightUncertainty one-sided 95% height uncertainty
/// @param heightShape how the height uncertainty is consumed
/// @param age measured age
/// @param ageUncertainty one-sided 95% age uncertainty
/// @param label optional display label, never null
public record Observation(
    double height,
    double heightUncertainty,
    UncertaintyShape heightShape,
    double age,
    double ageUncertainty,
    String label
) {

    public Observation {
        Objects.requireNonNull(heightShape, "heightShape cannot be null");
        label = label == null ? "" : label;
    }

    /// Creates an unlabeled observation.
    public Observation(double height, double heightUncertainty, UncertaintyShape heightShape,
                       double age, double ageUncertainty) {
        this(height, heightUncertainty, heightShape, age, ageUncertainty, "");
    }

    /// Creates an observation from the raw table columns.
    ///
    /// @param height the `height` column
    /// @param range the `range` column
    /// @param age the `age` column
    /// @param ageUnc the `ageUnc` column
    /// @param type the `type` column, see [UncertaintyShape#fromTag(String)]
    /// @return the observation
    public static Observation fromColumns(double height, double range, double age, double ageUnc, String type) {
        return new Observation(height, range, UncertaintyShape.fromTag(type), age, ageUnc, "");
    }

    /// Standard deviation used for the age draw (half of the 95% half-width).
    public double ageSigma() {
        return ageUncertainty / 2.0;
    }

    /// Standard deviation (Gaussian) or half-width (uniform) used for the height draw.
    public double heightSpread() {
        return heightUncertainty / 2.0;
    }

    /// Lists everything that makes this observation unusable.
    ///
    /// @return problem descriptions, empty when the observation is valid
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (!Double.isFinite(height)) {
            problems.add("height is not finite: " + height);
        }
        if (!Double.isFinite(age)) {
            problems.add("age is not finite: " + age);
        }
        if (!Double.isFinite(heightUncertainty) || heightUncertainty < 0) {
            problems.add("height uncertainty must be finite and non-negative: " + heightUncertainty);
        }
        if (!Double.isFinite(ageUncertainty) || ageUncertainty < 0) {
            problems.add("age uncertainty must be finite and non-negative: " + ageUncertainty);
        }
        return problems;
    }
}
