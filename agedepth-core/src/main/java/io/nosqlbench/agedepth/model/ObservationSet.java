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
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/// The validated, read-only observation table consumed by a calibration run.
///
/// Row order is preserved; it fixes the order in which random draws are taken
/// and therefore the reproducibility of a seeded run.
///
/// ```java
/// ObservationSet set = ObservationSet.builder()
///     .row(0, 20, 820, 5, "normal")
///     .row(500, 20, 750, 5, "normal")
///     .build();
/// ```
public final class ObservationSet implements Iterable<Observation> {

    /// A calibration needs at least this many rows to fit two curve parameters.
    public static final int MINIMUM_ROWS = 2;

    private final List<Observation> observations;

    private ObservationSet(List<Observation> observations) {
        this.observations = List.copyOf(observations);
    }

    /// Validates and wraps a list of observations.
    ///
    /// @param observations the rows in table order
    /// @return the observation set
    /// @throws CalibrationConfigException listing every invalid row
    public static ObservationSet of(List<Observation> observations) {
        Objects.requireNonNull(observations, "observations cannot be null");
        List<String> problems = new ArrayList<>();
        if (observations.size() < MINIMUM_ROWS) {
            problems.add("at least " + MINIMUM_ROWS + " observations are required, got " + observations.size());
        }
        for (int i = 0; i < observations.size(); i++) {
            Observation observation = observations.get(i);
            if (observation == null) {
                problems.add("row " + i + ": missing");
                continue;
            }
            for (String problem : observation.problems()) {
                problems.add("row " + i + ": " + problem);
            }
        }
        if (!problems.isEmpty()) {
            throw new CalibrationConfigException("observation table", problems);
        }
        return new ObservationSet(observations);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return observations.size();
    }

    public Observation get(int index) {
        return observations.get(index);
    }

    public List<Observation> asList() {
        return observations;
    }

    /// Lowest stored height.
    public double minHeight() {
        return observations.stream().mapToDouble(Observation::height).min().orElse(Double.NaN);
    }

    /// Highest stored height.
    public double maxHeight() {
        return observations.stream().mapToDouble(Observation::height).max().orElse(Double.NaN);
    }

    @Override
    public Iterator<Observation> iterator() {
        return observations.iterator();
    }

    @Override
    public String toString() {
        return "ObservationSet{size=" + observations.size()
            + ", heights=[" + minHeight() + ", " + maxHeight() + "]}";
    }

    /// Collects table rows; validation happens once in [#build()].
    public static final class Builder {
        private final List<Observation> rows = new ArrayList<>();

        private Builder() {
        }

        /// Adds a row using the table column names.
        ///
        /// @param height the `height` column
        /// @param range the `range` column
        /// @param age the `age` column
        /// @param ageUnc the `ageUnc` column
        /// @param type the `type` column
        /// @return this builder
        public Builder row(double height, double range, double age, double ageUnc, String type) {
            rows.add(Observation.fromColumns(height, range, age, ageUnc, type));
            return this;
        }

        public Builder add(Observation observation) {
            rows.add(observation);
            return this;
        }

        public ObservationSet build() {
            return ObservationSet.of(rows);
        }
    }
}
