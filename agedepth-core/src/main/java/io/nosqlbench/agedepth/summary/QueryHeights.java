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

import io.nosqlbench.agedepth.model.CalibrationConfigException;
import io.nosqlbench.agedepth.model.Observation;
import io.nosqlbench.agedepth.model.ObservationSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Strictly increasing, finite heights at which the posterior is summarized.
public final class QueryHeights {

    private final double[] heights;

    private QueryHeights(double[] heights) {
        this.heights = heights;
    }

    /// Validates an explicit list of heights.
    ///
    /// @param heights the heights, lowest first
    /// @return the query heights
    /// @throws CalibrationConfigException listing every non-finite or out-of-order entry
    public static QueryHeights of(double... heights) {
        List<String> problems = new ArrayList<>();
        if (heights.length == 0) {
            problems.add("at least one query height is required");
        }
        for (int i = 0; i < heights.length; i++) {
            if (!Double.isFinite(heights[i])) {
                problems.add("height " + i + " is not finite: " + heights[i]);
            } else if (i > 0 && Double.isFinite(heights[i - 1]) && heights[i] <= heights[i - 1]) {
                problems.add("height " + i + " (" + heights[i] + ") does not exceed height "
                    + (i - 1) + " (" + heights[i - 1] + ")");
            }
        }
        if (!problems.isEmpty()) {
            throw new CalibrationConfigException("query heights", problems);
        }
        return new QueryHeights(heights.clone());
    }

    /// Regular grid `0, step, 2·step, …` up to and including `top` when it falls on the grid.
    ///
    /// @throws CalibrationConfigException if step is not positive or top is negative
    public static QueryHeights grid(double step, double top) {
        List<String> problems = new ArrayList<>();
        if (!(step > 0.0) || !Double.isFinite(step)) {
            problems.add("grid step must be positive and finite: " + step);
        }
        if (!(top >= 0.0) || !Double.isFinite(top)) {
            problems.add("grid top must be non-negative and finite: " + top);
        }
        if (!problems.isEmpty()) {
            throw new CalibrationConfigException("query heights", problems);
        }
        int count = (int) Math.floor(top / step + 1e-9) + 1;
        double[] heights = new double[count];
        for (int i = 0; i < count; i++) {
            heights[i] = i * step;
        }
        return new QueryHeights(heights);
    }

    /// Heights of the observations themselves, duplicates collapsed.
    public static QueryHeights observed(ObservationSet observations) {
        double[] heights = observations.asList().stream()
            .mapToDouble(Observation::height)
            .sorted()
            .distinct()
            .toArray();
        return of(heights);
    }

    public int size() {
        return heights.length;
    }

    public double get(int index) {
        return heights[index];
    }

    public double[] toArray() {
        return heights.clone();
    }

    @Override
    public String toString() {
        return "QueryHeights" + Arrays.toString(heights);
    }
}
