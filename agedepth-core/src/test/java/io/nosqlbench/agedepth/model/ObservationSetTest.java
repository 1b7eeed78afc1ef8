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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class ObservationSetTest {

    @Test
    void buildsRowsInTableOrder() {
        ObservationSet set = ObservationSet.builder()
            .row(500, 20, 750, 5, "normal")
            .row(0, 20, 820, 5, "uniform")
            .build();

        assertThat(set.size()).isEqualTo(2);
        assertThat(set.get(0).height()).isEqualTo(500.0);
        assertThat(set.get(0).heightShape()).isEqualTo(UncertaintyShape.GAUSSIAN);
        assertThat(set.get(1).heightShape()).isEqualTo(UncertaintyShape.UNIFORM);
        assertThat(set.minHeight()).isEqualTo(0.0);
        assertThat(set.maxHeight()).isEqualTo(500.0);
    }

    @Test
    void parsesShapeTags() {
        assertThat(UncertaintyShape.fromTag("normal")).isEqualTo(UncertaintyShape.GAUSSIAN);
        assertThat(UncertaintyShape.fromTag(" Normal ")).isEqualTo(UncertaintyShape.GAUSSIAN);
        assertThat(UncertaintyShape.fromTag("GAUSSIAN")).isEqualTo(UncertaintyShape.GAUSSIAN);
        assertThat(UncertaintyShape.fromTag("uniform")).isEqualTo(UncertaintyShape.UNIFORM);
        assertThat(UncertaintyShape.fromTag("range")).isEqualTo(UncertaintyShape.UNIFORM);
        assertThat(UncertaintyShape.fromTag(null)).isEqualTo(UncertaintyShape.UNIFORM);
    }

    @Test
    void halvesUncertainties() {
        Observation observation = Observation.fromColumns(100, 40, 700, 10, "normal");
        assertThat(observation.ageSigma()).isEqualTo(5.0);
        assertThat(observation.heightSpread()).isEqualTo(20.0);
        assertThat(observation.label()).isEmpty();
    }

    @Test
    void reportsEveryProblemAtOnce() {
        assertThatThrownBy(() -> ObservationSet.builder()
            .row(Double.NaN, 20, 750, 5, "normal")
            .row(0, -1, 820, -5, "normal")
            .row(10, 0, Double.POSITIVE_INFINITY, 5, "uniform")
            .build())
            .isInstanceOf(CalibrationConfigException.class)
            .satisfies(e -> {
                List<String> problems = ((CalibrationConfigException) e).getProblems();
                assertThat(problems).hasSize(4);
                assertThat(problems).anyMatch(p -> p.startsWith("row 0: height"));
                assertThat(problems).anyMatch(p -> p.startsWith("row 1: height uncertainty"));
                assertThat(problems).anyMatch(p -> p.startsWith("row 1: age uncertainty"));
                assertThat(problems).anyMatch(p -> p.startsWith("row 2: age"));
            });
    }

    @Test
    void rejectsTooFewRows() {
        assertThatThrownBy(() -> ObservationSet.builder().row(0, 20, 820, 5, "normal").build())
            .isInstanceOf(CalibrationConfigException.class)
            .hasMessageContaining("at least 2 observations");
    }

    @Test
    void isReadOnly() {
        ObservationSet set = ObservationSet.builder()
            .row(0, 20, 820, 5, "normal")
            .row(500, 20, 750, 5, "normal")
            .build();
        assertThatThrownBy(() -> set.asList().add(Observation.fromColumns(1, 1, 1, 1, "normal")))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
