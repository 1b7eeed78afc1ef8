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

import io.nosqlbench.agedepth.model.ResampledDraw;
import io.nosqlbench.agedepth.sample.RandomSources;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class SuperpositionFilterTest {

    private final SuperpositionFilter filter = new SuperpositionFilter();

    private static ResampledDraw p(double height, double age) {
        return new ResampledDraw(height, age);
    }

    @Test
    void testOddIterationsScanUpward() {
        assertThat(ScanDirection.forIteration(1)).isEqualTo(ScanDirection.UPWARD);
        assertThat(ScanDirection.forIteration(2)).isEqualTo(ScanDirection.DOWNWARD);
        assertThat(ScanDirection.forIteration(7499)).isEqualTo(ScanDirection.UPWARD);
        assertThat(ScanDirection.forIteration(7500)).isEqualTo(ScanDirection.DOWNWARD);
    }

    @Test
    void testOrderedSectionIsKeptWhole() {
        List<ResampledDraw> draws = List.of(p(0, 820), p(500, 750), p(1000, 700), p(1500, 650));
        assertThat(filter.filter(draws, ScanDirection.UPWARD)).containsExactlyElementsOf(draws);
        assertThat(filter.filter(draws, ScanDirection.DOWNWARD)).containsExactlyElementsOf(draws);
    }

    @Test
    void testDirectionsDifferOnAnInvertedPair() {
        // 770 at 500 is older than 750 below it
        List<ResampledDraw> draws = List.of(p(0, 800), p(250, 750), p(500, 770), p(1000, 700));

        List<ResampledDraw> upward = filter.filter(draws, 1);
        List<ResampledDraw> downward = filter.filter(draws, 2);

        assertThat(upward).containsExactly(p(0, 800), p(250, 750), p(1000, 700));
        assertThat(downward).containsExactly(p(0, 800), p(500, 770), p(1000, 700));
        assertThat(upward).isNotEqualTo(downward);
    }

    @Test
    void testAnchorsSurviveTheirScan() {
        // an outlier at the base dominates the upward scan; the downward scan drops it
        List<ResampledDraw> draws = List.of(p(0, 600), p(500, 750), p(1000, 700), p(1500, 650));

        assertThat(filter.filter(draws, ScanDirection.UPWARD)).containsExactly(p(0, 600));
        assertThat(filter.filter(draws, ScanDirection.DOWNWARD))
            .containsExactly(p(500, 750), p(1000, 700), p(1500, 650));
    }

    @Test
    void testEqualHeightsAreOrderedOlderFirst() {
        List<ResampledDraw> draws = List.of(p(0, 820), p(100, 780), p(100, 760), p(200, 700));

        List<ResampledDraw> upward = filter.filter(draws, ScanDirection.UPWARD);
        List<ResampledDraw> downward = filter.filter(draws, ScanDirection.DOWNWARD);

        assertThat(upward).containsExactlyElementsOf(draws);
        assertThat(downward).containsExactlyElementsOf(draws);
        assertMonotone(upward);
        assertMonotone(downward);
    }

    @Test
    void testOutputIsMonotoneForRandomDraws() {
        UniformRandomProvider rng = RandomSources.create(11L);
        for (int trial = 0; trial < 500; trial++) {
            List<ResampledDraw> draws = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                draws.add(p(Math.floor(rng.nextDouble() * 20) * 100, 600 + rng.nextDouble() * 250));
            }
            draws.sort(ResampledDraw.BY_HEIGHT);
            assertMonotone(filter.filter(draws, ScanDirection.UPWARD));
            assertMonotone(filter.filter(draws, ScanDirection.DOWNWARD));
        }
    }

    @Test
    void testReversedSectionCollapsesToItsAnchor() {
        List<ResampledDraw> draws = List.of(p(0, 600), p(500, 650), p(1000, 700));
        assertThat(filter.filter(draws, ScanDirection.UPWARD)).containsExactly(p(0, 600));
        assertThat(filter.filter(draws, ScanDirection.DOWNWARD)).containsExactly(p(1000, 700));

        assertThatThrownBy(() -> filter.filter(draws, 3))
            .isInstanceOf(SuperpositionException.class)
            .satisfies(e -> {
                SuperpositionException failure = (SuperpositionException) e;
                assertThat(failure.getIteration()).isEqualTo(3);
                assertThat(failure.getSurvivorCount()).isEqualTo(1);
                assertThat(failure.getDrawCount()).isEqualTo(3);
            });
    }

    @Test
    void testRejectsUnsortedInput() {
        assertThatThrownBy(() -> filter.filter(List.of(p(500, 700), p(0, 800)), ScanDirection.UPWARD))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sorted");
    }

    @Test
    void testEmptyInputGivesEmptyOutput() {
        assertThat(filter.filter(List.of(), ScanDirection.DOWNWARD)).isEmpty();
    }

    private static void assertMonotone(List<ResampledDraw> kept) {
        assertThat(kept).isNotEmpty();
        for (int i = 1; i < kept.size(); i++) {
            assertThat(kept.get(i).height()).isGreaterThanOrEqualTo(kept.get(i - 1).height());
            assertThat(kept.get(i).age()).isLessThan(kept.get(i - 1).age());
        }
    }
}
