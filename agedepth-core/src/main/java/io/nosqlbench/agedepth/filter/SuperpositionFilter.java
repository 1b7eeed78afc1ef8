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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Reduces a resampled section to the points that obey superposition: higher
/// points must be strictly younger than every kept point below them.
///
/// ## Algorithm
///
/// ```text
///   UPWARD (odd iterations)            DOWNWARD (even iterations)
///
///   keep lowest draw                   keep highest draw
///   for each draw going up:            for each draw going down:
///     keep if age < last kept age        keep if age > last kept age
///                                      re-sort kept draws by height
/// ```
///
/// Out-of-order points are dropped one at a time instead of discarding the
/// whole draw. The anchor point of the scan always survives, so the two
/// directions are alternated between iterations to keep either end of the
/// section from being favoured.
///
/// ## Output
///
/// Kept draws are ascending in height and strictly descending in age.
public final class SuperpositionFilter {

    /// Fewest kept points for which the curve fit is well posed.
    public static final int MINIMUM_LENGTH = 2;

    /// Filters a draw using the direction assigned to the iteration.
    ///
    /// @param sortedDraws draws sorted ascending by height
    /// @param iteration 1-based iteration index
    /// @return the kept draws, ascending in height
    /// @throws SuperpositionException if fewer than [#MINIMUM_LENGTH] draws are kept
    public List<ResampledDraw> filter(List<ResampledDraw> sortedDraws, int iteration) {
        List<ResampledDraw> kept = filter(sortedDraws, ScanDirection.forIteration(iteration));
        if (kept.size() < MINIMUM_LENGTH) {
            throw new SuperpositionException(iteration, kept.size(), sortedDraws.size());
        }
        return kept;
    }

    /// Filters a draw in the given direction without enforcing a minimum length.
    ///
    /// @param sortedDraws draws sorted ascending by height
    /// @param direction scan direction
    /// @return the kept draws, ascending in height
    /// @throws IllegalArgumentException if the draws are not sorted by height
    public List<ResampledDraw> filter(List<ResampledDraw> sortedDraws, ScanDirection direction) {
        Objects.requireNonNull(sortedDraws, "sortedDraws cannot be null");
        Objects.requireNonNull(direction, "direction cannot be null");
        requireSorted(sortedDraws);
        if (sortedDraws.isEmpty()) {
            return List.of();
        }
        return direction == ScanDirection.UPWARD ? scanUpward(sortedDraws) : scanDownward(sortedDraws);
    }

    private static List<ResampledDraw> scanUpward(List<ResampledDraw> draws) {
        List<ResampledDraw> kept = new ArrayList<>(draws.size());
        ResampledDraw last = draws.get(0);
        kept.add(last);
        for (int i = 1; i < draws.size(); i++) {
            ResampledDraw candidate = draws.get(i);
            if (candidate.age() < last.age()) {
                kept.add(candidate);
                last = candidate;
            }
        }
        return kept;
    }

    private static List<ResampledDraw> scanDownward(List<ResampledDraw> draws) {
        List<ResampledDraw> kept = new ArrayList<>(draws.size());
        ResampledDraw last = draws.get(draws.size() - 1);
        kept.add(last);
        for (int i = draws.size() - 2; i >= 0; i--) {
            ResampledDraw candidate = draws.get(i);
            if (candidate.age() > last.age()) {
                kept.add(candidate);
                last = candidate;
            }
        }
        kept.sort(ResampledDraw.SECTION_ORDER);
        return kept;
    }

    private static void requireSorted(List<ResampledDraw> draws) {
        for (int i = 1; i < draws.size(); i++) {
            if (draws.get(i).height() < draws.get(i - 1).height()) {
                throw new IllegalArgumentException("draws must be sorted by ascending height; index " + i
                    + " (" + draws.get(i).height() + ") is below index " + (i - 1)
                    + " (" + draws.get(i - 1).height() + ")");
            }
        }
    }
}
