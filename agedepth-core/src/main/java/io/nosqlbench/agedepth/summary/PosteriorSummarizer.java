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

import io.nosqlbench.agedepth.model.CompositePosterior;
import io.nosqlbench.agedepth.model.PosteriorDraw;
import io.nosqlbench.agedepth.model.SubsidenceCurve;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Turns a composite posterior into ages and age differences.
///
/// ## Non-finite ages
///
/// A draw whose curve is undefined at a height (stretch too small for that
/// height, or `b ≤ 1`) yields NaN or an infinity there. Such values are left
/// out of the median and interval and counted in [AgeInterval#excluded()].
/// When every draw is non-finite the bounds are NaN.
///
/// ## Differences
///
/// [#correlatedDifference(double, double, CompositePosterior)] subtracts the
/// two ages of the same draw. [#independentDifference(double, double,
/// CompositePosterior, UniformRandomProvider)] pairs each draw with a randomly
/// chosen other one, which discards the correlation between `a` and `b` and
/// widens the interval; it exists for comparison only.
public final class PosteriorSummarizer {

    private static final Logger logger = LogManager.getLogger(PosteriorSummarizer.class);

    private final SubsidenceCurve curve;
    private final double mass;

    public PosteriorSummarizer(SubsidenceCurve curve) {
        this(curve, HighestDensityInterval.DEFAULT_MASS);
    }

    public PosteriorSummarizer(SubsidenceCurve curve, double mass) {
        this.curve = Objects.requireNonNull(curve, "curve cannot be null");
        if (!(mass > 0.0 && mass < 1.0)) {
            throw new IllegalArgumentException("mass must lie in (0, 1): " + mass);
        }
        this.mass = mass;
    }

    /// Ages implied at `height` by every draw, in draw order.
    public double[] agesAt(double height, CompositePosterior posterior) {
        double[] ages = new double[posterior.size()];
        for (int i = 0; i < ages.length; i++) {
            ages[i] = posterior.get(i).ageAt(curve, height);
        }
        return ages;
    }

    /// Median and highest-density interval of the age at one height.
    public AgeInterval summarize(double height, CompositePosterior posterior) {
        return intervalOf(agesAt(height, posterior), "age at height " + height);
    }

    /// One table row per query height.
    public List<HeightAgeSummary> summarize(QueryHeights heights, CompositePosterior posterior) {
        List<HeightAgeSummary> rows = new ArrayList<>(heights.size());
        for (int i = 0; i < heights.size(); i++) {
            double height = heights.get(i);
            rows.add(HeightAgeSummary.of(height, summarize(height, posterior)));
        }
        return rows;
    }

    public List<HeightAgeSummary> summarize(double[] heights, CompositePosterior posterior) {
        return summarize(QueryHeights.of(heights), posterior);
    }

    /// Distribution of `age(h1) - age(h2)` taken draw by draw.
    public AgeInterval correlatedDifference(double height1, double height2, CompositePosterior posterior) {
        double[] differences = new double[posterior.size()];
        for (int i = 0; i < differences.length; i++) {
            PosteriorDraw draw = posterior.get(i);
            differences[i] = draw.ageAt(curve, height1) - draw.ageAt(curve, height2);
        }
        return intervalOf(differences, "difference " + height1 + " - " + height2);
    }

    /// Distribution of `age(h1) - age(h2)` with the second age taken from a
    /// randomly permuted copy of the posterior.
    public AgeInterval independentDifference(double height1, double height2, CompositePosterior posterior,
                                             UniformRandomProvider rng) {
        CompositePosterior shuffled = posterior.permuted(rng);
        double[] differences = new double[posterior.size()];
        for (int i = 0; i < differences.length; i++) {
            differences[i] = posterior.get(i).ageAt(curve, height1) - shuffled.get(i).ageAt(curve, height2);
        }
        return intervalOf(differences, "independent difference " + height1 + " - " + height2);
    }

    /// Onset and end ages of an interval together with its correlated duration.
    ///
    /// @param onsetHeight base of the interval, the older end
    /// @param endHeight top of the interval
    public AnomalyDuration anomalyDuration(double onsetHeight, double endHeight, CompositePosterior posterior) {
        return new AnomalyDuration(
            onsetHeight,
            endHeight,
            summarize(onsetHeight, posterior),
            summarize(endHeight, posterior),
            correlatedDifference(onsetHeight, endHeight, posterior));
    }

    private AgeInterval intervalOf(double[] values, String quantity) {
        double[] finite = Arrays.stream(values).filter(Double::isFinite).toArray();
        int excluded = values.length - finite.length;
        if (excluded > 0) {
            logger.debug("{}: {} of {} draws non-finite, excluded", quantity, excluded, values.length);
        }
        if (finite.length == 0) {
            return new AgeInterval(Double.NaN, Double.NaN, Double.NaN, 0, excluded);
        }
        double median = new Median().evaluate(finite);
        HighestDensityInterval hdi = HighestDensityInterval.of(finite, mass);
        return new AgeInterval(median, hdi.lower(), hdi.upper(), finite.length, excluded);
    }
}
