package io.nosqlbench.agedepth.sample;

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

import io.nosqlbench.agedepth.model.Observation;
import io.nosqlbench.agedepth.model.ObservationSet;
import io.nosqlbench.agedepth.model.ResampledDraw;
import io.nosqlbench.agedepth.model.UncertaintyShape;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousUniformSampler;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Draws a random (height, age) point from each observation's uncertainty.
///
/// ## Distributions
///
/// | Quantity | Shape | Draw |
/// |----------|-------|------|
/// | age | always Gaussian | N(age, ageUnc / 2) |
/// | height | [UncertaintyShape#GAUSSIAN] | N(height, range / 2) |
/// | height | [UncertaintyShape#UNIFORM] | U[height − range / 2, height + range / 2] |
///
/// The stored uncertainties are 95% half-widths. Halving them approximates a
/// standard deviation; the 1.96 factor is deliberately not applied.
///
/// ## Draw order
///
/// [#resample(ObservationSet)] draws every age in table order first, then
/// every height in table order. Seeded runs rely on this order.
///
/// The sampler holds no per-observation state, only the shared random provider.
public final class UncertaintySampler {

    private final UniformRandomProvider rng;
    private final NormalizedGaussianSampler normal;

    /// Creates a sampler drawing from the given provider.
    ///
    /// @param rng the run's shared random provider
    public UncertaintySampler(UniformRandomProvider rng) {
        this.rng = Objects.requireNonNull(rng, "rng cannot be null");
        this.normal = RandomSources.standardNormal(rng);
    }

    /// Draws an age for one observation.
    public double drawAge(Observation observation) {
        return observation.age() + observation.ageSigma() * normal.sample();
    }

    /// Draws a height for one observation according to its uncertainty shape.
    public double drawHeight(Observation observation) {
        double spread = observation.heightSpread();
        if (observation.heightShape() == UncertaintyShape.GAUSSIAN) {
            return observation.height() + spread * normal.sample();
        }
        if (spread == 0) {
            return observation.height();
        }
        return ContinuousUniformSampler.of(rng, observation.height() - spread, observation.height() + spread).sample();
    }

    /// Draws one point for a single observation, age first.
    public ResampledDraw sample(Observation observation) {
        double age = drawAge(observation);
        double height = drawHeight(observation);
        return new ResampledDraw(height, age);
    }

    /// Draws one point per observation and returns them sorted by height.
    ///
    /// @param observations the observation table
    /// @return draws in ascending height order; ties keep table order
    public List<ResampledDraw> resample(ObservationSet observations) {
        int n = observations.size();
        double[] ages = new double[n];
        for (int i = 0; i < n; i++) {
            ages[i] = drawAge(observations.get(i));
        }
        double[] heights = new double[n];
        for (int i = 0; i < n; i++) {
            heights[i] = drawHeight(observations.get(i));
        }

        List<ResampledDraw> draws = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            draws.add(new ResampledDraw(heights[i], ages[i]));
        }
        draws.sort(ResampledDraw.BY_HEIGHT);
        return draws;
    }
}
