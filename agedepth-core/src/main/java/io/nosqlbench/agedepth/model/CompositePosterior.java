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

import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/// The ordered set of parameter draws collected over a bootstrap run, one per
/// iteration.
///
/// ## Lifecycle
///
/// ```text
///   Builder (append-only, owned by the calibrator)
///       │  append(draw) × N
///       ▼
///   CompositePosterior (immutable, input to every summary)
/// ```
///
/// Draw order is the iteration order. Summaries do not depend on it, which is
/// what [#permuted(UniformRandomProvider)] exists to check.
public final class CompositePosterior implements Iterable<PosteriorDraw> {

    private final List<PosteriorDraw> draws;

    private CompositePosterior(List<PosteriorDraw> draws) {
        this.draws = Collections.unmodifiableList(draws);
    }

    /// Wraps an existing list of draws.
    public static CompositePosterior of(List<PosteriorDraw> draws) {
        Objects.requireNonNull(draws, "draws cannot be null");
        return new CompositePosterior(new ArrayList<>(draws));
    }

    public static Builder builder(int expectedSize) {
        return new Builder(expectedSize);
    }

    public int size() {
        return draws.size();
    }

    public boolean isEmpty() {
        return draws.isEmpty();
    }

    public PosteriorDraw get(int index) {
        return draws.get(index);
    }

    public List<PosteriorDraw> draws() {
        return draws;
    }

    /// Column of intercept values in draw order.
    public double[] a() {
        double[] values = new double[draws.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = draws.get(i).a();
        }
        return values;
    }

    /// Column of stretch factors in draw order.
    public double[] b() {
        double[] values = new double[draws.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = draws.get(i).b();
        }
        return values;
    }

    /// Column of residual standard deviations in draw order.
    public double[] sigma() {
        double[] values = new double[draws.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = draws.get(i).sigma();
        }
        return values;
    }

    /// Returns a copy with the draws in a random order (Fisher-Yates).
    public CompositePosterior permuted(UniformRandomProvider rng) {
        List<PosteriorDraw> copy = new ArrayList<>(draws);
        for (int i = copy.size() - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            PosteriorDraw temp = copy.get(i);
            copy.set(i, copy.get(j));
            copy.set(j, temp);
        }
        return new CompositePosterior(copy);
    }

    @Override
    public Iterator<PosteriorDraw> iterator() {
        return draws.iterator();
    }

    @Override
    public String toString() {
        return "CompositePosterior{draws=" + draws.size() + "}";
    }

    /// Append-only accumulator used while the bootstrap loop runs.
    public static final class Builder {
        private final List<PosteriorDraw> draws;

        private Builder(int expectedSize) {
            this.draws = new ArrayList<>(Math.max(expectedSize, 0));
        }

        public Builder append(PosteriorDraw draw) {
            draws.add(Objects.requireNonNull(draw, "draw cannot be null"));
            return this;
        }

        public int size() {
            return draws.size();
        }

        public CompositePosterior build() {
            return new CompositePosterior(new ArrayList<>(draws));
        }
    }
}
