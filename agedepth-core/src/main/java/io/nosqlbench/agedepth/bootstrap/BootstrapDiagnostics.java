package io.nosqlbench.agedepth.bootstrap;

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

import com.google.gson.annotations.SerializedName;

/// Counters collected over a bootstrap run.
///
/// @param iterations accepted iterations
/// @param attempts total attempts including retries
/// @param superpositionFailures attempts rejected because too few points obeyed superposition
/// @param fitFailures attempts rejected because the fit did not converge
/// @param minFilteredLength shortest filtered section that was fitted
/// @param maxFilteredLength longest filtered section that was fitted
/// @param meanFilteredLength mean filtered section length over accepted iterations
/// @param evaluations objective evaluations over accepted iterations
/// @param elapsedMillis wall-clock duration of the loop
public record BootstrapDiagnostics(
    @SerializedName("iterations") int iterations,
    @SerializedName("attempts") long attempts,
    @SerializedName("superposition_failures") long superpositionFailures,
    @SerializedName("fit_failures") long fitFailures,
    @SerializedName("min_filtered_length") int minFilteredLength,
    @SerializedName("max_filtered_length") int maxFilteredLength,
    @SerializedName("mean_filtered_length") double meanFilteredLength,
    @SerializedName("evaluations") long evaluations,
    @SerializedName("elapsed_millis") long elapsedMillis
) {

    /// Attempts that had to be repeated.
    public long retries() {
        return attempts - iterations;
    }

    /// Mutable counterpart filled in by the calibrator.
    static final class Accumulator {
        private int iterations;
        private long attempts;
        private long superpositionFailures;
        private long fitFailures;
        private int minFiltered = Integer.MAX_VALUE;
        private int maxFiltered;
        private long filteredTotal;
        private long evaluations;
        private final long startNanos = System.nanoTime();

        void attempt() {
            attempts++;
        }

        void superpositionFailure() {
            superpositionFailures++;
        }

        void fitFailure() {
            fitFailures++;
        }

        void accepted(int filteredLength, int fitEvaluations) {
            iterations++;
            minFiltered = Math.min(minFiltered, filteredLength);
            maxFiltered = Math.max(maxFiltered, filteredLength);
            filteredTotal += filteredLength;
            evaluations += fitEvaluations;
        }

        long retries() {
            return attempts - iterations;
        }

        BootstrapDiagnostics snapshot() {
            return new BootstrapDiagnostics(
                iterations,
                attempts,
                superpositionFailures,
                fitFailures,
                iterations == 0 ? 0 : minFiltered,
                maxFiltered,
                iterations == 0 ? 0.0 : (double) filteredTotal / iterations,
                evaluations,
                (System.nanoTime() - startNanos) / 1_000_000L);
        }
    }
}
