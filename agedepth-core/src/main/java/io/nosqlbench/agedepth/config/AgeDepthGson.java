package io.nosqlbench.agedepth.config;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import io.nosqlbench.agedepth.bootstrap.CalibrationResult;
import io.nosqlbench.agedepth.summary.HeightAgeSummary;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/// Shared [Gson] configuration for calibration configs and run results.
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable files |
/// | HTML escaping | Disabled | Cleaner output |
/// | Special floating point | Enabled | Non-finite ages from extreme draws |
///
/// The instance is thread-safe.
public final class AgeDepthGson {

    private static final Gson INSTANCE = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .serializeSpecialFloatingPointValues()
        .create();

    private AgeDepthGson() {
    }

    public static Gson gson() {
        return INSTANCE;
    }

    /// Renders a run result with optional per-height summaries.
    ///
    /// ```json
    /// {
    ///   "seed": 1,
    ///   "diagnostics": {...},
    ///   "final_prior": {...},
    ///   "posterior": [{"a": 817.2, "b": 1.31, "sigma": 9.8}, ...],
    ///   "summaries": [{"height": 0.0, "median_age": 817.1, "age_min": 808.3, "age_max": 826.0}, ...]
    /// }
    /// ```
    ///
    /// @param result the finished run
    /// @param summaries per-height summaries, may be empty
    /// @return the JSON tree
    public static JsonObject toJsonTree(CalibrationResult result, List<HeightAgeSummary> summaries) {
        JsonObject root = new JsonObject();
        root.addProperty("seed", result.seed());
        root.add("diagnostics", INSTANCE.toJsonTree(result.diagnostics()));
        JsonObject prior = new JsonObject();
        prior.addProperty("a_mean", result.finalPrior().aMean());
        prior.addProperty("a_sigma", result.finalPrior().aSigma());
        prior.addProperty("b_mean", result.finalPrior().bMean());
        prior.addProperty("b_sigma", result.finalPrior().bSigma());
        root.add("final_prior", prior);
        root.add("posterior", INSTANCE.toJsonTree(result.posterior().draws()));
        root.add("summaries", INSTANCE.toJsonTree(summaries));
        return root;
    }

    /// Writes [#toJsonTree(CalibrationResult, List)] to a file.
    ///
    /// @throws IOException if the file cannot be written
    public static void write(Path path, CalibrationResult result, List<HeightAgeSummary> summaries) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            INSTANCE.toJson(toJsonTree(result, summaries), writer);
        }
    }
}
