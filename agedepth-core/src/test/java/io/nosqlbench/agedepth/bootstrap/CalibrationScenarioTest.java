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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.nosqlbench.agedepth.config.AgeDepthGson;
import io.nosqlbench.agedepth.config.CalibrationConfig;
import io.nosqlbench.agedepth.summary.AgeInterval;
import io.nosqlbench.agedepth.summary.HeightAgeSummary;
import io.nosqlbench.agedepth.summary.PosteriorSummarizer;
import io.nosqlbench.agedepth.summary.QueryHeights;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// Full run over a five-horizon section, summarized and exported.
@Tag("integration")
public class CalibrationScenarioTest {

    @TempDir
    Path tempDir;

    @Test
    void fivePointSectionCalibrates() throws IOException {
        CalibrationConfig config = new CalibrationConfig().setIterations(100).setSeed(1L).setProgressInterval(25);
        BootstrapCalibrator calibrator = new BootstrapCalibrator(BootstrapCalibratorTest.fivePointSection(), config);

        CalibrationResult result = calibrator.run();
        assertThat(result.posterior().size()).isEqualTo(100);
        assertThat(result.diagnostics().iterations()).isEqualTo(100);

        for (double sigma : result.posterior().sigma()) {
            assertThat(sigma).isPositive().isLessThanOrEqualTo(config.getFitSettings().sigmaUpper());
        }

        double medianB = new Median().evaluate(result.posterior().b());
        assertThat(medianB).isBetween(0.8, 2.0);

        PosteriorSummarizer summarizer = new PosteriorSummarizer(calibrator.curve());
        AgeInterval base = summarizer.summarize(0.0, result.posterior());
        AgeInterval top = summarizer.summarize(2000.0, result.posterior());
        assertThat(base.included()).isEqualTo(100);
        assertThat(top.included()).isPositive();
        assertThat(base.median()).isGreaterThan(top.median());
        assertThat(base.lower95()).isLessThanOrEqualTo(base.median());
        assertThat(base.upper95()).isGreaterThanOrEqualTo(base.median());

        List<HeightAgeSummary> table = summarizer.summarize(QueryHeights.grid(250.0, 2000.0), result.posterior());
        assertThat(table).hasSize(9);
        assertThat(table.get(0).medianAge()).isEqualTo(base.median());

        Path exported = tempDir.resolve("result.json");
        AgeDepthGson.write(exported, result, table);
        JsonObject json = JsonParser.parseString(Files.readString(exported)).getAsJsonObject();
        assertThat(json.get("seed").getAsLong()).isEqualTo(1L);
        assertThat(json.getAsJsonArray("posterior")).hasSize(100);
        assertThat(json.getAsJsonArray("summaries")).hasSize(9);
        assertThat(json.getAsJsonObject("diagnostics").get("iterations").getAsInt()).isEqualTo(100);
        assertThat(json.getAsJsonArray("summaries").get(0).getAsJsonObject().has("median_age")).isTrue();
    }
}
