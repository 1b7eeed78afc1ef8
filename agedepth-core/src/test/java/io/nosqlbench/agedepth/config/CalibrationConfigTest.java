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

import io.nosqlbench.agedepth.fit.FitSettings;
import io.nosqlbench.agedepth.fit.ParameterPrior;
import io.nosqlbench.agedepth.model.CalibrationConfigException;
import io.nosqlbench.agedepth.model.PhysicalConstants;
import io.nosqlbench.agedepth.sample.RandomSources;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CalibrationConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void emptyDocumentGivesDefaults() {
        CalibrationConfig config = CalibrationConfig.fromJson("{}");

        assertThat(config.getIterations()).isEqualTo(7500);
        assertThat(config.getSeed()).isEqualTo(1L);
        assertThat(config.getMaxAttempts()).isEqualTo(50);
        assertThat(config.getProgressInterval()).isEqualTo(500);
        assertThat(config.getPrior()).isEqualTo(ParameterPrior.defaults());
        assertThat(config.getFitSettings()).isEqualTo(FitSettings.defaults());
        assertThat(config.getConstants().subsidenceCorrection())
            .isEqualTo(PhysicalConstants.defaults().subsidenceCorrection());
        assertThat(config.getAlgorithm()).isEqualTo(RandomSources.Algorithm.XO_SHI_RO_256_PP);
        assertThat(config.validate()).isEmpty();

        assertThat(CalibrationConfig.fromJson("").getIterations()).isEqualTo(7500);
    }

    @Test
    void readsSnakeCaseFields() {
        String json = """
            {
              "iterations": 200,
              "seed": 42,
              "max_attempts": 5,
              "prior": {"a_mean": 800.0, "b_sigma": 0.3},
              "start": {"b": 1.5},
              "sigma_upper": 20.0,
              "constants": {"infill_density": 1000.0}
            }
            """;
        CalibrationConfig config = CalibrationConfig.fromJson(json);

        assertThat(config.getIterations()).isEqualTo(200);
        assertThat(config.getSeed()).isEqualTo(42L);
        assertThat(config.getMaxAttempts()).isEqualTo(5);
        assertThat(config.getPrior()).isEqualTo(new ParameterPrior(800.0, 5.0, 1.3, 0.3));
        assertThat(config.getFitSettings().start().b()).isEqualTo(1.5);
        assertThat(config.getFitSettings().start().a()).isEqualTo(817.0);
        assertThat(config.getFitSettings().sigmaUpper()).isEqualTo(20.0);
        assertThat(config.getConstants().infillDensity()).isEqualTo(1000.0);
        assertThat(config.getConstants().mantleDensity()).isEqualTo(PhysicalConstants.DEFAULT_MANTLE_DENSITY);
    }

    @Test
    void savesAndLoads() throws IOException {
        CalibrationConfig original = new CalibrationConfig()
            .setIterations(250)
            .setSeed(7L)
            .setMaxAttempts(12)
            .setPrior(new CalibrationConfig.PriorConfig(810.0, 4.0, 1.4, 0.25))
            .setStart(new CalibrationConfig.StartConfig(810.0, 1.4, 6.0))
            .setConstants(new CalibrationConfig.ConstantsConfig().setLithosphereThickness(120_000.0));

        Path file = tempDir.resolve("calibration.json");
        original.save(file);
        assertThat(Files.readString(file)).contains("\"max_attempts\": 12").contains("\"a_mean\": 810.0");

        CalibrationConfig loaded = CalibrationConfig.load(file);
        assertThat(loaded.getIterations()).isEqualTo(250);
        assertThat(loaded.getSeed()).isEqualTo(7L);
        assertThat(loaded.getMaxAttempts()).isEqualTo(12);
        assertThat(loaded.getPrior()).isEqualTo(original.getPrior());
        assertThat(loaded.getFitSettings()).isEqualTo(original.getFitSettings());
        assertThat(loaded.getConstants().lithosphereThickness()).isEqualTo(120_000.0);
        assertThat(loaded.toJson()).isEqualTo(original.toJson());
    }

    @Test
    void reportsAllProblemsTogether() {
        CalibrationConfig config = new CalibrationConfig()
            .setIterations(0)
            .setMaxAttempts(0)
            .setPrior(new CalibrationConfig.PriorConfig(817.0, -5.0, 1.3, 0.2))
            .setConstants(new CalibrationConfig.ConstantsConfig().setInfillDensity(4000.0));

        assertThat(config.validate()).hasSize(4);
        assertThatThrownBy(config::requireValid)
            .isInstanceOf(CalibrationConfigException.class)
            .hasMessageContaining("iterations")
            .hasMessageContaining("max_attempts")
            .hasMessageContaining("a_sigma")
            .hasMessageContaining("infill_density");
    }

    @Test
    void malformedJsonIsAConfigurationError() {
        assertThatThrownBy(() -> CalibrationConfig.fromJson("{\"iterations\": \"many\"}"))
            .isInstanceOf(CalibrationConfigException.class)
            .hasMessageContaining("unreadable JSON");
    }

    @Test
    void selectsRandomAlgorithmByName() {
        assertThat(CalibrationConfig.fromJson("{\"algorithm\": \"mt\"}").getAlgorithm())
            .isEqualTo(RandomSources.Algorithm.MT);
        assertThat(CalibrationConfig.fromJson("{\"algorithm\": \"Split_Mix_64\"}").getAlgorithm())
            .isEqualTo(RandomSources.Algorithm.SPLIT_MIX_64);

        CalibrationConfig unknown = CalibrationConfig.fromJson("{\"algorithm\": \"lcg\"}");
        assertThat(unknown.validate()).singleElement().asString().contains("lcg");
        assertThatThrownBy(unknown::requireValid)
            .isInstanceOf(CalibrationConfigException.class)
            .hasMessageContaining("algorithm");

        String saved = new CalibrationConfig().setAlgorithm(RandomSources.Algorithm.SPLIT_MIX_64).toJson();
        assertThat(saved).contains("\"algorithm\": \"split_mix_64\"");
        assertThat(CalibrationConfig.fromJson(saved).getAlgorithm()).isEqualTo(RandomSources.Algorithm.SPLIT_MIX_64);
    }
}
