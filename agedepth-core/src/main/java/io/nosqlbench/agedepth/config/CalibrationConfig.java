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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.agedepth.fit.FitSettings;
import io.nosqlbench.agedepth.fit.ParameterPrior;
import io.nosqlbench.agedepth.model.CalibrationConfigException;
import io.nosqlbench.agedepth.model.PhysicalConstants;
import io.nosqlbench.agedepth.model.PosteriorDraw;
import io.nosqlbench.agedepth.sample.RandomSources;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JSON-serializable configuration of a calibration run.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Every field is optional; missing fields take the reference defaults.
 * <pre>{@code
 * {
 *   "iterations": 7500,
 *   "seed": 1,
 *   "algorithm": "xo_shi_ro_256_pp",
 *   "max_attempts": 50,
 *   "progress_interval": 500,
 *   "prior": {"a_mean": 817.0, "a_sigma": 5.0, "b_mean": 1.3, "b_sigma": 0.2},
 *   "start": {"a": 817.0, "b": 1.3, "sigma": 5.0},
 *   "sigma_upper": 10.0,
 *   "sigma_floor": 0.001,
 *   "max_evaluations": 10000,
 *   "constants": {
 *     "lithosphere_thickness": 125000.0,
 *     "mantle_density": 3330.0,
 *     "infill_density": 2300.0,
 *     "thermal_diffusivity": 1.0e-6,
 *     "mantle_temperature": 1333.0,
 *     "expansion_coefficient": 3.28e-5,
 *     "seconds_per_age_unit": 3.15576e13
 *   }
 * }
 * }</pre>
 *
 * <p>{@link #validate()} collects every problem at once; {@link #requireValid()}
 * reports them in a single {@link CalibrationConfigException} before any
 * iteration runs.
 *
 * @see AgeDepthGson
 */
public class CalibrationConfig {

    public static final int DEFAULT_ITERATIONS = 7500;
    public static final long DEFAULT_SEED = 1L;
    public static final int DEFAULT_MAX_ATTEMPTS = 50;
    public static final int DEFAULT_PROGRESS_INTERVAL = 500;

    @SerializedName("iterations")
    private Integer iterations;

    @SerializedName("seed")
    private Long seed;

    /** Name of a {@link RandomSources.Algorithm}, any case */
    @SerializedName("algorithm")
    private String algorithm;

    /** Attempts allowed per iteration before the run is aborted */
    @SerializedName("max_attempts")
    private Integer maxAttempts;

    /** Iterations between progress log lines; 0 disables them */
    @SerializedName("progress_interval")
    private Integer progressInterval;

    @SerializedName("prior")
    private PriorConfig prior;

    @SerializedName("start")
    private StartConfig start;

    @SerializedName("sigma_upper")
    private Double sigmaUpper;

    @SerializedName("sigma_floor")
    private Double sigmaFloor;

    @SerializedName("max_evaluations")
    private Integer maxEvaluations;

    @SerializedName("constants")
    private ConstantsConfig constants;

    public CalibrationConfig() {
    }

    /**
     * Prior on the curve parameters.
     */
    public static class PriorConfig {
        @SerializedName("a_mean")
        private Double aMean;

        @SerializedName("a_sigma")
        private Double aSigma;

        @SerializedName("b_mean")
        private Double bMean;

        @SerializedName("b_sigma")
        private Double bSigma;

        public PriorConfig() {
        }

        public PriorConfig(double aMean, double aSigma, double bMean, double bSigma) {
            this.aMean = aMean;
            this.aSigma = aSigma;
            this.bMean = bMean;
            this.bSigma = bSigma;
        }

        public ParameterPrior toPrior() {
            return new ParameterPrior(
                orDefault(aMean, ParameterPrior.DEFAULT_A_MEAN),
                orDefault(aSigma, ParameterPrior.DEFAULT_A_SIGMA),
                orDefault(bMean, ParameterPrior.DEFAULT_B_MEAN),
                orDefault(bSigma, ParameterPrior.DEFAULT_B_SIGMA));
        }
    }

    /**
     * Starting point of the mode search.
     */
    public static class StartConfig {
        @SerializedName("a")
        private Double a;

        @SerializedName("b")
        private Double b;

        @SerializedName("sigma")
        private Double sigma;

        public StartConfig() {
        }

        public StartConfig(double a, double b, double sigma) {
            this.a = a;
            this.b = b;
            this.sigma = sigma;
        }

        public PosteriorDraw toDraw() {
            PosteriorDraw defaults = FitSettings.DEFAULT_START;
            return new PosteriorDraw(
                orDefault(a, defaults.a()),
                orDefault(b, defaults.b()),
                orDefault(sigma, defaults.sigma()));
        }
    }

    /**
     * Lithospheric constants of the subsidence curve.
     */
    public static class ConstantsConfig {
        @SerializedName("lithosphere_thickness")
        private Double lithosphereThickness;

        @SerializedName("mantle_density")
        private Double mantleDensity;

        @SerializedName("infill_density")
        private Double infillDensity;

        @SerializedName("thermal_diffusivity")
        private Double thermalDiffusivity;

        @SerializedName("mantle_temperature")
        private Double mantleTemperature;

        @SerializedName("expansion_coefficient")
        private Double expansionCoefficient;

        @SerializedName("seconds_per_age_unit")
        private Double secondsPerAgeUnit;

        public ConstantsConfig() {
        }

        public ConstantsConfig setInfillDensity(double infillDensity) {
            this.infillDensity = infillDensity;
            return this;
        }

        public ConstantsConfig setLithosphereThickness(double lithosphereThickness) {
            this.lithosphereThickness = lithosphereThickness;
            return this;
        }

        public PhysicalConstants toConstants() {
            return new PhysicalConstants(
                orDefault(lithosphereThickness, PhysicalConstants.DEFAULT_LITHOSPHERE_THICKNESS),
                orDefault(mantleDensity, PhysicalConstants.DEFAULT_MANTLE_DENSITY),
                orDefault(infillDensity, PhysicalConstants.DEFAULT_INFILL_DENSITY),
                orDefault(thermalDiffusivity, PhysicalConstants.DEFAULT_THERMAL_DIFFUSIVITY),
                orDefault(mantleTemperature, PhysicalConstants.DEFAULT_MANTLE_TEMPERATURE),
                orDefault(expansionCoefficient, PhysicalConstants.DEFAULT_EXPANSION_COEFFICIENT),
                orDefault(secondsPerAgeUnit, PhysicalConstants.DEFAULT_SECONDS_PER_AGE_UNIT));
        }
    }

    public int getIterations() {
        return iterations != null ? iterations : DEFAULT_ITERATIONS;
    }

    public CalibrationConfig setIterations(int iterations) {
        this.iterations = iterations;
        return this;
    }

    public long getSeed() {
        return seed != null ? seed : DEFAULT_SEED;
    }

    public CalibrationConfig setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    /**
     * The random algorithm of the run.
     *
     * @return the configured algorithm, or {@link RandomSources.Algorithm#DEFAULT}
     * @throws IllegalArgumentException if the configured name is unknown
     */
    public RandomSources.Algorithm getAlgorithm() {
        return algorithm != null ? RandomSources.Algorithm.fromName(algorithm) : RandomSources.Algorithm.DEFAULT;
    }

    public CalibrationConfig setAlgorithm(RandomSources.Algorithm algorithm) {
        this.algorithm = algorithm.name().toLowerCase(Locale.ROOT);
        return this;
    }

    public int getMaxAttempts() {
        return maxAttempts != null ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
    }

    public CalibrationConfig setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
        return this;
    }

    public int getProgressInterval() {
        return progressInterval != null ? progressInterval : DEFAULT_PROGRESS_INTERVAL;
    }

    public CalibrationConfig setProgressInterval(int progressInterval) {
        this.progressInterval = progressInterval;
        return this;
    }

    public ParameterPrior getPrior() {
        return prior != null ? prior.toPrior() : ParameterPrior.defaults();
    }

    public CalibrationConfig setPrior(PriorConfig prior) {
        this.prior = prior;
        return this;
    }

    public CalibrationConfig setStart(StartConfig start) {
        this.start = start;
        return this;
    }

    public CalibrationConfig setSigmaUpper(double sigmaUpper) {
        this.sigmaUpper = sigmaUpper;
        return this;
    }

    public CalibrationConfig setConstants(ConstantsConfig constants) {
        this.constants = constants;
        return this;
    }

    public FitSettings getFitSettings() {
        return new FitSettings(
            start != null ? start.toDraw() : FitSettings.DEFAULT_START,
            orDefault(sigmaUpper, FitSettings.DEFAULT_SIGMA_UPPER),
            orDefault(sigmaFloor, FitSettings.DEFAULT_SIGMA_FLOOR),
            maxEvaluations != null ? maxEvaluations : FitSettings.DEFAULT_MAX_EVALUATIONS,
            FitSettings.DEFAULT_RELATIVE_TOLERANCE);
    }

    public PhysicalConstants getConstants() {
        return constants != null ? constants.toConstants() : PhysicalConstants.defaults();
    }

    /**
     * Lists every problem in this configuration.
     *
     * @return problem descriptions, empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (getIterations() < 1) {
            problems.add("iterations must be at least 1: " + getIterations());
        }
        try {
            getAlgorithm();
        } catch (IllegalArgumentException e) {
            problems.add("algorithm: " + e.getMessage());
        }
        if (getMaxAttempts() < 1) {
            problems.add("max_attempts must be at least 1: " + getMaxAttempts());
        }
        if (getProgressInterval() < 0) {
            problems.add("progress_interval must not be negative: " + getProgressInterval());
        }
        problems.addAll(getPrior().problems());
        problems.addAll(getFitSettings().problems());
        problems.addAll(getConstants().problems());
        return problems;
    }

    /**
     * Throws if {@link #validate()} finds any problem.
     *
     * @return this configuration
     * @throws CalibrationConfigException listing every problem
     */
    public CalibrationConfig requireValid() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            throw new CalibrationConfigException("calibration configuration", problems);
        }
        return this;
    }

    /**
     * Reads a configuration from JSON.
     *
     * @param reader the JSON source
     * @return the configuration; an empty document yields all defaults
     * @throws CalibrationConfigException if the JSON cannot be parsed
     */
    public static CalibrationConfig fromJson(Reader reader) {
        try {
            CalibrationConfig config = AgeDepthGson.gson().fromJson(reader, CalibrationConfig.class);
            return config != null ? config : new CalibrationConfig();
        } catch (JsonParseException e) {
            throw new CalibrationConfigException("calibration configuration", List.of("unreadable JSON: " + e.getMessage()));
        }
    }

    public static CalibrationConfig fromJson(String json) {
        try {
            CalibrationConfig config = AgeDepthGson.gson().fromJson(json, CalibrationConfig.class);
            return config != null ? config : new CalibrationConfig();
        } catch (JsonParseException e) {
            throw new CalibrationConfigException("calibration configuration", List.of("unreadable JSON: " + e.getMessage()));
        }
    }

    /**
     * Loads a configuration from a JSON file.
     *
     * @param path the file to read
     * @return the configuration
     * @throws IOException if the file cannot be read
     */
    public static CalibrationConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    /**
     * Writes this configuration to a JSON file.
     *
     * @param path the file to write
     * @throws IOException if the file cannot be written
     */
    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            AgeDepthGson.gson().toJson(this, writer);
        }
    }

    public String toJson() {
        return AgeDepthGson.gson().toJson(this);
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
