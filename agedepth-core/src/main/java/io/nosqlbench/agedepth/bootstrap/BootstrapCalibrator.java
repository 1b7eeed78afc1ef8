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

import io.nosqlbench.agedepth.CalibrationException;
import io.nosqlbench.agedepth.config.CalibrationConfig;
import io.nosqlbench.agedepth.filter.ScanDirection;
import io.nosqlbench.agedepth.filter.SuperpositionException;
import io.nosqlbench.agedepth.filter.SuperpositionFilter;
import io.nosqlbench.agedepth.fit.FitConvergenceException;
import io.nosqlbench.agedepth.fit.ParameterPrior;
import io.nosqlbench.agedepth.fit.QuadraticApproximationFitter;
import io.nosqlbench.agedepth.fit.QuadraticFit;
import io.nosqlbench.agedepth.model.CompositePosterior;
import io.nosqlbench.agedepth.model.ObservationSet;
import io.nosqlbench.agedepth.model.ResampledDraw;
import io.nosqlbench.agedepth.model.SubsidenceCurve;
import io.nosqlbench.agedepth.sample.RandomSources;
import io.nosqlbench.agedepth.sample.UncertaintySampler;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/// Runs the bootstrap-and-refit loop that builds the composite posterior.
///
/// ## Iteration
///
/// ```text
/// prior ──┐
///         ▼
/// ┌──────────────┐   ┌──────────────────┐   ┌──────────────────┐
/// │ resample all │──▶│ superposition    │──▶│ quadratic fit,   │──▶ draw ──▶ posterior
/// │ observations │   │ filter (parity)  │   │ one sample       │      │
/// └──────────────┘   └──────────────────┘   └──────────────────┘      │
///         ▲                                                            │
///         └──────────────── prior means drift to the draw ◀────────────┘
/// ```
///
/// Iterations are numbered from 1; odd iterations scan upward, even ones
/// downward (see [ScanDirection#forIteration(int)]).
///
/// ## Failures
///
/// An attempt that leaves too few points after filtering, or whose fit does
/// not converge, is repeated with fresh resampling under the same iteration
/// number and the same prior. Once `max_attempts` attempts have failed the
/// last failure is rethrown and no partial posterior is returned.
///
/// ## Reproducibility
///
/// One generator seeded from the configuration drives every random choice,
/// in a fixed order: ages, heights, then the fitter's normals. Equal seeds
/// and inputs give identical posteriors.
public final class BootstrapCalibrator {

    private static final Logger logger = LogManager.getLogger(BootstrapCalibrator.class);

    private final ObservationSet observations;
    private final CalibrationConfig config;
    private final SubsidenceCurve curve;
    private final SuperpositionFilter filter;
    private final QuadraticApproximationFitter fitter;

    /// Creates a calibrator after validating the configuration.
    ///
    /// @param observations the dated section
    /// @param config run settings
    /// @throws io.nosqlbench.agedepth.model.CalibrationConfigException if the configuration is unusable
    public BootstrapCalibrator(ObservationSet observations, CalibrationConfig config) {
        this.observations = Objects.requireNonNull(observations, "observations cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null").requireValid();
        this.curve = new SubsidenceCurve(config.getConstants());
        this.filter = new SuperpositionFilter();
        this.fitter = new QuadraticApproximationFitter(curve, config.getFitSettings());
    }

    public SubsidenceCurve curve() {
        return curve;
    }

    public CalibrationConfig config() {
        return config;
    }

    /// Runs every iteration.
    ///
    /// @return the composite posterior with diagnostics
    /// @throws SuperpositionException if an iteration exhausts its attempts in the filter
    /// @throws FitConvergenceException if an iteration exhausts its attempts in the fitter
    public CalibrationResult run() {
        int iterations = config.getIterations();
        int maxAttempts = config.getMaxAttempts();
        int progressInterval = config.getProgressInterval();
        long seed = config.getSeed();

        UniformRandomProvider rng = RandomSources.create(config.getAlgorithm(), seed);
        UncertaintySampler sampler = new UncertaintySampler(rng);
        BootstrapDiagnostics.Accumulator diagnostics = new BootstrapDiagnostics.Accumulator();
        CompositePosterior.Builder posterior = CompositePosterior.builder(iterations);
        ParameterPrior prior = config.getPrior();

        logger.info("Calibrating {} observations over {} iterations (seed {}, {}, {})",
            observations.size(), iterations, seed, config.getAlgorithm(), curve.constants());

        for (int iteration = 1; iteration <= iterations; iteration++) {
            QuadraticFit fit = null;
            int filteredLength = 0;
            for (int attempt = 1; fit == null; attempt++) {
                diagnostics.attempt();
                try {
                    List<ResampledDraw> draws = sampler.resample(observations);
                    List<ResampledDraw> kept = filter.filter(draws, iteration);
                    fit = fitter.fit(kept, prior, rng, iteration);
                    filteredLength = kept.size();
                } catch (SuperpositionException e) {
                    diagnostics.superpositionFailure();
                    retryOrAbort(e, iteration, attempt, maxAttempts);
                } catch (FitConvergenceException e) {
                    diagnostics.fitFailure();
                    retryOrAbort(e, iteration, attempt, maxAttempts);
                }
            }

            posterior.append(fit.draw());
            prior = prior.driftTo(fit.draw());
            diagnostics.accepted(filteredLength, fit.evaluations());

            if (progressInterval > 0 && iteration % progressInterval == 0) {
                logger.info("Iteration {}/{}: {} points kept scanning {}, draw {}, {} retries so far",
                    iteration, iterations, filteredLength,
                    ScanDirection.forIteration(iteration).name().toLowerCase(),
                    fit.draw(), diagnostics.retries());
            }
        }

        BootstrapDiagnostics summary = diagnostics.snapshot();
        logger.info("Calibration finished: {} iterations, {} retries, {} ms",
            summary.iterations(), summary.retries(), summary.elapsedMillis());
        return new CalibrationResult(posterior.build(), summary, prior, seed);
    }

    private static void retryOrAbort(CalibrationException failure, int iteration, int attempt, int maxAttempts) {
        if (attempt >= maxAttempts) {
            failure.abortedAfter(attempt);
            logger.error("Aborting calibration: {}", failure.getMessage());
            throw failure;
        }
        logger.debug("Iteration {} attempt {} rejected: {}", iteration, attempt, failure.getMessage());
    }
}
