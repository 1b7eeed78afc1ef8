package io.nosqlbench.agedepth.fit;

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

import io.nosqlbench.agedepth.model.PhysicalConstants;
import io.nosqlbench.agedepth.model.PosteriorDraw;
import io.nosqlbench.agedepth.model.ResampledDraw;
import io.nosqlbench.agedepth.model.SubsidenceCurve;
import io.nosqlbench.agedepth.sample.RandomSources;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class QuadraticApproximationFitterTest {

    private static final List<ResampledDraw> SECTION = List.of(
        new ResampledDraw(0, 820),
        new ResampledDraw(500, 750),
        new ResampledDraw(1000, 700),
        new ResampledDraw(1500, 650),
        new ResampledDraw(2000, 600));

    private final SubsidenceCurve curve = new SubsidenceCurve(PhysicalConstants.defaults());
    private final QuadraticApproximationFitter fitter = new QuadraticApproximationFitter(curve, FitSettings.defaults());

    @Test
    void testFiveOrderedPoints() {
        QuadraticFit fit = fitter.fit(SECTION, ParameterPrior.defaults(), RandomSources.create(1L), 1);

        PosteriorDraw mode = fit.mode();
        assertTrue(mode.a() > 780 && mode.a() < 797, "a = " + mode.a());
        // just above the stretch at which 2000 reaches the subsidence limit
        assertTrue(mode.b() > 1.306 && mode.b() < 1.33, "b = " + mode.b());
        // the curve cannot bend to a straight section, so residuals exceed the sigma bound
        assertEquals(FitSettings.DEFAULT_SIGMA_UPPER, mode.sigma(), 1e-9);

        assertEquals(5, fit.pointCount());
        assertTrue(fit.evaluations() > 0);
        assertTrue(Double.isFinite(fit.logPosterior()));

        double[][] covariance = fit.covariance();
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                assertEquals(covariance[i][j], covariance[j][i], 1e-9 * Math.abs(covariance[i][i] + covariance[j][j]));
            }
        }
        assertTrue(fit.standardError(0) > 1.0 && fit.standardError(0) < 5.0, "se(a) = " + fit.standardError(0));
        assertTrue(fit.standardError(1) > 0 && fit.standardError(1) < 0.01, "se(b) = " + fit.standardError(1));

        PosteriorDraw draw = fit.draw();
        assertTrue(Double.isFinite(draw.a()) && Double.isFinite(draw.b()) && Double.isFinite(draw.sigma()));
        assertTrue(Math.abs(draw.b() - mode.b()) < 6 * fit.standardError(1));
        // sigma on its upper bound is held there, never drawn past it
        assertEquals(FitSettings.DEFAULT_SIGMA_UPPER, draw.sigma(), 0.0);
        assertEquals(0.0, covariance[2][2], 0.0);
    }

    @Test
    void testSigmaOnUpperBoundNeverLeavesSupport() {
        UniformRandomProvider rng = RandomSources.create(1L);
        for (int i = 0; i < 500; i++) {
            PosteriorDraw draw = fitter.fit(SECTION, ParameterPrior.defaults(), rng, i + 1).draw();
            assertTrue(draw.sigma() > 0 && draw.sigma() <= FitSettings.DEFAULT_SIGMA_UPPER, "sigma = " + draw.sigma());
        }
    }

    @Test
    void testTwoPointsAreEnough() {
        List<ResampledDraw> points = List.of(new ResampledDraw(0, 820), new ResampledDraw(1000, 700));
        QuadraticFit fit = fitter.fit(points, ParameterPrior.defaults(), RandomSources.create(2L));

        PosteriorDraw mode = fit.mode();
        // two points, two curve parameters: an exact fit with sigma at its floor
        assertEquals(820.0, mode.ageAt(curve, 0), 0.5);
        assertEquals(700.0, mode.ageAt(curve, 1000), 0.5);
        assertEquals(FitSettings.DEFAULT_SIGMA_FLOOR, mode.sigma(), 0.0);
        assertEquals(FitSettings.DEFAULT_SIGMA_FLOOR, fit.draw().sigma(), 0.0);
        assertEquals(0.0, fit.covariance()[2][2], 0.0);
        assertTrue(Double.isFinite(fit.draw().ageAt(curve, 1000)));
    }

    @Test
    void testSameRandomSourceSameDraw() {
        QuadraticFit first = fitter.fit(SECTION, ParameterPrior.defaults(), RandomSources.create(9L), 1);
        QuadraticFit second = fitter.fit(SECTION, ParameterPrior.defaults(), RandomSources.create(9L), 1);
        assertEquals(first.mode(), second.mode());
        assertEquals(first.draw(), second.draw());
    }

    @Test
    void testPriorPullsIntercept() {
        ParameterPrior low = new ParameterPrior(770.0, 5.0, 1.3, 0.2);
        ParameterPrior high = new ParameterPrior(830.0, 5.0, 1.3, 0.2);
        double aLow = fitter.fit(SECTION, low, RandomSources.create(3L)).mode().a();
        double aHigh = fitter.fit(SECTION, high, RandomSources.create(3L)).mode().a();
        assertTrue(aLow < aHigh, aLow + " vs " + aHigh);
    }

    @Test
    void testSectionAboveSubsidenceLimitFails() {
        List<ResampledDraw> points = List.of(new ResampledDraw(0, 820), new ResampledDraw(8000, 500));
        FitConvergenceException failure = assertThrows(FitConvergenceException.class,
            () -> fitter.fit(points, ParameterPrior.defaults(), RandomSources.create(4L), 17));
        assertEquals(17, failure.getIteration());
        assertTrue(failure.getMessage().startsWith("Iteration 17:"), failure.getMessage());
    }

    @Test
    void testSinglePointRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> fitter.fit(List.of(new ResampledDraw(0, 820)), ParameterPrior.defaults(), RandomSources.create(5L)));
    }

    @Test
    void testLogPosteriorSupport() {
        LogPosterior posterior = new LogPosterior(curve, SECTION, ParameterPrior.defaults(), 10.0);
        assertEquals(5, posterior.pointCount());

        assertTrue(Double.isFinite(posterior.value(new double[]{790, 1.32, 10.0})));
        assertEquals(Double.NEGATIVE_INFINITY, posterior.value(new double[]{790, 1.32, 10.5}));
        assertEquals(Double.NEGATIVE_INFINITY, posterior.value(new double[]{790, 1.32, 0.0}));
        // undefined at 2000 for this stretch
        assertEquals(Double.NEGATIVE_INFINITY, posterior.value(new double[]{790, 1.3, 5.0}));
        assertFalse(posterior.curveDefined(790, 1.3));
        assertTrue(posterior.curveDefined(790, 1.32));

        // smooth() ignores the uniform bound
        double[] outside = {790, 1.32, 10.5};
        assertTrue(Double.isFinite(posterior.smooth(outside)));
        assertEquals(posterior.smooth(new double[]{790, 1.32, 5.0}) - Math.log(10.0),
            posterior.value(new double[]{790, 1.32, 5.0}), 1e-9);
    }

    @Test
    void testPriorDrift() {
        ParameterPrior prior = ParameterPrior.defaults();
        ParameterPrior drifted = prior.driftTo(new PosteriorDraw(790.0, 1.35, 9.0));
        assertEquals(new ParameterPrior(790.0, 5.0, 1.35, 0.2), drifted);
        assertTrue(new ParameterPrior(817, 0, 1.3, -1).problems().size() >= 2);
    }
}
