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

import java.util.ArrayList;
import java.util.List;

/// Lithospheric constants of the thermal-subsidence model and the two scalars
/// derived from them.
///
/// ## Derived scalars
///
/// ```text
///   E0  = 4 · a · ρm · α · Tm / (π² · (ρm − ρi))     subsidence correction (m)
///   tau = a² / (π² · κ)                              thermal decay time (s)
/// ```
///
/// | Symbol | Accessor | Default |
/// |--------|----------|---------|
/// | a  | [#lithosphereThickness()] | 125 000 m |
/// | ρm | [#mantleDensity()] | 3 330 kg/m³ |
/// | ρi | [#infillDensity()] | 2 300 kg/m³ |
/// | κ  | [#thermalDiffusivity()] | 1.0e-6 m²/s |
/// | Tm | [#mantleTemperature()] | 1 333 °C |
/// | α  | [#expansionCoefficient()] | 3.28e-5 1/°C |
/// | T  | [#secondsPerAgeUnit()] | 3.15576e13 s per Ma |
///
/// The derived values are computed once in the constructor.
public final class PhysicalConstants {

    public static final double DEFAULT_LITHOSPHERE_THICKNESS = 125_000.0;
    public static final double DEFAULT_MANTLE_DENSITY = 3_330.0;
    public static final double DEFAULT_INFILL_DENSITY = 2_300.0;
    public static final double DEFAULT_THERMAL_DIFFUSIVITY = 1.0e-6;
    public static final double DEFAULT_MANTLE_TEMPERATURE = 1_333.0;
    public static final double DEFAULT_EXPANSION_COEFFICIENT = 3.28e-5;
    /// Seconds in one million Julian years.
    public static final double DEFAULT_SECONDS_PER_AGE_UNIT = 3.15576e13;

    private final double lithosphereThickness;
    private final double mantleDensity;
    private final double infillDensity;
    private final double thermalDiffusivity;
    private final double mantleTemperature;
    private final double expansionCoefficient;
    private final double secondsPerAgeUnit;

    private final double subsidenceCorrection;
    private final double thermalDecayTime;

    public PhysicalConstants(double lithosphereThickness, double mantleDensity, double infillDensity,
                             double thermalDiffusivity, double mantleTemperature,
                             double expansionCoefficient, double secondsPerAgeUnit) {
        this.lithosphereThickness = lithosphereThickness;
        this.mantleDensity = mantleDensity;
        this.infillDensity = infillDensity;
        this.thermalDiffusivity = thermalDiffusivity;
        this.mantleTemperature = mantleTemperature;
        this.expansionCoefficient = expansionCoefficient;
        this.secondsPerAgeUnit = secondsPerAgeUnit;

        double pi2 = Math.PI * Math.PI;
        this.subsidenceCorrection = 4.0 * lithosphereThickness * mantleDensity * expansionCoefficient
            * mantleTemperature / (pi2 * (mantleDensity - infillDensity));
        this.thermalDecayTime = lithosphereThickness * lithosphereThickness / (pi2 * thermalDiffusivity);
    }

    public static PhysicalConstants defaults() {
        return new PhysicalConstants(
            DEFAULT_LITHOSPHERE_THICKNESS,
            DEFAULT_MANTLE_DENSITY,
            DEFAULT_INFILL_DENSITY,
            DEFAULT_THERMAL_DIFFUSIVITY,
            DEFAULT_MANTLE_TEMPERATURE,
            DEFAULT_EXPANSION_COEFFICIENT,
            DEFAULT_SECONDS_PER_AGE_UNIT);
    }

    public double lithosphereThickness() {
        return lithosphereThickness;
    }

    public double mantleDensity() {
        return mantleDensity;
    }

    public double infillDensity() {
        return infillDensity;
    }

    public double thermalDiffusivity() {
        return thermalDiffusivity;
    }

    public double mantleTemperature() {
        return mantleTemperature;
    }

    public double expansionCoefficient() {
        return expansionCoefficient;
    }

    public double secondsPerAgeUnit() {
        return secondsPerAgeUnit;
    }

    /// The subsidence correction constant E0, in height units.
    public double subsidenceCorrection() {
        return subsidenceCorrection;
    }

    /// The thermal decay time constant tau, in seconds.
    public double thermalDecayTime() {
        return thermalDecayTime;
    }

    /// The thermal decay time constant expressed in age units (tau / T).
    public double thermalDecayAge() {
        return thermalDecayTime / secondsPerAgeUnit;
    }

    /// Lists every constant that would make the derived scalars meaningless.
    ///
    /// @return problem descriptions, empty when usable
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        requirePositive(problems, "lithosphere_thickness", lithosphereThickness);
        requirePositive(problems, "mantle_density", mantleDensity);
        requirePositive(problems, "infill_density", infillDensity);
        requirePositive(problems, "thermal_diffusivity", thermalDiffusivity);
        requirePositive(problems, "mantle_temperature", mantleTemperature);
        requirePositive(problems, "expansion_coefficient", expansionCoefficient);
        requirePositive(problems, "seconds_per_age_unit", secondsPerAgeUnit);
        if (!(mantleDensity > infillDensity)) {
            problems.add("mantle_density (" + mantleDensity + ") must exceed infill_density (" + infillDensity + ")");
        }
        return problems;
    }

    private static void requirePositive(List<String> problems, String name, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            problems.add(name + " must be finite and positive: " + value);
        }
    }

    @Override
    public String toString() {
        return String.format("PhysicalConstants{E0=%.3f, tau=%.6g s (%.3f age units)}",
            subsidenceCorrection, thermalDecayTime, thermalDecayAge());
    }
}
