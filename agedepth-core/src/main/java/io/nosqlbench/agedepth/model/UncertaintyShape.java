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

import java.util.Locale;

/// Shape of the distribution a stratigraphic height uncertainty is drawn from.
///
/// The stored uncertainty is a one-sided 95% half-width. A [#GAUSSIAN] height
/// uses half of it as a standard deviation; a [#UNIFORM] height uses half of it
/// as the half-width of the support interval.
public enum UncertaintyShape {

    GAUSSIAN("normal"),
    UNIFORM("uniform");

    private final String tag;

    UncertaintyShape(String tag) {
        this.tag = tag;
    }

    /// Returns the tag written in observation tables for this shape.
    public String tag() {
        return tag;
    }

    /// Parses the `type` column of an observation table.
    ///
    /// `normal` and `gaussian` (any case) select [#GAUSSIAN]; every other value,
    /// including blank or missing tags, selects [#UNIFORM].
    ///
    /// @param tag the raw tag, may be null
    /// @return the parsed shape
    public static UncertaintyShape fromTag(String tag) {
        if (tag == null) {
            return UNIFORM;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("normal") || normalized.equals("gaussian")) {
            return GAUSSIAN;
        }
        return UNIFORM;
    }
}
