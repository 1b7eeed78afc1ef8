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

import java.util.List;

/// Thrown before a calibration starts when its inputs are unusable.
///
/// All problems found in the observation table, the configuration or the query
/// heights are gathered into one exception so they can be fixed together.
public class CalibrationConfigException extends IllegalArgumentException {

    private final List<String> problems;

    public CalibrationConfigException(String subject, List<String> problems) {
        super(String.format("Invalid %s (%d problem%s):%n  - %s",
            subject, problems.size(), problems.size() == 1 ? "" : "s",
            String.join(System.lineSeparator() + "  - ", problems)));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
