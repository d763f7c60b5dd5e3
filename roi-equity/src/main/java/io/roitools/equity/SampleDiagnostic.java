package io.roitools.equity;

/*
 * Copyright (c) roitools
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

/// A non-fatal observation about a [GroupedSample], recorded at construction and
/// logged at WARN level. Diagnostics never stop a calculation.
///
/// @param kind what was observed
/// @param group the affected group label, or `null` when the diagnostic concerns the whole sample
/// @param message a human-readable description
public record SampleDiagnostic(Kind kind, String group, String message) {

    /// Categories of diagnostics.
    public enum Kind {
        /// NaN values are present; every reduction excludes them, which can bias
        /// results when values are not missing at random.
        MISSING_VALUES,
        /// A group has fewer observed values than the configured minimum group size.
        SMALL_GROUP,
        /// A group has no observed values at all; every index is undefined for it.
        EMPTY_GROUP
    }
}
