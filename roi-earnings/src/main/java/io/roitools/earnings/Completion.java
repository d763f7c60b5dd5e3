package io.roitools.earnings;

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

import io.roitools.equity.GroupedSample;
import io.roitools.equity.stats.GroupSummary;

import java.util.List;
import java.util.Objects;

/// # Completion
///
/// Completion rates and time to completion per program.
///
/// - **Completion rate**: each enrollment counts 1 when completed and 0 otherwise,
///   so the group mean is the program's completion rate.
/// - **Time to completion**: years from entry to exit, counted for completers only.
///   Non-completers are carried as missing values, so every program keeps a row and
///   the summary's `nanCount` is its number of non-completers.
///
/// Programs are listed in order of first occurrence.
public final class Completion {

    private final List<Enrollment> enrollments;

    public Completion(List<Enrollment> enrollments) {
        this.enrollments = List.copyOf(Objects.requireNonNull(enrollments, "enrollments cannot be null"));
    }

    /// @return 1/0 completion indicators grouped by program
    public GroupedSample completionIndicators() {
        return ProgramGroups.sample(enrollments, Enrollment::program, e -> e.completed() ? 1.0 : 0.0);
    }

    /// @return one summary per program; `mean` is the completion rate
    public List<GroupSummary> completionRates() {
        return ProgramGroups.summarize(enrollments, Enrollment::program, e -> e.completed() ? 1.0 : 0.0);
    }

    /// @return years to completion grouped by program, NaN for non-completers
    public GroupedSample yearsToCompletion() {
        return ProgramGroups.sample(enrollments, Enrollment::program, Completion::yearsToCompletion);
    }

    /// @return one summary per program of the years to completion of its completers
    public List<GroupSummary> timeToCompletion() {
        return ProgramGroups.summarize(enrollments, Enrollment::program, Completion::yearsToCompletion);
    }

    public List<Enrollment> enrollments() {
        return enrollments;
    }

    private static double yearsToCompletion(Enrollment enrollment) {
        return enrollment.completed() ? enrollment.yearsEnrolled() : Double.NaN;
    }
}
