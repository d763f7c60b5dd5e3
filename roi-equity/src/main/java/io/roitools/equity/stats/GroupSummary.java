package io.roitools.equity.stats;

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

/// Descriptive statistics for one group of a [io.roitools.equity.GroupedSample].
///
/// All statistics exclude NaN entries; `n` counts observed values only and
/// `nanCount` reports how many were skipped. `sd` is the population standard
/// deviation, consistent with the variance decomposition.
///
/// @param group the group label
/// @param n number of observed (non-NaN) values
/// @param nanCount number of missing values
/// @param mean arithmetic mean
/// @param median middle value
/// @param sd population standard deviation
/// @param min smallest observed value
/// @param max largest observed value
public record GroupSummary(
    String group,
    int n,
    int nanCount,
    double mean,
    double median,
    double sd,
    double min,
    double max
) {

    /// Computes the summary of one group's raw values.
    ///
    /// @param group the group label
    /// @param values the group's values, NaN marking missing entries
    /// @return the computed summary
    public static GroupSummary of(String group, double[] values) {
        return new GroupSummary(
            group,
            NanStats.count(values),
            NanStats.nanCount(values),
            NanStats.mean(values),
            NanStats.median(values),
            NanStats.populationStdDev(values),
            NanStats.min(values),
            NanStats.max(values)
        );
    }

    @Override
    public String toString() {
        return String.format("GroupSummary[%s, n=%d, mean=%.4f, median=%.4f, sd=%.4f, range=[%.4f, %.4f]]",
            group, n, mean, median, sd, min, max);
    }
}
