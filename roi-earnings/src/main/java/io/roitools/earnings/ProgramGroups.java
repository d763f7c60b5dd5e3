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

import io.roitools.equity.ConstructionException;
import io.roitools.equity.GroupedSample;
import io.roitools.equity.stats.GroupSummaries;
import io.roitools.equity.stats.GroupSummary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/// Groups per-individual outcomes into a [GroupedSample], groups ordered by first
/// occurrence of their label.
final class ProgramGroups {

    private ProgramGroups() {}

    /// @param labels one group label per value
    /// @param values the values, NaN where unknown
    static GroupedSample sample(List<String> labels, double[] values) {
        Objects.requireNonNull(labels, "labels cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (labels.size() != values.length) {
            throw new ConstructionException(
                "labels and values must have the same length: " + labels.size() + " vs " + values.length);
        }
        Map<String, List<Double>> grouped = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            grouped.computeIfAbsent(labels.get(i), k -> new ArrayList<>()).add(values[i]);
        }
        List<double[]> groupValues = new ArrayList<>(grouped.size());
        for (List<Double> list : grouped.values()) {
            groupValues.add(list.stream().mapToDouble(Double::doubleValue).toArray());
        }
        return new GroupedSample(new ArrayList<>(grouped.keySet()), groupValues);
    }

    static <T> GroupedSample sample(List<T> items, Function<? super T, String> grouping,
                                    ToDoubleFunction<? super T> value) {
        List<String> labels = new ArrayList<>(items.size());
        double[] values = new double[items.size()];
        for (int i = 0; i < items.size(); i++) {
            labels.add(grouping.apply(items.get(i)));
            values[i] = value.applyAsDouble(items.get(i));
        }
        return sample(labels, values);
    }

    /// @return one summary per group, empty when there are no items
    static <T> List<GroupSummary> summarize(List<T> items, Function<? super T, String> grouping,
                                            ToDoubleFunction<? super T> value) {
        if (items.isEmpty()) {
            return List.of();
        }
        return GroupSummaries.summarize(sample(items, grouping, value));
    }

    /// @return 1 for true, 0 for false, NaN for unknown
    static double indicator(Boolean flag) {
        if (flag == null) {
            return Double.NaN;
        }
        return flag ? 1.0 : 0.0;
    }
}
