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

import io.roitools.equity.stats.NanStats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// # GroupedSample
///
/// Immutable holder of numeric observations partitioned into labeled groups.
///
/// ## Structure
/// - **groups**: ordered, unique group labels
/// - **grouped values**: one `double[]` per label, in the same order; `NaN` marks a
///   missing observation
///
/// Derived once at construction: the order-preserving concatenation ([#flat()]),
/// the total count ([#n()], missing values included), the group count and the
/// number of missing values.
///
/// ## Immutability
/// Value arrays are copied on the way in and on the way out. No operation in this
/// package mutates a sample, so one sample can back any number of metrics.
///
/// ## Diagnostics
/// Missing values, groups smaller than the minimum group size, and groups with no
/// observed values are recorded as [SampleDiagnostic]s and logged. They are never
/// raised as errors here; the metrics decide whether an empty group is fatal.
///
/// ```java
/// GroupedSample sample = GroupedSample.builder()
///     .group("A", 3, 3, 3)
///     .group("B", 1, 2, 6)
///     .build();
/// ```
public final class GroupedSample {

    private static final Logger logger = LogManager.getLogger(GroupedSample.class);

    /// Minimum number of observed values per group below which a
    /// [SampleDiagnostic.Kind#SMALL_GROUP] diagnostic is recorded.
    public static final int DEFAULT_MIN_GROUP_SIZE = 30;

    private final List<String> groups;
    private final List<double[]> groupedValues;
    private final double[] flat;
    private final int nanCount;
    private final int minGroupSize;
    private final List<SampleDiagnostic> diagnostics;

    /// Creates a sample with the default minimum group size.
    ///
    /// @param groups ordered unique group labels
    /// @param groupedValues one array of observations per label
    /// @throws ConstructionException if the lists differ in length, a label repeats,
    ///     a value array is null, or no groups are given
    public GroupedSample(List<String> groups, List<double[]> groupedValues) {
        this(groups, groupedValues, DEFAULT_MIN_GROUP_SIZE);
    }

    /// Creates a sample.
    ///
    /// @param groups ordered unique group labels
    /// @param groupedValues one array of observations per label
    /// @param minGroupSize groups with fewer observed values are flagged; 0 disables the check
    /// @throws ConstructionException if the lists differ in length, a label repeats,
    ///     a value array is null, or no groups are given
    /// @throws ConfigurationException if `minGroupSize` is negative
    public GroupedSample(List<String> groups, List<double[]> groupedValues, int minGroupSize) {
        Objects.requireNonNull(groups, "groups cannot be null");
        Objects.requireNonNull(groupedValues, "groupedValues cannot be null");
        if (groups.size() != groupedValues.size()) {
            throw new ConstructionException(
                "groups and grouped values must have the same length: " +
                groups.size() + " labels vs " + groupedValues.size() + " value arrays");
        }
        if (groups.isEmpty()) {
            throw new ConstructionException("at least one group is required");
        }
        if (minGroupSize < 0) {
            throw new ConfigurationException("minGroupSize must be >= 0, was " + minGroupSize);
        }

        Set<String> seen = new HashSet<>();
        List<double[]> copies = new ArrayList<>(groupedValues.size());
        int total = 0;
        for (int i = 0; i < groups.size(); i++) {
            String label = groups.get(i);
            if (label == null) {
                throw new ConstructionException("group label at index " + i + " is null");
            }
            if (!seen.add(label)) {
                throw new ConstructionException("duplicate group label: " + label);
            }
            double[] values = groupedValues.get(i);
            if (values == null) {
                throw new ConstructionException("values for group '" + label + "' are null");
            }
            copies.add(values.clone());
            total += values.length;
        }

        this.groups = List.copyOf(groups);
        this.groupedValues = Collections.unmodifiableList(copies);
        this.minGroupSize = minGroupSize;

        this.flat = new double[total];
        int offset = 0;
        for (double[] values : copies) {
            System.arraycopy(values, 0, flat, offset, values.length);
            offset += values.length;
        }
        this.nanCount = NanStats.nanCount(flat);
        this.diagnostics = List.copyOf(diagnose());
        for (SampleDiagnostic diagnostic : diagnostics) {
            logger.warn(diagnostic.message());
        }
    }

    /// Creates a sample from parallel arrays.
    public static GroupedSample of(String[] groups, double[][] groupedValues) {
        Objects.requireNonNull(groups, "groups cannot be null");
        Objects.requireNonNull(groupedValues, "groupedValues cannot be null");
        return new GroupedSample(Arrays.asList(groups), Arrays.asList(groupedValues));
    }

    /// Creates a sample with one group spanning every observation.
    public static GroupedSample single(String group, double... values) {
        return new GroupedSample(List.of(group), Collections.singletonList(values));
    }

    /// @return a builder that adds groups in call order
    public static Builder builder() {
        return new Builder();
    }

    private List<SampleDiagnostic> diagnose() {
        List<SampleDiagnostic> found = new ArrayList<>();
        if (nanCount > 0) {
            found.add(new SampleDiagnostic(SampleDiagnostic.Kind.MISSING_VALUES, null,
                nanCount + " of " + flat.length + " observations are NaN and will be excluded from every " +
                "reduction; results may be biased if values are not missing at random"));
        }
        for (int i = 0; i < groups.size(); i++) {
            int observed = NanStats.count(groupedValues.get(i));
            String label = groups.get(i);
            if (observed == 0) {
                found.add(new SampleDiagnostic(SampleDiagnostic.Kind.EMPTY_GROUP, label,
                    "group '" + label + "' has no observed values"));
            } else if (observed < minGroupSize) {
                found.add(new SampleDiagnostic(SampleDiagnostic.Kind.SMALL_GROUP, label,
                    "group '" + label + "' has " + observed + " observed values, fewer than " + minGroupSize));
            }
        }
        return found;
    }

    /// @return the ordered group labels
    public List<String> groups() {
        return groups;
    }

    /// @return copies of every group's values, in group order
    public List<double[]> groupedValues() {
        List<double[]> out = new ArrayList<>(groupedValues.size());
        for (double[] values : groupedValues) {
            out.add(values.clone());
        }
        return out;
    }

    /// @param groupIndex position of the group
    /// @return a copy of that group's values, NaN included
    public double[] values(int groupIndex) {
        return groupedValues.get(groupIndex).clone();
    }

    /// @param group a group label
    /// @return a copy of that group's values, or empty if the label is unknown
    public Optional<double[]> values(String group) {
        int index = groups.indexOf(group);
        return index < 0 ? Optional.empty() : Optional.of(values(index));
    }

    /// @param groupIndex position of the group
    /// @return that group's non-NaN values, in order
    public double[] observedValues(int groupIndex) {
        return NanStats.observed(groupedValues.get(groupIndex));
    }

    /// @return every group's non-NaN values, in group order
    public List<double[]> observedGroups() {
        List<double[]> out = new ArrayList<>(groupedValues.size());
        for (double[] values : groupedValues) {
            out.add(NanStats.observed(values));
        }
        return out;
    }

    /// @return a copy of the concatenation of all groups, NaN included
    public double[] flat() {
        return flat.clone();
    }

    /// @return the non-NaN values of the concatenation, in order
    public double[] observedFlat() {
        return NanStats.observed(flat);
    }

    /// @return total number of observations, NaN included
    public int n() {
        return flat.length;
    }

    /// @return number of observed (non-NaN) values
    public int observedCount() {
        return flat.length - nanCount;
    }

    public int groupCount() {
        return groups.size();
    }

    public int nanCount() {
        return nanCount;
    }

    public boolean hasMissingValues() {
        return nanCount > 0;
    }

    public int minGroupSize() {
        return minGroupSize;
    }

    /// @return the non-fatal diagnostics found at construction
    public List<SampleDiagnostic> diagnostics() {
        return diagnostics;
    }

    /// @return true if any group has no observed values
    public boolean hasEmptyGroup() {
        return diagnostics.stream().anyMatch(d -> d.kind() == SampleDiagnostic.Kind.EMPTY_GROUP);
    }

    @Override
    public String toString() {
        return String.format("GroupedSample[groups=%d, n=%d, nan=%d]", groups.size(), flat.length, nanCount);
    }

    /// Collects groups in insertion order.
    public static final class Builder {
        private final List<String> groups = new ArrayList<>();
        private final List<double[]> values = new ArrayList<>();
        private int minGroupSize = DEFAULT_MIN_GROUP_SIZE;

        private Builder() {}

        public Builder group(String label, double... groupValues) {
            groups.add(label);
            values.add(groupValues);
            return this;
        }

        public Builder minGroupSize(int minGroupSize) {
            this.minGroupSize = minGroupSize;
            return this;
        }

        public GroupedSample build() {
            return new GroupedSample(groups, values, minGroupSize);
        }
    }
}
