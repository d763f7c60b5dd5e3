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

import io.roitools.equity.config.EquityConfig;
import io.roitools.equity.measures.VarianceDecomposition;
import io.roitools.equity.stats.NanStats;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Entry points for building metrics by [MetricKind].
///
/// Every call returns new instances; nothing is cached or shared between them.
public final class Metrics {

    private Metrics() {}

    /// @return a new, uncalculated metric
    public static InequalityMetric of(MetricKind kind, GroupedSample sample) {
        Objects.requireNonNull(kind, "kind cannot be null");
        return kind.create(sample);
    }

    /// @return a new, uncalculated metric with the configured residual tolerance applied
    public static InequalityMetric of(MetricKind kind, GroupedSample sample, EquityConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        if (kind == MetricKind.VARIANCE) {
            return new VarianceDecomposition(sample, config.validate().getResidualTolerance());
        }
        return of(kind, sample);
    }

    /// Builds and calculates every applicable index over one sample. The Theil indices
    /// are skipped when the sample holds non-positive values, rather than failing the
    /// whole batch.
    ///
    /// @return calculated metrics in [MetricKind] order
    /// @throws DomainException if a remaining index rejects the sample
    public static List<InequalityMetric> calculateApplicable(GroupedSample sample) {
        Set<MetricKind> kinds = EnumSet.allOf(MetricKind.class);
        if (NanStats.countNonPositive(sample.flat()) > 0) {
            kinds.removeIf(MetricKind::requiresPositiveValues);
        }
        List<InequalityMetric> metrics = new ArrayList<>(kinds.size());
        for (MetricKind kind : kinds) {
            InequalityMetric metric = of(kind, sample);
            metric.calculate();
            metrics.add(metric);
        }
        return metrics;
    }
}
