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
import io.roitools.equity.measures.GiniDecomposition;
import io.roitools.equity.measures.ThielT;
import io.roitools.equity.measures.VarianceDecomposition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/// Lifecycle and shared-contract tests run against every index.
public class MetricsTest {

    private static final GroupedSample POSITIVE = GroupedSample.builder()
        .group("A", 1, 2, 3)
        .group("B", 10, 20, 30)
        .build();

    @ParameterizedTest
    @EnumSource(MetricKind.class)
    void resultIsUnavailableBeforeCalculate(MetricKind kind) {
        InequalityMetric metric = Metrics.of(kind, POSITIVE);

        assertThat(metric.isCalculated()).isFalse();
        assertThat(metric.mnemonic()).isEqualTo(kind.mnemonic());
        assertThatThrownBy(metric::within).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(metric::result).isInstanceOf(IllegalStateException.class);
    }

    @ParameterizedTest
    @EnumSource(MetricKind.class)
    void calculateIsRepeatable(MetricKind kind) {
        InequalityMetric metric = Metrics.of(kind, POSITIVE);
        Decomposition first = metric.calculate();
        Decomposition second = metric.calculate();

        assertThat(metric.isCalculated()).isTrue();
        assertThat(second).isEqualTo(first);
        assertThat(metric.within()).isEqualTo(first.within());
        assertThat(metric.between()).isEqualTo(first.between());
        assertThat(metric.overall()).isEqualTo(first.overall());
        assertThat(metric.ratio()).isEqualTo(first.ratio());
    }

    @ParameterizedTest
    @EnumSource(MetricKind.class)
    void componentsAreNonNegativeAndRatioBounded(MetricKind kind) {
        InequalityMetric metric = Metrics.of(kind, POSITIVE);
        metric.calculate();

        assertThat(metric.within()).isGreaterThanOrEqualTo(0.0);
        assertThat(metric.between()).isGreaterThanOrEqualTo(0.0);
        assertThat(metric.ratio()).isBetween(0.0, 1.0);
    }

    @ParameterizedTest
    @EnumSource(MetricKind.class)
    void singleGroupHasNoBetweenComponent(MetricKind kind) {
        GroupedSample single = GroupedSample.single("all", 2, 4, 6, 9);
        InequalityMetric metric = Metrics.of(kind, single);
        metric.calculate();

        assertThat(metric.between()).isCloseTo(0.0, within(1e-12));
        assertThat(metric.within()).isCloseTo(metric.overall(), within(1e-12));
    }

    @ParameterizedTest
    @EnumSource(MetricKind.class)
    void identicalGroupsHaveNoBetweenComponent(MetricKind kind) {
        GroupedSample sample = GroupedSample.builder()
            .group("A", 1, 5, 9)
            .group("B", 1, 5, 9)
            .build();
        InequalityMetric metric = Metrics.of(kind, sample);
        metric.calculate();

        assertThat(metric.between()).isCloseTo(0.0, within(1e-12));
        assertThat(metric.ratio()).isCloseTo(0.0, within(1e-12));
    }

    @ParameterizedTest
    @EnumSource(MetricKind.class)
    void emptyGroupIsADomainError(MetricKind kind) {
        GroupedSample sample = GroupedSample.builder()
            .group("A", 1, 2)
            .group("B", Double.NaN)
            .build();
        InequalityMetric metric = Metrics.of(kind, sample);

        assertThatThrownBy(metric::calculate)
            .isInstanceOf(DomainException.class)
            .hasMessageContaining("B");
        assertThat(metric.isCalculated()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(MetricKind.class)
    void missingValuesAreExcluded(MetricKind kind) {
        GroupedSample withNaN = GroupedSample.builder()
            .group("A", 1, Double.NaN, 3)
            .group("B", 10, 30, Double.NaN)
            .build();
        GroupedSample without = GroupedSample.builder()
            .group("A", 1, 3)
            .group("B", 10, 30)
            .build();

        Decomposition a = Metrics.of(kind, withNaN).calculate();
        Decomposition b = Metrics.of(kind, without).calculate();
        assertThat(a.within()).isCloseTo(b.within(), within(1e-12));
        assertThat(a.between()).isCloseTo(b.between(), within(1e-12));
        assertThat(a.overall()).isCloseTo(b.overall(), within(1e-12));
    }

    @ParameterizedTest
    @EnumSource(MetricKind.class)
    void resultsDoNotDependOnGroupOrder(MetricKind kind) {
        GroupedSample ordered = GroupedSample.builder()
            .group("A", 2, 4, 9)
            .group("B", 1, 3)
            .group("C", 10, 12, 15, 30)
            .build();
        GroupedSample permuted = GroupedSample.builder()
            .group("C", 10, 12, 15, 30)
            .group("A", 2, 4, 9)
            .group("B", 1, 3)
            .build();

        Decomposition a = Metrics.of(kind, ordered).calculate();
        Decomposition b = Metrics.of(kind, permuted).calculate();

        assertThat(b.within()).isCloseTo(a.within(), within(1e-12));
        assertThat(b.between()).isCloseTo(a.between(), within(1e-12));
        assertThat(b.overall()).isCloseTo(a.overall(), within(1e-12));
        assertThat(b.ratio()).isCloseTo(a.ratio(), within(1e-12));
        assertThat(b.residual()).isCloseTo(a.residual(), within(1e-12));
    }

    @ParameterizedTest
    @EnumSource(MetricKind.class)
    void constantIdenticalGroupsHaveAnUndefinedRatio(MetricKind kind) {
        GroupedSample constant = GroupedSample.builder()
            .group("A", 4, 4, 4)
            .group("B", 4, 4, 4)
            .build();
        InequalityMetric metric = Metrics.of(kind, constant);
        metric.calculate();

        assertThat(metric.between()).isZero();
        assertThat(metric.overall()).isZero();
        assertThat(metric.ratio()).isNaN();
    }

    @Test
    void calculateApplicableSkipsTheilForASingleZero() {
        GroupedSample withZero = GroupedSample.builder()
            .group("A", 0, 5, 10)
            .group("B", Double.NaN, 20, 30)
            .build();

        assertThat(Metrics.calculateApplicable(withZero))
            .extracting(InequalityMetric::mnemonic)
            .containsExactly("VARIANCE", "GINI");
    }

    @Test
    void instancesDoNotShareResults() {
        ThielT first = new ThielT(POSITIVE);
        ThielT second = new ThielT(GroupedSample.single("all", 3, 3, 3));
        first.calculate();
        second.calculate();

        assertThat(first.overall()).isGreaterThan(0.0);
        assertThat(second.overall()).isEqualTo(0.0);
        assertThat(first.result()).isNotEqualTo(second.result());
    }

    @Test
    void metricKindCreatesTheMatchingType() {
        assertThat(MetricKind.VARIANCE.create(POSITIVE)).isInstanceOf(VarianceDecomposition.class);
        assertThat(MetricKind.GINI.create(POSITIVE)).isInstanceOf(GiniDecomposition.class);
        assertThat(MetricKind.THEIL_T.requiresPositiveValues()).isTrue();
        assertThat(MetricKind.GINI.requiresPositiveValues()).isFalse();
    }

    @Test
    void configuredToleranceReachesVariance() {
        InequalityMetric metric = Metrics.of(MetricKind.VARIANCE, POSITIVE,
            new EquityConfig().setResidualTolerance(0.5));

        assertThat(metric).isInstanceOf(VarianceDecomposition.class);
        assertThat(((VarianceDecomposition) metric).residualTolerance()).isEqualTo(0.5);
    }

    @Test
    void calculateApplicableSkipsTheilForNonPositiveData() {
        GroupedSample changes = GroupedSample.builder()
            .group("A", -5, 0, 10)
            .group("B", 20, 30, 40)
            .build();

        List<InequalityMetric> metrics = Metrics.calculateApplicable(changes);

        assertThat(metrics).extracting(InequalityMetric::mnemonic).containsExactly("VARIANCE", "GINI");
        assertThat(metrics).allMatch(InequalityMetric::isCalculated);
    }

    @Test
    void calculateApplicableRunsEveryIndexOnPositiveData() {
        assertThat(Metrics.calculateApplicable(POSITIVE))
            .extracting(InequalityMetric::mnemonic)
            .containsExactly("THEIL_T", "THEIL_L", "VARIANCE", "GINI");
    }
}
