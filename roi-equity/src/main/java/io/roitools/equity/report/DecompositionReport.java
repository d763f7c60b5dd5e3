package io.roitools.equity.report;

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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.roitools.equity.ConfigurationException;
import io.roitools.equity.Decomposition;
import io.roitools.equity.GroupedSample;
import io.roitools.equity.InequalityMetric;
import io.roitools.equity.ResidualMetric;
import io.roitools.equity.SampleDiagnostic;
import io.roitools.equity.stats.GroupSummaries;
import io.roitools.equity.stats.GroupSummary;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON-serializable snapshot of a calculated metric: its decomposition, the group
 * layout of the sample, per-group summaries and any sample diagnostics.
 *
 * <pre>{@code
 * InequalityMetric gini = new GiniDecomposition(sample);
 * gini.calculate();
 * String json = DecompositionReport.of(gini).toJson();
 * }</pre>
 *
 * @param metric the index mnemonic
 * @param groups group labels in sample order
 * @param n total observations, missing values included
 * @param nanCount missing values
 * @param within the within-group component
 * @param between the between-group component
 * @param overall the population-level index
 * @param ratio between / overall
 * @param residual overall - (within + between); null for indices that are additive by construction
 * @param summaries per-group descriptive statistics
 * @param diagnostics sample diagnostic messages
 */
public record DecompositionReport(
    @SerializedName("metric") String metric,
    @SerializedName("groups") List<String> groups,
    @SerializedName("n") int n,
    @SerializedName("nan_count") int nanCount,
    @SerializedName("within") double within,
    @SerializedName("between") double between,
    @SerializedName("overall") double overall,
    @SerializedName("ratio") double ratio,
    @SerializedName("residual") Double residual,
    @SerializedName("summaries") List<GroupSummary> summaries,
    @SerializedName("diagnostics") List<String> diagnostics
) {

    /**
     * Builds a report from a calculated metric.
     *
     * @throws IllegalStateException if the metric has not been calculated
     */
    public static DecompositionReport of(InequalityMetric metric) {
        Decomposition result = metric.result();
        GroupedSample sample = metric.sample();
        List<String> messages = new ArrayList<>();
        for (SampleDiagnostic diagnostic : sample.diagnostics()) {
            messages.add(diagnostic.kind() + ": " + diagnostic.message());
        }
        return new DecompositionReport(
            metric.mnemonic(),
            sample.groups(),
            sample.n(),
            sample.nanCount(),
            result.within(),
            result.between(),
            result.overall(),
            result.ratio(),
            metric instanceof ResidualMetric ? result.residual() : null,
            GroupSummaries.summarize(sample),
            List.copyOf(messages)
        );
    }

    public String toJson() {
        return EquityGsonConfig.gson().toJson(this);
    }

    /**
     * @throws ConfigurationException if the JSON cannot be read as a report
     */
    public static DecompositionReport fromJson(String json) {
        try {
            return EquityGsonConfig.gson().fromJson(json, DecompositionReport.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("invalid decomposition report JSON: " + e.getMessage(), e);
        }
    }
}
