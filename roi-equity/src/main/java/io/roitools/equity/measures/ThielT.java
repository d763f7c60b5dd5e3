package io.roitools.equity.measures;

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

import io.roitools.equity.AbstractInequalityMetric;
import io.roitools.equity.Decomposition;
import io.roitools.equity.GroupedSample;
import io.roitools.equity.stats.NanStats;
import io.roitools.equity.table.GroupedSamples;
import io.roitools.equity.table.GroupingSource;

import java.util.List;

/**
 * Theil T index decomposition (income-share weighted entropy).
 *
 * <p>For group {@code i} with {@code N_i} observations and mean {@code x̄_i}, over a
 * population of {@code N} observations with mean {@code μ}:
 *
 * <pre>
 *   T_i     = (1/N_i) Σ_j (x_j/x̄_i) ln(x_j/x̄_i)
 *   s_i     = (N_i/N) (x̄_i/μ)
 *   within  = Σ_i s_i T_i
 *   between = Σ_i s_i ln(x̄_i/μ)
 *   overall = within + between
 * </pre>
 *
 * <p>The weight {@code s_i} is the group's share of total value: population share
 * scaled by the group's mean relative to the overall mean. Every observed value must
 * be strictly positive.
 *
 * @see ThielL
 */
public class ThielT extends AbstractInequalityMetric {

    public static final String MNEMONIC = "THEIL_T";

    public ThielT(GroupedSample sample) {
        super(sample);
    }

    /**
     * Groups a table and wraps it in a new, uncalculated instance.
     */
    public static ThielT fromTable(GroupingSource table, List<String> groupColumns, String valueColumn) {
        return new ThielT(GroupedSamples.fromTable(table, groupColumns, valueColumn));
    }

    /**
     * Draws a seeded subsample of {@code sampleSize} rows, groups it, and wraps it in a
     * new, uncalculated instance.
     */
    public static ThielT fromTable(GroupingSource table, List<String> groupColumns, String valueColumn,
                                   int sampleSize, long seed) {
        return new ThielT(GroupedSamples.fromTable(table, groupColumns, valueColumn, sampleSize, seed));
    }

    @Override
    public String mnemonic() {
        return MNEMONIC;
    }

    @Override
    protected void checkDomain(GroupedSample sample) {
        Domains.requirePositive(MNEMONIC, sample);
    }

    @Override
    protected Decomposition computeImpl(GroupedSample sample) {
        double[] all = sample.observedFlat();
        double populationSize = all.length;
        double mu = NanStats.mean(all);

        double within = 0;
        double between = 0;
        for (double[] group : sample.observedGroups()) {
            double groupMean = NanStats.mean(group);
            double share = (group.length / populationSize) * (groupMean / mu);
            within += share * entropy(group, groupMean);
            between += share * Math.log(groupMean / mu);
        }
        return Decomposition.additive(MNEMONIC, within, between);
    }

    /**
     * Theil T index of a single array: {@code (1/N) Σ (x/μ) ln(x/μ)}. NaN entries
     * are excluded.
     *
     * @param values strictly positive observations
     * @return the index, {@code 0} for a constant array
     * @throws io.roitools.equity.DomainException if there are no observed values or
     *     any value is zero or negative
     */
    public static double theil(double[] values) {
        Domains.requireObserved(MNEMONIC, values);
        Domains.requirePositive(MNEMONIC, values);
        double[] observed = NanStats.observed(values);
        return entropy(observed, NanStats.mean(observed));
    }

    private static double entropy(double[] observed, double mean) {
        double sum = 0;
        for (double x : observed) {
            double r = x / mean;
            // ratios below zero can only come from rounding near zero; r ln r -> 0 as r -> 0
            if (r <= 0) {
                continue;
            }
            sum += r * Math.log(r);
        }
        return sum / observed.length;
    }
}
