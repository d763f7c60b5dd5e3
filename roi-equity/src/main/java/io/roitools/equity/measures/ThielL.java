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
 * Theil L index decomposition, also known as the mean log deviation.
 *
 * <pre>
 *   L_i     = (1/N_i) Σ_j ln(x̄_i/x_j)
 *   s_i     = N_i/N
 *   within  = Σ_i s_i L_i
 *   between = Σ_i s_i ln(μ/x̄_i)
 *   overall = within + between
 * </pre>
 *
 * <p>Unlike {@link ThielT}, groups are weighted by population share alone, which
 * makes this index more sensitive to the lower tail. Every observed value must be
 * strictly positive.
 */
public class ThielL extends AbstractInequalityMetric {

    public static final String MNEMONIC = "THEIL_L";

    public ThielL(GroupedSample sample) {
        super(sample);
    }

    public static ThielL fromTable(GroupingSource table, List<String> groupColumns, String valueColumn) {
        return new ThielL(GroupedSamples.fromTable(table, groupColumns, valueColumn));
    }

    public static ThielL fromTable(GroupingSource table, List<String> groupColumns, String valueColumn,
                                   int sampleSize, long seed) {
        return new ThielL(GroupedSamples.fromTable(table, groupColumns, valueColumn, sampleSize, seed));
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
            double share = group.length / populationSize;
            within += share * logDeviation(group, groupMean);
            between += share * Math.log(mu / groupMean);
        }
        return Decomposition.additive(MNEMONIC, within, between);
    }

    /**
     * Mean log deviation of a single array: {@code (1/N) Σ ln(μ/x)}. NaN entries are
     * excluded.
     *
     * @param values strictly positive observations
     * @return the index, {@code 0} for a constant array
     * @throws io.roitools.equity.DomainException if there are no observed values or
     *     any value is zero or negative
     */
    public static double meanLogDeviation(double[] values) {
        Domains.requireObserved(MNEMONIC, values);
        Domains.requirePositive(MNEMONIC, values);
        double[] observed = NanStats.observed(values);
        return logDeviation(observed, NanStats.mean(observed));
    }

    private static double logDeviation(double[] observed, double mean) {
        double sum = 0;
        for (double x : observed) {
            sum += Math.log(mean / x);
        }
        return sum / observed.length;
    }
}
