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
import io.roitools.equity.DomainException;
import io.roitools.equity.GroupedSample;
import io.roitools.equity.ResidualMetric;
import io.roitools.equity.stats.NanStats;
import io.roitools.equity.table.GroupedSamples;
import io.roitools.equity.table.GroupingSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;

/**
 * Gini coefficient decomposition.
 *
 * <pre>
 *   Gini(x)  = Σ_i Σ_j |x_i - x_j| / (2 n² mean(x))
 *   within   = Σ_i Gini(group_i) · (sum(group_i)/sum(all)) · (N_i/N)
 *   between  = Gini(every observation replaced by its group mean)
 *   overall  = Gini(all observations)
 *   residual = overall - (within + between)
 * </pre>
 *
 * <p>The Gini coefficient is only approximately decomposable. The residual is the
 * overlap term: zero when group ranges do not overlap, positive otherwise. It is
 * reported, never treated as an error, and {@code ratio = between / overall} stays
 * interpretable.
 *
 * <p>Intended for non-negative values. Negative values are accepted but logged,
 * since value shares lose their meaning. A population mean of zero, or one that
 * cancels to rounding noise, is rejected.
 */
public class GiniDecomposition extends AbstractInequalityMetric implements ResidualMetric {

    private static final Logger logger = LogManager.getLogger(GiniDecomposition.class);

    public static final String MNEMONIC = "GINI";

    /**
     * A sum within this fraction of the sum of absolute values is treated as zero,
     * so a mean that cancels to rounding noise is rejected like an exact zero.
     */
    public static final double ZERO_MEAN_TOLERANCE = 1e-12;

    public GiniDecomposition(GroupedSample sample) {
        super(sample);
    }

    public static GiniDecomposition fromTable(GroupingSource table, List<String> groupColumns,
                                              String valueColumn) {
        return new GiniDecomposition(GroupedSamples.fromTable(table, groupColumns, valueColumn));
    }

    public static GiniDecomposition fromTable(GroupingSource table, List<String> groupColumns,
                                              String valueColumn, int sampleSize, long seed) {
        return new GiniDecomposition(GroupedSamples.fromTable(table, groupColumns, valueColumn, sampleSize, seed));
    }

    @Override
    public String mnemonic() {
        return MNEMONIC;
    }

    @Override
    protected void checkDomain(GroupedSample sample) {
        double[] all = sample.flat();
        if (hasZeroMean(all)) {
            throw new DomainException(MNEMONIC, "mean of all observations is zero; the Gini coefficient is undefined");
        }
        int negative = NanStats.countNegative(all);
        if (negative > 0) {
            logger.warn("{} negative value(s) passed to the Gini decomposition; value shares and the index " +
                "are not interpretable for negative data", negative);
        }
    }

    @Override
    protected Decomposition computeImpl(GroupedSample sample) {
        List<double[]> groups = sample.observedGroups();
        double[] all = sample.observedFlat();
        double populationSize = all.length;
        double total = NanStats.sum(all);

        double within = 0;
        double[] meanSubstituted = new double[all.length];
        int offset = 0;
        for (double[] group : groups) {
            double groupSum = NanStats.sum(group);
            // a zero-sum group has zero value share and contributes nothing
            if (!hasZeroMean(group)) {
                double valueShare = groupSum / total;
                double populationShare = group.length / populationSize;
                within += gini(group) * valueShare * populationShare;
            }
            Arrays.fill(meanSubstituted, offset, offset + group.length, groupSum / group.length);
            offset += group.length;
        }
        double between = gini(meanSubstituted);
        double overall = gini(all);
        return Decomposition.withResidual(MNEMONIC, within, between, overall);
    }

    /**
     * Gini coefficient of a single array, NaN entries excluded.
     *
     * <p>Evaluated on the sorted values with the rank identity
     * {@code Σ_i Σ_j |x_i - x_j| = 2 Σ_k (2k - n - 1) x_(k)}, which equals the
     * pairwise definition in O(n log n).
     *
     * @param values observations, normally non-negative
     * @return the coefficient, {@code 0} for a constant array
     * @throws DomainException if there are no observed values or their mean is zero
     *     within {@link #ZERO_MEAN_TOLERANCE}
     */
    public static double gini(double[] values) {
        Domains.requireObserved(MNEMONIC, values);
        double[] sorted = NanStats.sortedObserved(values);
        int n = sorted.length;

        double sum = 0;
        double rankWeighted = 0;
        for (int k = 0; k < n; k++) {
            sum += sorted[k];
            rankWeighted += (2.0 * (k + 1) - n - 1) * sorted[k];
        }
        if (hasZeroMean(sorted)) {
            throw new DomainException(MNEMONIC, "mean of values is zero; the Gini coefficient is undefined");
        }
        double mean = sum / n;
        double absoluteDifferences = 2.0 * rankWeighted;
        return absoluteDifferences / (2.0 * n * (double) n * mean);
    }

    private static boolean hasZeroMean(double[] values) {
        return Math.abs(NanStats.sum(values)) <= ZERO_MEAN_TOLERANCE * NanStats.sumAbsolute(values);
    }
}
