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
import io.roitools.equity.ConfigurationException;
import io.roitools.equity.Decomposition;
import io.roitools.equity.GroupedSample;
import io.roitools.equity.ResidualMetric;
import io.roitools.equity.stats.NanStats;
import io.roitools.equity.table.GroupedSamples;
import io.roitools.equity.table.GroupingSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Population variance decomposition.
 *
 * <pre>
 *   within   = Σ_i (N_i/N) popvar(group_i)
 *   between  = popvar(x̄_1, ..., x̄_k)       one mean per group, unweighted
 *   overall  = popvar(all observations)
 *   residual = overall - (within + between)
 * </pre>
 *
 * <p>Defined on the whole real line, so this is the decomposition to use for
 * quantities that can be negative, such as earnings changes. All variances divide
 * by N: the observations are treated as a census.
 *
 * <p>The between term is the unweighted variance of group means. It coincides with
 * the size-weighted ANOVA term when groups have equal size, and the residual is then
 * zero up to rounding. With unequal group sizes the residual absorbs the difference;
 * a residual beyond the tolerance is logged at WARN level.
 */
public class VarianceDecomposition extends AbstractInequalityMetric implements ResidualMetric {

    private static final Logger logger = LogManager.getLogger(VarianceDecomposition.class);

    public static final String MNEMONIC = "VARIANCE";

    /** Relative residual above which a warning is logged. */
    public static final double DEFAULT_RESIDUAL_TOLERANCE = 1e-9;

    private final double residualTolerance;

    public VarianceDecomposition(GroupedSample sample) {
        this(sample, DEFAULT_RESIDUAL_TOLERANCE);
    }

    /**
     * @param sample the grouped observations
     * @param residualTolerance relative residual above which a warning is logged
     */
    public VarianceDecomposition(GroupedSample sample, double residualTolerance) {
        super(sample);
        if (!(residualTolerance >= 0)) {
            throw new ConfigurationException("residualTolerance must be >= 0, was " + residualTolerance);
        }
        this.residualTolerance = residualTolerance;
    }

    public static VarianceDecomposition fromTable(GroupingSource table, List<String> groupColumns,
                                                  String valueColumn) {
        return new VarianceDecomposition(GroupedSamples.fromTable(table, groupColumns, valueColumn));
    }

    public static VarianceDecomposition fromTable(GroupingSource table, List<String> groupColumns,
                                                  String valueColumn, int sampleSize, long seed) {
        return new VarianceDecomposition(
            GroupedSamples.fromTable(table, groupColumns, valueColumn, sampleSize, seed));
    }

    @Override
    public String mnemonic() {
        return MNEMONIC;
    }

    @Override
    protected void checkDomain(GroupedSample sample) {
        // any real value is accepted
    }

    @Override
    protected Decomposition computeImpl(GroupedSample sample) {
        List<double[]> groups = sample.observedGroups();
        double populationSize = sample.observedCount();

        double within = 0;
        double[] groupMeans = new double[groups.size()];
        for (int i = 0; i < groups.size(); i++) {
            double[] group = groups.get(i);
            within += (group.length / populationSize) * NanStats.populationVariance(group);
            groupMeans[i] = NanStats.mean(group);
        }
        double between = NanStats.populationVariance(groupMeans);
        double overall = NanStats.populationVariance(sample.observedFlat());

        Decomposition decomposition = Decomposition.withResidual(MNEMONIC, within, between, overall);
        if (Math.abs(decomposition.residual()) > residualTolerance * Math.max(1.0, Math.abs(overall))) {
            logger.warn("variance residual {} exceeds tolerance {}; group sizes are unequal, so the unweighted " +
                "between-group variance differs from the size-weighted term", decomposition.residual(),
                residualTolerance);
        }
        return decomposition;
    }

    public double residualTolerance() {
        return residualTolerance;
    }

    /**
     * Population variance of a single array, NaN entries excluded.
     *
     * @param values observations, any sign
     * @return the variance
     * @throws io.roitools.equity.DomainException if there are no observed values
     */
    public static double populationVariance(double[] values) {
        Domains.requireObserved(MNEMONIC, values);
        return NanStats.populationVariance(values);
    }
}
