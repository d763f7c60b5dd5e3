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

import io.roitools.equity.measures.GiniDecomposition;
import io.roitools.equity.measures.ThielL;
import io.roitools.equity.measures.ThielT;
import io.roitools.equity.measures.VarianceDecomposition;

import java.util.function.Function;

/// The four decomposable inequality indices.
public enum MetricKind {
    THEIL_T(ThielT.MNEMONIC, ThielT::new),
    THEIL_L(ThielL.MNEMONIC, ThielL::new),
    VARIANCE(VarianceDecomposition.MNEMONIC, VarianceDecomposition::new),
    GINI(GiniDecomposition.MNEMONIC, GiniDecomposition::new);

    private final String mnemonic;
    private final Function<GroupedSample, InequalityMetric> factory;

    MetricKind(String mnemonic, Function<GroupedSample, InequalityMetric> factory) {
        this.mnemonic = mnemonic;
        this.factory = factory;
    }

    public String mnemonic() {
        return mnemonic;
    }

    /// @return a new, uncalculated metric of this kind over the sample
    public InequalityMetric create(GroupedSample sample) {
        return factory.apply(sample);
    }

    /// @return true if values must be strictly positive
    public boolean requiresPositiveValues() {
        return this == THEIL_T || this == THEIL_L;
    }
}
