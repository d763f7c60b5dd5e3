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

import io.roitools.equity.DomainException;
import io.roitools.equity.GroupedSample;
import io.roitools.equity.stats.NanStats;

/// Precondition checks shared by the index implementations.
final class Domains {

    private Domains() {}

    /// Rejects any zero or negative observation, naming the alternatives that accept them.
    static void requirePositive(String mnemonic, GroupedSample sample) {
        requirePositive(mnemonic, sample.flat());
    }

    static void requirePositive(String mnemonic, double[] values) {
        int nonPositive = NanStats.countNonPositive(values);
        if (nonPositive > 0) {
            throw new DomainException(mnemonic,
                "found " + nonPositive + " non-positive value(s); this index is defined only for strictly " +
                "positive values. Use VarianceDecomposition for real-valued data or GiniDecomposition " +
                "for non-negative data.");
        }
    }

    static void requireObserved(String mnemonic, double[] values) {
        if (NanStats.count(values) == 0) {
            throw new DomainException(mnemonic, "no observed values");
        }
    }
}
