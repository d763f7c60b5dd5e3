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

/// The outcome of decomposing an inequality index over a [GroupedSample].
///
/// `overall` is the index over the whole population, `within` the part
/// attributed to dispersion inside groups and `between` the part attributed to
/// differences among groups. `ratio` is `between / overall`, NaN when `overall`
/// is zero. `residual` is `overall - (within + between)`: zero by construction for
/// the Theil indices, near zero for the variance decomposition of equal-size
/// groups, and an expected overlap term for Gini.
///
/// Groups that share the same mean and shape have `between == 0` and so a ratio
/// of zero, with one exception: when every value is equal, `overall` is zero as
/// well and the ratio is NaN rather than zero.
///
/// @param mnemonic the short name of the index, e.g. `THEIL_T`
/// @param within the within-group component
/// @param between the between-group component
/// @param overall the population-level index
/// @param ratio share of the index attributable to between-group differences
/// @param residual what the two components leave unexplained
public record Decomposition(
    String mnemonic,
    double within,
    double between,
    double overall,
    double ratio,
    double residual
) {

    /// Builds a decomposition whose overall value is the sum of its components.
    public static Decomposition additive(String mnemonic, double within, double between) {
        double overall = within + between;
        return new Decomposition(mnemonic, within, between, overall, ratio(between, overall), 0.0);
    }

    /// Builds a decomposition whose overall value is computed independently; the
    /// residual is derived from it.
    public static Decomposition withResidual(String mnemonic, double within, double between, double overall) {
        return new Decomposition(mnemonic, within, between, overall, ratio(between, overall),
            overall - (within + between));
    }

    /// @return `between / overall`, or NaN when `overall` is zero
    public static double ratio(double between, double overall) {
        if (overall == 0.0) {
            return Double.NaN;
        }
        return between / overall;
    }

    @Override
    public String toString() {
        return String.format("%s[within=%.6f, between=%.6f, overall=%.6f, ratio=%.6f, residual=%.3e]",
            mnemonic, within, between, overall, ratio, residual);
    }
}
