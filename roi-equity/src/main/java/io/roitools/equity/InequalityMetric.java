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

/// # InequalityMetric
///
/// Shared contract of the group-decomposable inequality indices.
///
/// ## Lifecycle
/// 1. **Construct** over one [GroupedSample]. Construction never computes.
/// 2. **Calculate** with [#calculate()]. Domain preconditions are checked first;
///    a violation raises [DomainException] before any result is stored.
/// 3. **Read** [#within()], [#between()], [#overall()] and [#ratio()].
///
/// `calculate()` is pure with respect to the sample: calling it again on the same
/// instance reproduces bit-identical values. Each instance owns its results; no
/// state is shared between instances.
///
/// ## Implementations
/// - `ThielT`: income-share weighted entropy, positive values only
/// - `ThielL`: population weighted mean log deviation, positive values only
/// - `VarianceDecomposition`: population variance, any real values
/// - `GiniDecomposition`: Gini coefficient, non-negative values, approximate
public interface InequalityMetric {

    /// @return a short, unique identifier such as `THEIL_T` or `GINI`
    String mnemonic();

    /// @return the sample this metric decomposes
    GroupedSample sample();

    /// Computes the decomposition and stores it on this instance.
    ///
    /// @return the computed decomposition
    /// @throws DomainException if the sample violates the index's domain
    Decomposition calculate();

    /// @return true once [#calculate()] has completed successfully
    boolean isCalculated();

    /// @return the last computed decomposition
    /// @throws IllegalStateException if [#calculate()] has not completed
    Decomposition result();

    default double within() {
        return result().within();
    }

    default double between() {
        return result().between();
    }

    default double overall() {
        return result().overall();
    }

    default double ratio() {
        return result().ratio();
    }
}
