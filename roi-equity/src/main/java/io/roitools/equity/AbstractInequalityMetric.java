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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// # AbstractInequalityMetric
///
/// Base implementation of [InequalityMetric] that owns the two-phase lifecycle.
///
/// ## Template
/// `calculate()` rejects samples containing a group with no observed values,
/// delegates the index-specific precondition to [#checkDomain(GroupedSample)],
/// and only then runs [#computeImpl(GroupedSample)]. The result is stored on the
/// instance after the computation has completed, so a failed calculation never
/// leaves a partial result behind.
///
/// ```java
/// public class MyIndex extends AbstractInequalityMetric {
///     public String mnemonic() { return "MY"; }
///     protected void checkDomain(GroupedSample sample) { }
///     protected Decomposition computeImpl(GroupedSample sample) {
///         return Decomposition.additive(mnemonic(), within, between);
///     }
/// }
/// ```
public abstract class AbstractInequalityMetric implements InequalityMetric {

    private static final Logger logger = LogManager.getLogger(AbstractInequalityMetric.class);

    private final GroupedSample sample;
    private Decomposition result;

    protected AbstractInequalityMetric(GroupedSample sample) {
        this.sample = Objects.requireNonNull(sample, "sample cannot be null");
    }

    @Override
    public final GroupedSample sample() {
        return sample;
    }

    @Override
    public final Decomposition calculate() {
        if (sample.hasEmptyGroup()) {
            List<String> empty = new ArrayList<>();
            for (SampleDiagnostic diagnostic : sample.diagnostics()) {
                if (diagnostic.kind() == SampleDiagnostic.Kind.EMPTY_GROUP) {
                    empty.add(diagnostic.group());
                }
            }
            throw new DomainException(mnemonic(), "groups with no observed values: " + empty);
        }
        checkDomain(sample);
        Decomposition computed = computeImpl(sample);
        this.result = computed;
        logger.debug("{} over {}: {}", mnemonic(), sample, computed);
        return computed;
    }

    /// Validates the index-specific precondition.
    ///
    /// @param sample the sample about to be decomposed; has no empty groups
    /// @throws DomainException if the values are outside the index's domain
    protected abstract void checkDomain(GroupedSample sample);

    /// Computes the decomposition. Called only after [#checkDomain(GroupedSample)] passed.
    ///
    /// @param sample the sample to decompose
    /// @return the decomposition
    protected abstract Decomposition computeImpl(GroupedSample sample);

    @Override
    public final boolean isCalculated() {
        return result != null;
    }

    @Override
    public final Decomposition result() {
        if (result == null) {
            throw new IllegalStateException(mnemonic() + " has not been calculated; call calculate() first");
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + (result == null ? sample : result) + "]";
    }
}
