/// The four group-decomposable inequality indices.
///
/// Each index is a self-contained [io.roitools.equity.AbstractInequalityMetric]
/// over one [io.roitools.equity.GroupedSample], and also exposes its single-array
/// formula as a static method.
///
/// ## Domains
///
/// | Index | Values | Residual |
/// |-------|--------|----------|
/// | {@link io.roitools.equity.measures.ThielT} | strictly positive | none, additive |
/// | {@link io.roitools.equity.measures.ThielL} | strictly positive | none, additive |
/// | {@link io.roitools.equity.measures.VarianceDecomposition} | any real | zero for equal group sizes |
/// | {@link io.roitools.equity.measures.GiniDecomposition} | non-negative | group range overlap |
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
