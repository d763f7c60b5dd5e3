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

/// An [InequalityMetric] whose overall value is computed independently of its
/// components, so that `overall - (within + between)` is worth reporting.
public interface ResidualMetric extends InequalityMetric {

    /// @return `overall - (within + between)` of the last calculation
    default double residual() {
        return result().residual();
    }
}
