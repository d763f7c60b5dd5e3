package io.roitools.charts;

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

import io.roitools.equity.GroupedSample;

import java.util.List;

/// # GroupChartRenderer
///
/// Optional rendering collaborator for grouped observations.
///
/// The decomposition engine never calls a renderer; rendering is a separate step a
/// caller invokes explicitly, and every metric works the same with no renderer on
/// the classpath.
///
/// @param <A> the displayable artifact produced, e.g. a `String` for text output
public interface GroupChartRenderer<A> {

    /// Renders parallel lists of group labels and group values.
    ///
    /// @param groups ordered group labels
    /// @param groupedValues one array per label; NaN entries are missing values
    /// @return the rendered artifact
    A render(List<String> groups, List<double[]> groupedValues);

    /// Renders a [GroupedSample].
    default A render(GroupedSample sample) {
        return render(sample.groups(), sample.groupedValues());
    }
}
