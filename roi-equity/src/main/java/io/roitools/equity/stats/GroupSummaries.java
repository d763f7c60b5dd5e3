package io.roitools.equity.stats;

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

import java.util.ArrayList;
import java.util.List;

/// Per-group descriptive summaries, in the sample's group order.
public final class GroupSummaries {

    private GroupSummaries() {}

    /// @param sample the grouped observations
    /// @return one summary per group
    public static List<GroupSummary> summarize(GroupedSample sample) {
        List<GroupSummary> summaries = new ArrayList<>(sample.groupCount());
        for (int i = 0; i < sample.groupCount(); i++) {
            summaries.add(GroupSummary.of(sample.groups().get(i), sample.values(i)));
        }
        return List.copyOf(summaries);
    }
}
