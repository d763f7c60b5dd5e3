package io.roitools.equity.table;

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

/// One (key, values) pair yielded by [GroupingSource#groupBy(java.util.List, String)].
///
/// @param label the group key; multi-column keys are joined with [GroupingSource#KEY_SEPARATOR]
/// @param values the group's values in row order, NaN for missing or non-numeric cells
public record Group(String label, double[] values) {
}
