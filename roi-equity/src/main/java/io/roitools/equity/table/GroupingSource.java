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

import java.util.List;

/// # GroupingSource
///
/// The only contract the metrics require of an upstream loader: group rows by one or
/// more key columns and yield ordered (key, value-list) pairs.
///
/// ## Contract
/// - Groups are yielded in order of first occurrence of their key.
/// - Values keep row order within a group; a missing or non-numeric cell is `NaN`.
/// - A multi-column key is rendered by joining the key values with [#KEY_SEPARATOR].
/// - [#select(int[])] returns a view over a subset of rows, in the order given, so the
///   caller can subsample before grouping.
///
/// Survey microdata loaders, joined wage records and in-memory tables all implement
/// this the same way; see [RowTable] for the in-memory form.
public interface GroupingSource {

    /// Separator between key values of a multi-column group key.
    String KEY_SEPARATOR = "|";

    /// @return the number of rows
    int rowCount();

    /// @return the column names
    List<String> columns();

    /// @param rowIndices zero-based row positions to keep
    /// @return a source over only those rows
    GroupingSource select(int[] rowIndices);

    /// Groups rows by the key columns and extracts the value column per group.
    ///
    /// @param keyColumns one or more key column names
    /// @param valueColumn the numeric column to extract
    /// @return groups in order of first occurrence
    List<Group> groupBy(List<String> keyColumns, String valueColumn);
}
