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

import io.roitools.equity.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * In-memory {@link GroupingSource} over a list of rows keyed by column name.
 *
 * <p>Cells may hold any object. Key cells are rendered with {@link String#valueOf(Object)};
 * value cells are read as numbers, with {@link Number} taken directly, numeric strings
 * parsed, and anything else (including {@code null}) read as {@code NaN}.
 *
 * <pre>{@code
 * RowTable table = RowTable.builder("gender", "race", "wage")
 *     .row("F", "A", 41000.0)
 *     .row("M", "B", 38000.0)
 *     .build();
 * }</pre>
 */
public final class RowTable implements GroupingSource {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    /**
     * @param columns column names
     * @param rows rows keyed by column name; missing keys read as null cells
     */
    public RowTable(List<String> columns, List<Map<String, Object>> rows) {
        Objects.requireNonNull(columns, "columns cannot be null");
        Objects.requireNonNull(rows, "rows cannot be null");
        this.columns = List.copyOf(columns);
        List<Map<String, Object>> copies = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copies);
    }

    public static Builder builder(String... columns) {
        return new Builder(List.of(columns));
    }

    @Override
    public int rowCount() {
        return rows.size();
    }

    @Override
    public List<String> columns() {
        return columns;
    }

    @Override
    public RowTable select(int[] rowIndices) {
        List<Map<String, Object>> selected = new ArrayList<>(rowIndices.length);
        for (int index : rowIndices) {
            selected.add(rows.get(index));
        }
        return new RowTable(columns, selected);
    }

    @Override
    public List<Group> groupBy(List<String> keyColumns, String valueColumn) {
        Objects.requireNonNull(keyColumns, "keyColumns cannot be null");
        if (keyColumns.isEmpty()) {
            throw new ConfigurationException("at least one key column is required");
        }
        for (String key : keyColumns) {
            requireColumn(key);
        }
        requireColumn(valueColumn);

        Map<String, List<Double>> grouped = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            StringJoiner label = new StringJoiner(KEY_SEPARATOR);
            for (String key : keyColumns) {
                label.add(String.valueOf(row.get(key)));
            }
            grouped.computeIfAbsent(label.toString(), k -> new ArrayList<>()).add(toDouble(row.get(valueColumn)));
        }

        List<Group> groups = new ArrayList<>(grouped.size());
        for (Map.Entry<String, List<Double>> entry : grouped.entrySet()) {
            List<Double> values = entry.getValue();
            double[] array = new double[values.size()];
            for (int i = 0; i < array.length; i++) {
                array[i] = values.get(i);
            }
            groups.add(new Group(entry.getKey(), array));
        }
        return groups;
    }

    private void requireColumn(String column) {
        if (!columns.contains(column)) {
            throw new ConfigurationException("unknown column '" + column + "'; available: " + columns);
        }
    }

    private static double toDouble(Object cell) {
        if (cell instanceof Number) {
            return ((Number) cell).doubleValue();
        }
        if (cell instanceof String) {
            try {
                return Double.parseDouble(((String) cell).trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    /**
     * Collects rows positionally against a fixed column list.
     */
    public static final class Builder {
        private final List<String> columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = columns;
        }

        public Builder row(Object... cells) {
            if (cells.length != columns.size()) {
                throw new ConfigurationException(
                    "row has " + cells.length + " cells but table has " + columns.size() + " columns");
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < cells.length; i++) {
                row.put(columns.get(i), cells[i]);
            }
            rows.add(row);
            return this;
        }

        public RowTable build() {
            return new RowTable(columns, rows);
        }
    }
}
