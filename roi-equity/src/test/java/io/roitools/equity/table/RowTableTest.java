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
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RowTableTest {

    private static final RowTable TABLE = RowTable.builder("gender", "race", "wage")
        .row("F", "B", 41000.0)
        .row("M", "A", 38000)
        .row("F", "A", "52000")
        .row("M", "A", null)
        .row("F", "B", "n/a")
        .build();

    @Test
    void groupsInFirstOccurrenceOrder() {
        List<Group> groups = TABLE.groupBy(List.of("gender"), "wage");

        assertThat(groups).extracting(Group::label).containsExactly("F", "M");
        assertThat(groups.get(0).values()).containsExactly(41000.0, 52000.0, Double.NaN);
        assertThat(groups.get(1).values()).containsExactly(38000.0, Double.NaN);
    }

    @Test
    void multiColumnKeysAreJoined() {
        List<Group> groups = TABLE.groupBy(List.of("gender", "race"), "wage");

        assertThat(groups).extracting(Group::label).containsExactly("F|B", "M|A", "F|A");
    }

    @Test
    void selectKeepsGivenRows() {
        RowTable selected = TABLE.select(new int[]{1, 2});

        assertThat(selected.rowCount()).isEqualTo(2);
        assertThat(selected.columns()).containsExactly("gender", "race", "wage");
        assertThat(selected.groupBy(List.of("race"), "wage"))
            .singleElement()
            .satisfies(g -> assertThat(g.values()).containsExactly(38000.0, 52000.0));
    }

    @Test
    void unknownColumnIsAConfigurationError() {
        assertThatThrownBy(() -> TABLE.groupBy(List.of("age"), "wage"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("age");
        assertThatThrownBy(() -> TABLE.groupBy(List.of("gender"), "salary"))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> TABLE.groupBy(List.of(), "wage"))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void rowsAreReadByColumnName() {
        Map<String, Object> row = new HashMap<>();
        row.put("state", 36);
        row.put("wage", 1.5);
        RowTable table = new RowTable(List.of("state", "wage"), List.of(row, Map.of("wage", 2.5)));

        assertThat(table.groupBy(List.of("state"), "wage"))
            .extracting(Group::label)
            .containsExactly("36", "null");
    }

    @Test
    void builderRejectsShortRows() {
        assertThatThrownBy(() -> RowTable.builder("a", "b").row("x"))
            .isInstanceOf(ConfigurationException.class);
    }
}
