package io.roitools.earnings;

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
import io.roitools.equity.stats.GroupSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// Tests for [Completion].
public class CompletionTest {

    private static final Completion COMPLETION = new Completion(List.of(
        new Enrollment("1", "nursing", 2015, 2019, true),
        new Enrollment("2", "welding", 2016, 2017, true),
        new Enrollment("3", "nursing", 2015, 2017, false),
        new Enrollment("4", "nursing", 2016, 2018, true),
        new Enrollment("5", "welding", 2016, 2018, true),
        new Enrollment("6", "history", 2014, 2015, false)
    ));

    @Test
    void completionRateIsTheMeanIndicator() {
        List<GroupSummary> rates = COMPLETION.completionRates();

        assertThat(rates).extracting(GroupSummary::group).containsExactly("nursing", "welding", "history");
        assertThat(rates).extracting(GroupSummary::mean).containsExactly(2.0 / 3.0, 1.0, 0.0);
        assertThat(rates).extracting(GroupSummary::n).containsExactly(3, 2, 1);
    }

    @Test
    void timeToCompletionCountsCompletersOnly() {
        List<GroupSummary> times = COMPLETION.timeToCompletion();

        GroupSummary nursing = times.get(0);
        assertThat(nursing.n()).isEqualTo(2);
        assertThat(nursing.nanCount()).isEqualTo(1);
        assertThat(nursing.mean()).isEqualTo(3.0);
        assertThat(nursing.min()).isEqualTo(2.0);
        assertThat(nursing.max()).isEqualTo(4.0);
        assertThat(times.get(1).mean()).isEqualTo(1.5);
    }

    @Test
    void programWithoutCompletersKeepsAnEmptyRow() {
        GroupSummary history = COMPLETION.timeToCompletion().get(2);

        assertThat(history.group()).isEqualTo("history");
        assertThat(history.n()).isZero();
        assertThat(history.mean()).isNaN();
    }

    @Test
    void groupedViewsFeedTheDecompositions() {
        GroupedSample indicators = COMPLETION.completionIndicators();
        GroupedSample years = COMPLETION.yearsToCompletion();

        assertThat(indicators.groups()).containsExactly("nursing", "welding", "history");
        assertThat(indicators.nanCount()).isZero();
        assertThat(years.nanCount()).isEqualTo(2);
        assertThat(years.hasEmptyGroup()).isTrue();
    }

    @Test
    void noEnrollmentsGiveNoSummaries() {
        Completion empty = new Completion(List.of());

        assertThat(empty.completionRates()).isEmpty();
        assertThat(empty.timeToCompletion()).isEmpty();
    }
}
