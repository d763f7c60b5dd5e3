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
import io.roitools.equity.measures.VarianceDecomposition;
import io.roitools.equity.stats.GroupSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class EarningsPremiumTest {

    private EarningsPremium premium;

    @BeforeEach
    void setup() {
        CounterfactualWageProjector projector =
            new CounterfactualWageProjector(new MincerCoefficients(0.09, 0.001, 0.03, -0.0005));
        List<ProgramParticipant> participants = List.of(
            new ProgramParticipant("a", "36", EducationLevels.GED, 2019, 2021, 30000, 35000, 30),
            new ProgramParticipant("b", "06", EducationLevels.GED, 2019, 2021, 30000, 29000, 30),
            new ProgramParticipant("c", "36", EducationLevels.BA, 2020, 2020, 50000, 50000, 40),
            new ProgramParticipant("d", "06", EducationLevels.GED, 2019, 2021, 30000, Double.NaN, 30)
        );
        premium = new EarningsPremium(participants, projector);
    }

    @Test
    void premiumIsEndingWageMinusCounterfactual() {
        double[] premiums = premium.premiums();

        assertThat(premium.predictedWages()[0]).isCloseTo(31860.0, within(1e-6));
        assertThat(premiums[0]).isCloseTo(3140.0, within(1e-6));
        assertThat(premiums[1]).isCloseTo(-2860.0, within(1e-6));
        assertThat(premiums[2]).isEqualTo(0.0);
        assertThat(premiums[3]).isNaN();
    }

    @Test
    void premiumsGroupInFirstOccurrenceOrder() {
        GroupedSample byState = premium.premiumsBy(ProgramParticipant::state);

        assertThat(byState.groups()).containsExactly("36", "06");
        assertThat(byState.n()).isEqualTo(4);
        assertThat(byState.nanCount()).isEqualTo(1);
    }

    @Test
    void negativePremiumsDecomposeByVariance() {
        VarianceDecomposition variance = new VarianceDecomposition(premium.premiumsBy(ProgramParticipant::state));
        variance.calculate();

        assertThat(variance.overall()).isGreaterThan(0.0);
        assertThat(variance.between()).isGreaterThan(0.0);
    }

    @Test
    void groupAveragesSkipMissingPremiums() {
        List<GroupSummary> summaries = premium.groupAveragePremiums(ProgramParticipant::state);

        assertThat(summaries).extracting(GroupSummary::group).containsExactly("36", "06");
        assertThat(summaries.get(0).mean()).isCloseTo(1570.0, within(1e-6));
        assertThat(summaries.get(1).n()).isEqualTo(1);
        assertThat(summaries.get(1).nanCount()).isEqualTo(1);
        assertThat(summaries.get(1).mean()).isCloseTo(-2860.0, within(1e-6));
    }
}
