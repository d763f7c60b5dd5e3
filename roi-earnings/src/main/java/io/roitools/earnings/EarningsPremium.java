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
import io.roitools.equity.stats.GroupSummaries;
import io.roitools.equity.stats.GroupSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/// # EarningsPremium
///
/// Per-individual earnings premium of program participation: the observed wage after
/// the program minus the counterfactual wage projected without it.
///
/// Premiums are computed once at construction. A premium is `NaN` when the ending
/// wage is missing or the counterfactual cannot be projected; the grouped views
/// carry those as missing values.
///
/// Premiums can be negative, so the natural decomposition of their spread across
/// groups is `VarianceDecomposition`:
///
/// ```java
/// EarningsPremium premium = new EarningsPremium(participants, projector);
/// VarianceDecomposition variance = new VarianceDecomposition(premium.premiumsBy(ProgramParticipant::state));
/// variance.calculate();
/// ```
public final class EarningsPremium {

    private static final Logger logger = LogManager.getLogger(EarningsPremium.class);

    private final List<ProgramParticipant> participants;
    private final double[] predictedWages;
    private final double[] premiums;

    public EarningsPremium(List<ProgramParticipant> participants, CounterfactualWageProjector projector) {
        Objects.requireNonNull(participants, "participants cannot be null");
        Objects.requireNonNull(projector, "projector cannot be null");
        this.participants = List.copyOf(participants);
        this.predictedWages = new double[this.participants.size()];
        this.premiums = new double[this.participants.size()];

        int missing = 0;
        for (int i = 0; i < this.participants.size(); i++) {
            ProgramParticipant participant = this.participants.get(i);
            predictedWages[i] = projector.predictedWage(participant);
            premiums[i] = participant.wageAtEnd() - predictedWages[i];
            if (Double.isNaN(premiums[i])) {
                missing++;
            }
        }
        if (missing > 0) {
            logger.warn("{} of {} participants have no earnings premium (missing wage or education data)",
                missing, premiums.length);
        }
    }

    public List<ProgramParticipant> participants() {
        return participants;
    }

    /// @return counterfactual wages in participant order
    public double[] predictedWages() {
        return predictedWages.clone();
    }

    /// @return premiums in participant order, NaN where unavailable
    public double[] premiums() {
        return premiums.clone();
    }

    /// Groups premiums by a participant attribute, groups ordered by first occurrence.
    ///
    /// @param grouping extracts the group label of a participant
    /// @return a sample of premiums, NaN where unavailable
    public GroupedSample premiumsBy(Function<ProgramParticipant, String> grouping) {
        List<String> labels = new ArrayList<>(participants.size());
        for (ProgramParticipant participant : participants) {
            labels.add(grouping.apply(participant));
        }
        return ProgramGroups.sample(labels, premiums);
    }

    /// @return descriptive statistics of the premiums per group
    public List<GroupSummary> groupAveragePremiums(Function<ProgramParticipant, String> grouping) {
        return GroupSummaries.summarize(premiumsBy(grouping));
    }
}
