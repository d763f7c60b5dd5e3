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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Raw likelihood of employment per program, before any correction for
 * macroeconomic conditions.
 *
 * <ul>
 *   <li><b>likelihood at end</b>: mean of the 1/0 employment indicator after the program</li>
 *   <li><b>likelihood change</b>: mean of {@code employedAtEnd - employedAtStart}, between
 *       -1 and 1</li>
 * </ul>
 *
 * <p>Unknown statuses are missing values and are excluded from the means.
 */
public final class EmploymentLikelihood {

    private static final Logger logger = LogManager.getLogger(EmploymentLikelihood.class);

    private final List<EmploymentRecord> records;

    public EmploymentLikelihood(List<EmploymentRecord> records) {
        this.records = List.copyOf(Objects.requireNonNull(records, "records cannot be null"));
        long unknown = this.records.stream()
            .filter(r -> r.employedAtStart() == null || r.employedAtEnd() == null)
            .count();
        if (unknown > 0) {
            logger.debug("{} of {} records have an unknown employment status", unknown, this.records.size());
        }
    }

    /// @return employment indicators after the program, grouped by program
    public GroupedSample employedAtEnd() {
        return ProgramGroups.sample(records, EmploymentRecord::program,
            r -> ProgramGroups.indicator(r.employedAtEnd()));
    }

    /// @return one summary per program; `mean` is the likelihood of employment at the end
    public List<GroupSummary> rawLikelihoodAtEnd() {
        return ProgramGroups.summarize(records, EmploymentRecord::program,
            r -> ProgramGroups.indicator(r.employedAtEnd()));
    }

    /// @return per-individual change in employment status, grouped by program
    public GroupedSample employmentChanges() {
        return ProgramGroups.sample(records, EmploymentRecord::program, EmploymentLikelihood::change);
    }

    /// @return one summary per program; `mean` is the change in likelihood of employment
    public List<GroupSummary> rawLikelihoodChange() {
        return ProgramGroups.summarize(records, EmploymentRecord::program, EmploymentLikelihood::change);
    }

    public List<EmploymentRecord> records() {
        return records;
    }

    private static double change(EmploymentRecord record) {
        return ProgramGroups.indicator(record.employedAtEnd()) - ProgramGroups.indicator(record.employedAtStart());
    }
}
