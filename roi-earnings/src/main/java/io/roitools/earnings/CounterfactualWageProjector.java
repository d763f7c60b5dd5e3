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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Projects the wage an individual would have earned had they not entered a program,
 * from their starting wage and the experience returns of a Mincer model.
 *
 * <pre>
 *   s            = years of schooling for the prior EDUC code
 *   e_now        = age - s - 6
 *   e_start      = e_now - years in program
 *   value(e)     = c_sx·e·s + c_x·e + c_x2·e²
 *   predicted    = starting wage × (1 + value(e_now) - value(e_start))
 * </pre>
 *
 * <p>The difference in log wages is read as a percentage change. When the starting
 * wage is missing and the individual is at most {@value #IMPUTATION_MAX_AGE}, the
 * mean wage of high school graduates in the same state and entry age group is used
 * instead, if a {@link BaselineWageLookup} is configured. Any other missing input
 * yields {@code NaN}.
 */
public class CounterfactualWageProjector {

    private static final Logger logger = LogManager.getLogger(CounterfactualWageProjector.class);

    /** Oldest current age for which a missing starting wage is imputed. */
    public static final int IMPUTATION_MAX_AGE = 25;

    /** Years before work experience starts accumulating, on top of schooling. */
    public static final int PRESCHOOL_YEARS = 6;

    private final MincerCoefficients coefficients;
    private final BaselineWageLookup baselineWages;

    public CounterfactualWageProjector(MincerCoefficients coefficients) {
        this(coefficients, null);
    }

    /**
     * @param coefficients fitted Mincer coefficients
     * @param baselineWages mean high school graduate wages, or null to skip imputation
     */
    public CounterfactualWageProjector(MincerCoefficients coefficients, BaselineWageLookup baselineWages) {
        this.coefficients = Objects.requireNonNull(coefficients, "coefficients cannot be null");
        this.baselineWages = baselineWages;
    }

    /**
     * Predicted wage after the program had the individual not participated.
     *
     * @return the counterfactual wage, or NaN when it cannot be projected
     */
    public double predictedWage(ProgramParticipant participant) {
        return predictedWage(participant.state(), participant.priorEducation(), participant.currentAge(),
            participant.wageAtStart(), participant.yearsInProgram());
    }

    /**
     * Predicted wage after {@code yearsInProgram} years had the individual not participated.
     *
     * @param state state identifier used for imputation
     * @param priorEducation CPS EDUC code before the program
     * @param currentAge age after the program
     * @param startingWage wage before the program, NaN if unknown
     * @param yearsInProgram program length in years
     * @return the counterfactual wage, or NaN when it cannot be projected
     */
    public double predictedWage(String state, int priorEducation, int currentAge, double startingWage,
                                double yearsInProgram) {
        OptionalInt schooling = EducationLevels.yearsOfSchooling(priorEducation);
        if (schooling.isEmpty()) {
            logger.debug("no schooling mapping for EDUC code {}", priorEducation);
            return Double.NaN;
        }
        double wage = startingWage;
        if (Double.isNaN(wage) && currentAge <= IMPUTATION_MAX_AGE) {
            wage = imputedStartingWage(state, currentAge - yearsInProgram);
        }
        if (Double.isNaN(wage)) {
            return Double.NaN;
        }
        return wage * (1 + wageChange(schooling.getAsInt(), currentAge, yearsInProgram));
    }

    /**
     * Proportional wage change from experience alone over the program years.
     */
    public double wageChange(int schoolingYears, double currentAge, double yearsInProgram) {
        double experienceNow = currentAge - schoolingYears - PRESCHOOL_YEARS;
        double experienceStart = experienceNow - yearsInProgram;
        return coefficients.experienceValue(experienceNow, schoolingYears)
            - coefficients.experienceValue(experienceStart, schoolingYears);
    }

    private double imputedStartingWage(String state, double ageAtStart) {
        if (baselineWages == null) {
            return Double.NaN;
        }
        Optional<AgeGroup> group = AgeGroup.of(ageAtStart);
        if (group.isEmpty()) {
            return Double.NaN;
        }
        OptionalDouble mean = baselineWages.meanWage(state, group.get());
        if (mean.isEmpty()) {
            return Double.NaN;
        }
        logger.debug("imputed starting wage {} for state {} age group {}", mean.getAsDouble(), state,
            group.get().label());
        return mean.getAsDouble();
    }

    public MincerCoefficients coefficients() {
        return coefficients;
    }
}
