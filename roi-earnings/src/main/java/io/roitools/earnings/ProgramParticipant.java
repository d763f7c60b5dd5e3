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

/// One individual's record from an education or training program.
///
/// @param id caller-assigned identifier
/// @param state state identifier
/// @param priorEducation CPS `EDUC` code before entering the program
/// @param programStartYear year the program started
/// @param programEndYear year the program ended
/// @param wageAtStart annual wage before the program, NaN if unknown
/// @param wageAtEnd annual wage after the program, NaN if unknown
/// @param currentAge age after the program
public record ProgramParticipant(
    String id,
    String state,
    int priorEducation,
    int programStartYear,
    int programEndYear,
    double wageAtStart,
    double wageAtEnd,
    int currentAge
) {

    /// @return years spent in the program
    public int yearsInProgram() {
        return programEndYear - programStartYear;
    }
}
