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

import java.util.OptionalInt;

/// Maps CPS `EDUC` codes to years of schooling.
///
/// | EDUC code | Years |
/// |-----------|-------|
/// | 0 - 60    | 10    |
/// | 61 - 73   | 12    |
/// | 74 - 81   | 14    |
/// | 82 - 92   | 13    |
/// | 93 - 111  | 16    |
/// | 112 - 123 | 18    |
/// | 124       | 19    |
/// | 125       | 20    |
///
/// The 82 - 92 band (associate degrees) maps below the 74 - 81 band (some college);
/// this follows the coding used when the Mincer coefficients were fitted.
public final class EducationLevels {

    /** High school diploma or equivalent. */
    public static final int GED = 73;
    /** Bachelor's degree. */
    public static final int BA = 111;
    /** Master's degree. */
    public static final int MA = 123;
    /** Doctorate. */
    public static final int PHD = 125;

    private static final int[] UPPER_BOUNDS = {60, 73, 81, 92, 111, 123, 124, 125};
    private static final int[] YEARS = {10, 12, 14, 13, 16, 18, 19, 20};

    private EducationLevels() {}

    /// @param educCode a CPS `EDUC` code
    /// @return years of schooling, empty for codes outside 0 - 125
    public static OptionalInt yearsOfSchooling(int educCode) {
        if (educCode < 0) {
            return OptionalInt.empty();
        }
        for (int i = 0; i < UPPER_BOUNDS.length; i++) {
            if (educCode <= UPPER_BOUNDS[i]) {
                return OptionalInt.of(YEARS[i]);
            }
        }
        return OptionalInt.empty();
    }
}
