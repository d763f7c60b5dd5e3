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

import java.util.OptionalDouble;

/// Source of mean annual wages for high school graduates by state and age group,
/// used to fill in a missing starting wage for young program entrants.
@FunctionalInterface
public interface BaselineWageLookup {

    /// @param state state identifier, e.g. a FIPS code
    /// @param ageGroup age group at program entry
    /// @return the mean wage, or empty if none is known
    OptionalDouble meanWage(String state, AgeGroup ageGroup);
}
