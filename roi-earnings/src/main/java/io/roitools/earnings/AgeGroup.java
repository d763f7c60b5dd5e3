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

import java.util.Optional;

/// Age bands used to match individuals to mean wages of comparable workers.
/// Each band includes its upper bound.
public enum AgeGroup {
    UNDER_19("18 and under", 0, 18),
    AGE_19_25("19-25", 18, 25),
    AGE_26_34("26-34", 25, 34),
    AGE_35_54("35-54", 34, 54),
    AGE_55_64("55-64", 54, 64),
    AGE_65_PLUS("65+", 64, 150);

    private final String label;
    private final double lowerExclusive;
    private final double upperInclusive;

    AgeGroup(String label, double lowerExclusive, double upperInclusive) {
        this.label = label;
        this.lowerExclusive = lowerExclusive;
        this.upperInclusive = upperInclusive;
    }

    public String label() {
        return label;
    }

    /// @param age age in years
    /// @return the band containing the age, empty outside (0, 150]
    public static Optional<AgeGroup> of(double age) {
        for (AgeGroup group : values()) {
            if (age > group.lowerExclusive && age <= group.upperInclusive) {
                return Optional.of(group);
            }
        }
        return Optional.empty();
    }
}
