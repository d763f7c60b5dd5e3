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

/// One individual's enrollment in a program.
///
/// @param id caller-assigned identifier
/// @param program program identifier
/// @param entryYear year of entry
/// @param exitYear year of exit, whether or not the program was completed
/// @param completed true if the program was completed
public record Enrollment(String id, String program, int entryYear, int exitYear, boolean completed) {

    /// @return years between entry and exit
    public int yearsEnrolled() {
        return exitYear - entryYear;
    }
}
