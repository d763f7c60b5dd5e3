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

/// Employment status of one individual at program entry and exit.
///
/// @param id caller-assigned identifier
/// @param program program identifier
/// @param employedAtStart employed when entering the program, null if unknown
/// @param employedAtEnd employed after the program, null if unknown
public record EmploymentRecord(String id, String program, Boolean employedAtStart, Boolean employedAtEnd) {
}
