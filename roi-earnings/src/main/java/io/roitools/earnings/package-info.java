/// Earnings premium of education and training programs.
///
/// A program's premium for one participant is the wage observed after the program
/// minus the wage projected without it, from pre-computed Mincer coefficients. The
/// resulting premiums are grouped into an [io.roitools.equity.GroupedSample] and
/// decomposed like any other quantity.
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
