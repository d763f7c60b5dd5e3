package io.roitools.equity;

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

/// Thrown from a metric's calculation when the observations fall outside the domain
/// on which the index is defined. No partial result is stored when this is raised.
public class DomainException extends EquityException {

    private final String mnemonic;

    public DomainException(String mnemonic, String message) {
        super(mnemonic + ": " + message);
        this.mnemonic = mnemonic;
    }

    /// @return the mnemonic of the index that rejected the input
    public String getMnemonic() {
        return mnemonic;
    }
}
