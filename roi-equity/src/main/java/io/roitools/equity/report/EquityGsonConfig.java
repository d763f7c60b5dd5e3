package io.roitools.equity.report;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for equity reports.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable reports |
/// | Serialize nulls | Disabled | Omits the residual of exact indices |
/// | HTML escaping | Disabled | Group labels such as `A&B` stay readable |
/// | Special floats | Enabled | A ratio of NaN (zero overall inequality) survives the round trip |
///
/// ## Thread Safety
///
/// The [Gson] instances are thread-safe and can be shared.
public final class EquityGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();

    private EquityGsonConfig() {
        // Utility class
    }

    /// @return the shared pretty-printing Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with the equity defaults, without pretty printing.
    ///
    /// @return a new GsonBuilder
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }

    /// Creates a compact Gson instance, one report per line.
    ///
    /// @return a compact Gson instance
    public static Gson compactGson() {
        return builder().create();
    }
}
