package io.nosqlbench.fabric.persist;

/*
 * Copyright (c) nosqlbench
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
import com.google.gson.ToNumberPolicy;

/// Shared Gson configuration for fabric snapshots.
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled (`gson()`) | Human-readable snapshots |
/// | Serialize nulls | Enabled | Null metadata values survive a round trip |
/// | HTML escaping | Disabled | Metadata strings written as-is |
/// | Untyped numbers | `LONG_OR_DOUBLE` | Integral metadata reads back as `Long` |
///
/// The compact instance is used for checksums, so checksum input does not
/// depend on whitespace.
///
/// Both instances are thread-safe and shared.
public final class FabricGsonConfig {

    private static final Gson PRETTY = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private FabricGsonConfig() {
        // Utility class
    }

    /// Returns the pretty-printing Gson used for snapshot files.
    public static Gson gson() {
        return PRETTY;
    }

    /// Returns a compact Gson with the same settings.
    public static Gson compactGson() {
        return COMPACT;
    }

    /// Creates a new GsonBuilder with fabric defaults.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE);
    }
}
