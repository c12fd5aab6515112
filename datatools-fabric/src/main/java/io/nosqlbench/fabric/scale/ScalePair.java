package io.nosqlbench.fabric.scale;

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

import io.nosqlbench.fabric.SchemaException;

import java.util.Objects;

/// An ordered pair of distinct scales, the key of a transform matrix.
///
/// `(a, b)` and `(b, a)` are different pairs with independent matrices.
///
/// @param from the source scale
/// @param to the target scale
public record ScalePair(Scale from, Scale to) {

    /// Separator used in snapshot keys, as in `cellular->tissue`.
    public static final String SEPARATOR = "->";

    public ScalePair {
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(to, "to cannot be null");
        if (from.equals(to)) {
            throw new IllegalArgumentException("transform pair requires distinct scales, got " + from.name() + " twice");
        }
    }

    public static ScalePair of(Scale from, Scale to) {
        return new ScalePair(from, to);
    }

    /// Returns the pair in the opposite direction.
    public ScalePair reversed() {
        return new ScalePair(to, from);
    }

    /// Returns the snapshot key for this pair.
    public String key() {
        return from.name() + SEPARATOR + to.name();
    }

    /// Parses a snapshot key against a schema.
    ///
    /// @param key a key like `cellular->tissue`
    /// @param schema the schema that must contain both scales
    /// @return the pair
    /// @throws SchemaException if the key is malformed, names an unknown
    ///     scale, or names the same scale twice
    public static ScalePair parse(String key, ScaleSchema schema) {
        int at = key == null ? -1 : key.indexOf(SEPARATOR);
        if (at <= 0 || at + SEPARATOR.length() >= key.length()) {
            throw new SchemaException("Malformed transform key: " + key);
        }
        String fromName = key.substring(0, at);
        String toName = key.substring(at + SEPARATOR.length());
        Scale from = schema.find(fromName)
            .orElseThrow(() -> new SchemaException("Transform key '" + key + "' names unknown scale " + fromName));
        Scale to = schema.find(toName)
            .orElseThrow(() -> new SchemaException("Transform key '" + key + "' names unknown scale " + toName));
        if (from.equals(to)) {
            throw new SchemaException("Transform key '" + key + "' names the same scale twice");
        }
        return new ScalePair(from, to);
    }

    @Override
    public String toString() {
        return key();
    }
}
