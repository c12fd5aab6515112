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

import io.nosqlbench.fabric.UnknownScaleException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Owns one [EmbeddingStore] per scale and resolves scale-qualified addresses.
///
/// Stores are created once, in schema order, and never replaced.
public final class ScaleRegistry {

    private final ScaleSchema schema;
    private final int dimension;
    private final Map<Scale, EmbeddingStore> stores;

    /// Creates a registry of zero-initialized stores.
    ///
    /// @param schema the scales to hold
    /// @param dimension the embedding dimension shared by every scale
    public ScaleRegistry(ScaleSchema schema, int dimension) {
        this.schema = Objects.requireNonNull(schema, "schema cannot be null");
        this.dimension = dimension;
        Map<Scale, EmbeddingStore> byScale = new LinkedHashMap<>();
        for (Scale scale : schema.scales()) {
            byScale.put(scale, new EmbeddingStore(scale, dimension));
        }
        this.stores = Collections.unmodifiableMap(byScale);
    }

    public ScaleSchema schema() {
        return schema;
    }

    public int dimension() {
        return dimension;
    }

    /// Returns the store for a scale.
    ///
    /// @throws UnknownScaleException if the scale is not in this registry's schema
    public EmbeddingStore store(Scale scale) {
        Objects.requireNonNull(scale, "scale cannot be null");
        EmbeddingStore store = stores.get(scale);
        if (store == null) {
            throw new UnknownScaleException(scale.name());
        }
        return store;
    }

    /// Returns the store for a scale name.
    public EmbeddingStore store(String scaleName) {
        return store(schema.scale(scaleName));
    }

    /// All stores in schema order.
    public Collection<EmbeddingStore> stores() {
        return stores.values();
    }
}
