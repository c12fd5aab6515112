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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable metadata attached to a fabric component.
///
/// ## Content
///
/// An open, ordered map from string keys to JSON-compatible values:
/// strings, numbers, booleans, null, lists and maps of those. The keys in
/// [MetadataKeys] have documented meaning; any other key is allowed.
///
/// Numbers are normalized on the way in: integral types become `Long` and
/// everything else becomes `Double`. This is the same shape a snapshot load
/// produces, so metadata compares equal across save and load.
///
/// ## Usage
///
/// ```java
/// ComponentMetadata meta = ComponentMetadata.builder()
///     .name("keratinocyte")
///     .put(MetadataKeys.TYPE, "cell")
///     .build();
/// meta.name();                         // Optional[keratinocyte]
/// meta.with(MetadataKeys.DESCRIPTION, "outer layer cell");
/// ```
public final class ComponentMetadata {

    /// Metadata with no entries.
    public static final ComponentMetadata EMPTY = new ComponentMetadata(Collections.emptyMap());

    private final Map<String, Object> values;

    private ComponentMetadata(Map<String, Object> values) {
        this.values = values;
    }

    /// Creates metadata from a map, validating and copying every value.
    ///
    /// @param map source entries, may be null for empty metadata
    /// @return metadata holding a deep copy of the entries
    /// @throws IllegalArgumentException if a value is not JSON-compatible
    public static ComponentMetadata of(Map<String, ?> map) {
        if (map == null || map.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("metadata keys cannot be null");
            }
            copy.put(entry.getKey(), normalize(entry.getValue(), entry.getKey()));
        }
        return new ComponentMetadata(Collections.unmodifiableMap(copy));
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a value, or null when absent.
    public Object get(String key) {
        return values.get(key);
    }

    /// Returns a value as a string, if present and a string.
    public Optional<String> getString(String key) {
        Object value = values.get(key);
        return value instanceof String ? Optional.of((String) value) : Optional.empty();
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /// The [MetadataKeys#NAME] entry.
    public Optional<String> name() {
        return getString(MetadataKeys.NAME);
    }

    /// The [MetadataKeys#DESCRIPTION] entry.
    public Optional<String> description() {
        return getString(MetadataKeys.DESCRIPTION);
    }

    /// Returns a copy with one entry added or replaced.
    public ComponentMetadata with(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(values);
        next.put(key, value);
        return of(next);
    }

    /// Returns a copy with `other`'s entries laid over this one's.
    public ComponentMetadata merge(ComponentMetadata other) {
        Map<String, Object> next = new LinkedHashMap<>(values);
        next.putAll(other.values);
        return of(next);
    }

    /// Read-only view of the entries.
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    private static Object normalize(Object value, String path) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) {
                throw new IllegalArgumentException("metadata value at '" + path + "' is not finite: " + value);
            }
            return d;
        }
        if (value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Map<?, ?>) {
            Map<String, Object> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new IllegalArgumentException("metadata map keys must be strings at '" + path + "'");
                }
                String key = (String) entry.getKey();
                nested.put(key, normalize(entry.getValue(), path + "." + key));
            }
            return Collections.unmodifiableMap(nested);
        }
        if (value instanceof Iterable<?>) {
            List<Object> nested = new ArrayList<>();
            int i = 0;
            for (Object item : (Iterable<?>) value) {
                nested.add(normalize(item, path + "[" + i++ + "]"));
            }
            return Collections.unmodifiableList(nested);
        }
        throw new IllegalArgumentException("metadata value at '" + path + "' is not JSON-compatible: "
            + value.getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((ComponentMetadata) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "ComponentMetadata" + values;
    }

    /// Builder for [ComponentMetadata].
    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder name(String name) {
            return put(MetadataKeys.NAME, name);
        }

        public Builder description(String description) {
            return put(MetadataKeys.DESCRIPTION, description);
        }

        public Builder put(String key, Object value) {
            values.put(Objects.requireNonNull(key, "key cannot be null"), value);
            return this;
        }

        public Builder putAll(Map<String, ?> entries) {
            entries.forEach(this::put);
            return this;
        }

        public ComponentMetadata build() {
            return ComponentMetadata.of(values);
        }
    }
}
