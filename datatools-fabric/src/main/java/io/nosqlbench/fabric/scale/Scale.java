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

import java.util.Objects;

/// One hierarchical level of component granularity.
///
/// A scale is a value: two scales are equal when name, level and cardinality
/// all match. Lower levels are finer grained. The default schema uses the
/// four skin scales declared here.
///
/// | Scale | Level | Cardinality |
/// |-------|-------|-------------|
/// | [#CELLULAR] | 1 | 1000 |
/// | [#TISSUE] | 2 | 50 |
/// | [#REGION] | 3 | 20 |
/// | [#SYSTEM] | 4 | 5 |
///
/// @param name unique, non-blank scale name
/// @param level ordering level, finer scales have lower levels
/// @param cardinality fixed number of components at this scale
public record Scale(String name, int level, int cardinality) {

    /// Microscopic units: cells, proteins, molecular structures.
    public static final Scale CELLULAR = new Scale("cellular", 1, 1000);
    /// Dermal layers.
    public static final Scale TISSUE = new Scale("tissue", 2, 50);
    /// Body regions.
    public static final Scale REGION = new Scale("region", 3, 20);
    /// Whole-body functions.
    public static final Scale SYSTEM = new Scale("system", 4, 5);

    public Scale {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("scale name cannot be blank");
        }
        if (name.contains("->")) {
            throw new IllegalArgumentException("scale name cannot contain '->': " + name);
        }
        if (cardinality < 1) {
            throw new IllegalArgumentException("cardinality must be at least 1 for scale '" + name + "', got " + cardinality);
        }
    }

    /// Creates a scale.
    public static Scale of(String name, int level, int cardinality) {
        return new Scale(name, level, cardinality);
    }

    /// Whether a component id is valid at this scale.
    public boolean contains(int componentId) {
        return componentId >= 0 && componentId < cardinality;
    }

    @Override
    public String toString() {
        return name + "(L" + level + ", n=" + cardinality + ")";
    }
}
