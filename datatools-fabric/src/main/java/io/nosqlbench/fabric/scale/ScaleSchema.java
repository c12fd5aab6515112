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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Ordered, validated list of the scales a fabric is built from.
///
/// ## Invariants
/// - at least one scale
/// - scale names are unique
/// - levels strictly increase in list order (fine to coarse)
///
/// The [default schema][#defaultSchema()] holds the four skin scales.
public final class ScaleSchema {

    private static final ScaleSchema DEFAULT =
        new ScaleSchema(List.of(Scale.CELLULAR, Scale.TISSUE, Scale.REGION, Scale.SYSTEM));

    private final List<Scale> scales;

    private ScaleSchema(List<Scale> scales) {
        if (scales.isEmpty()) {
            throw new IllegalArgumentException("a scale schema needs at least one scale");
        }
        Set<String> names = new HashSet<>();
        Scale previous = null;
        for (Scale scale : scales) {
            if (scale == null) {
                throw new IllegalArgumentException("scale schema cannot contain null");
            }
            if (!names.add(scale.name())) {
                throw new IllegalArgumentException("duplicate scale name: " + scale.name());
            }
            if (previous != null && scale.level() <= previous.level()) {
                throw new IllegalArgumentException("scale levels must strictly increase: "
                    + previous + " is followed by " + scale);
            }
            previous = scale;
        }
        this.scales = List.copyOf(scales);
    }

    /// Returns the four-scale skin schema: cellular, tissue, region, system.
    public static ScaleSchema defaultSchema() {
        return DEFAULT;
    }

    /// Creates a schema from scales listed fine to coarse.
    public static ScaleSchema of(Scale... scales) {
        return new ScaleSchema(Arrays.asList(scales));
    }

    /// Creates a schema from any scales, ordering them by level.
    public static ScaleSchema ofUnordered(List<Scale> scales) {
        List<Scale> sorted = new ArrayList<>(scales);
        sorted.sort((a, b) -> Integer.compare(a.level(), b.level()));
        return new ScaleSchema(sorted);
    }

    /// Scales from finest to coarsest.
    public List<Scale> scales() {
        return scales;
    }

    public int size() {
        return scales.size();
    }

    /// Looks up a scale by name.
    public Optional<Scale> find(String name) {
        for (Scale scale : scales) {
            if (scale.name().equals(name)) {
                return Optional.of(scale);
            }
        }
        return Optional.empty();
    }

    /// Looks up a scale by name.
    ///
    /// @throws UnknownScaleException if no scale has that name
    public Scale scale(String name) {
        return find(name).orElseThrow(() -> new UnknownScaleException(name));
    }

    public boolean contains(Scale scale) {
        return scales.contains(scale);
    }

    /// Verifies that a scale belongs to this schema.
    ///
    /// A scale with a known name but a different level or cardinality is
    /// still unknown here.
    ///
    /// @throws UnknownScaleException if it doesn't
    public Scale require(Scale scale) {
        if (scale == null) {
            throw new NullPointerException("scale cannot be null");
        }
        if (!scales.contains(scale)) {
            throw new UnknownScaleException(scale.name());
        }
        return scale;
    }

    /// Every ordered pair of distinct scales, in schema order of the source
    /// and then of the target.
    public List<ScalePair> orderedPairs() {
        List<ScalePair> pairs = new ArrayList<>();
        for (Scale from : scales) {
            for (Scale to : scales) {
                if (!from.equals(to)) {
                    pairs.add(new ScalePair(from, to));
                }
            }
        }
        return Collections.unmodifiableList(pairs);
    }

    /// Sum of the cardinalities of every scale.
    public int totalComponents() {
        int total = 0;
        for (Scale scale : scales) {
            total += scale.cardinality();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return scales.equals(((ScaleSchema) o).scales);
    }

    @Override
    public int hashCode() {
        return scales.hashCode();
    }

    @Override
    public String toString() {
        return "ScaleSchema" + scales;
    }
}
