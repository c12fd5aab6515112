package io.nosqlbench.fabric.similarity;

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

import io.nosqlbench.fabric.scale.EmbeddingStore;
import io.nosqlbench.fabric.scale.Scale;
import io.nosqlbench.fabric.scale.ScaleRegistry;
import io.nosqlbench.fabric.vector.VectorUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Cosine-similarity ranking within a single scale.
///
/// Search is exhaustive: every component of the scale is scored. Scales are
/// small (at most a few thousand components) so no approximate index is kept.
///
/// ## Ordering
/// Results are sorted by descending score; equal scores are ordered by
/// ascending id, so results are deterministic.
///
/// ## Degenerate vectors
/// A zero (or near-zero) query or component scores 0.0 rather than NaN and is
/// ranked like any other component.
public final class SimilarityIndex {

    private final ScaleRegistry registry;

    public SimilarityIndex(ScaleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    /// Cosine similarity with the zero-norm fallback of 0.0.
    ///
    /// @see VectorUtils#cosineSimilarity(float[], float[])
    public static double cosineSimilarity(float[] u, float[] v) {
        return VectorUtils.cosineSimilarity(u, v);
    }

    /// Ranks the components of a scale by similarity to a query vector.
    ///
    /// @param vector query of length D
    /// @param scale the scale to search
    /// @param topK how many results to return; values above the cardinality
    ///     are truncated to it
    /// @return `min(topK, cardinality)` matches, best first
    /// @throws IllegalArgumentException if topK is less than 1
    public List<SimilarityMatch> query(float[] vector, Scale scale, int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1, got " + topK);
        }
        EmbeddingStore store = registry.store(scale);
        VectorUtils.requireDimension(vector, store.dimension());
        VectorUtils.requireFinite(vector, "query vector");
        List<SimilarityMatch> all = new ArrayList<>(store.count());
        store.forEach((id, embedding) -> all.add(new SimilarityMatch(id, VectorUtils.cosineSimilarity(vector, embedding))));
        all.sort(SimilarityMatch.RANKING);
        int limit = Math.min(topK, all.size());
        return Collections.unmodifiableList(new ArrayList<>(all.subList(0, limit)));
    }

    /// Cosine similarity between two components of the same scale.
    public double similarity(Scale scale, int a, int b) {
        EmbeddingStore store = registry.store(scale);
        return VectorUtils.cosineSimilarity(store.get(a), store.get(b));
    }
}
