package io.nosqlbench.fabric.propagate;

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
import io.nosqlbench.fabric.transform.CrossScaleTransformer;
import io.nosqlbench.fabric.vector.VectorUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Diffuses an activation from one component into every component of a
/// target scale.
///
/// ## Algorithm
///
/// ```text
///   source embedding ──transform(from,to)──► t
///   for each target component j:
///       activation[j] = strength × max(0, cos(t, embedding[j]))
/// ```
///
/// Propagation is excitatory only: negative similarity contributes zero.
/// Activations are independent per target; they are not normalized and do
/// not form a distribution. A target identical in direction to `t` receives
/// exactly `strength`.
public final class SignalPropagator {

    private final ScaleRegistry registry;
    private final CrossScaleTransformer transformer;

    public SignalPropagator(ScaleRegistry registry, CrossScaleTransformer transformer) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.transformer = Objects.requireNonNull(transformer, "transformer cannot be null");
    }

    /// Propagates a signal from `(sourceScale, sourceId)` into `targetScale`.
    ///
    /// @param sourceScale scale of the source component
    /// @param sourceId id of the source component
    /// @param targetScale scale receiving the activation
    /// @param strength non-negative signal strength
    /// @return one activation per target component, keyed and ordered by id
    /// @throws io.nosqlbench.fabric.MissingTransformException if the pair has no matrix
    public Map<Integer, Double> propagate(Scale sourceScale, int sourceId, Scale targetScale, double strength) {
        if (!(strength >= 0.0) || !Double.isFinite(strength)) {
            throw new IllegalArgumentException("strength must be finite and non-negative, got " + strength);
        }
        EmbeddingStore targetStore = registry.store(targetScale);
        float[] source = registry.store(sourceScale).get(sourceId);
        float[] transformed = transformer.transform(source, sourceScale, targetScale);

        Map<Integer, Double> activations = new LinkedHashMap<>();
        targetStore.forEach((id, embedding) -> {
            double similarity = VectorUtils.cosineSimilarity(transformed, embedding);
            activations.put(id, strength * Math.max(0.0, similarity));
        });
        return Collections.unmodifiableMap(activations);
    }
}
