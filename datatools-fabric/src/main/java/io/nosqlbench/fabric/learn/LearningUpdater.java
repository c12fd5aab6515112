package io.nosqlbench.fabric.learn;

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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/// Pulls component embeddings toward observed vectors.
///
/// ## Update Rule
///
/// ```text
///   embedding ← embedding + rate × (observation − embedding)
/// ```
///
/// An exponential moving average toward the observation: each step shrinks
/// the distance to the observation by the factor `(1 − rate)`. Rate 1
/// replaces the embedding with the observation, rate 0 leaves it unchanged.
///
/// Each update is a single read-modify-write under the store's write lock.
public final class LearningUpdater {

    private static final Logger logger = LogManager.getLogger(LearningUpdater.class);

    private final ScaleRegistry registry;
    private final double defaultRate;

    /// @param registry the stores to update
    /// @param defaultRate rate used when none is given, in [0, 1]
    public LearningUpdater(ScaleRegistry registry, double defaultRate) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.defaultRate = requireRate(defaultRate);
    }

    public double defaultRate() {
        return defaultRate;
    }

    /// Updates one component with the default rate.
    public float[] updateFromObservation(Scale scale, int id, float[] observation) {
        return updateFromObservation(scale, id, observation, defaultRate);
    }

    /// Moves one component's embedding toward an observation.
    ///
    /// @param scale the component's scale
    /// @param id the component's id
    /// @param observation the observed vector, length D
    /// @param rate step size in [0, 1]
    /// @return a copy of the updated embedding
    public float[] updateFromObservation(Scale scale, int id, float[] observation, double rate) {
        requireRate(rate);
        EmbeddingStore store = registry.store(scale);
        VectorUtils.requireDimension(observation, store.dimension());
        VectorUtils.requireFinite(observation, "observation");
        float[] target = observation.clone();
        return store.update(id, current -> blend(current, target, rate));
    }

    /// Applies a batch of observations, checking a cancellation flag between
    /// components.
    ///
    /// Every observation is validated before the first is applied, so an
    /// invalid entry fails the batch without touching the fabric. A
    /// cancelled batch keeps the updates already applied.
    ///
    /// @param observations the observations, applied in order
    /// @param rate step size in [0, 1]
    /// @param cancelled polled before each update; true stops the batch
    /// @return the number of observations applied
    public int updateBatch(List<Observation> observations, double rate, BooleanSupplier cancelled) {
        requireRate(rate);
        Objects.requireNonNull(cancelled, "cancelled cannot be null");
        for (Observation observation : observations) {
            EmbeddingStore store = registry.store(observation.scale());
            store.checkIndex(observation.componentId());
            float[] values = observation.values();
            VectorUtils.requireDimension(values, store.dimension());
            VectorUtils.requireFinite(values, "observation");
        }
        int applied = 0;
        for (Observation observation : observations) {
            if (cancelled.getAsBoolean()) {
                logger.warn("Batch update cancelled after {} of {} observations", applied, observations.size());
                return applied;
            }
            float[] target = observation.values();
            registry.store(observation.scale())
                .update(observation.componentId(), current -> blend(current, target, rate));
            applied++;
        }
        logger.debug("Applied {} observations at rate {}", applied, rate);
        return applied;
    }

    static float[] blend(float[] current, float[] observation, double rate) {
        if (rate == 0.0) {
            return current;
        }
        if (rate == 1.0) {
            return observation.clone();
        }
        float[] next = new float[current.length];
        for (int i = 0; i < current.length; i++) {
            next[i] = (float) (current[i] + rate * ((double) observation[i] - current[i]));
        }
        return next;
    }

    private static double requireRate(double rate) {
        if (!(rate >= 0.0 && rate <= 1.0)) {
            throw new IllegalArgumentException("learning rate must be in [0, 1], got " + rate);
        }
        return rate;
    }
}
