package io.nosqlbench.fabric.integration;

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

import io.nosqlbench.fabric.ComponentIndexException;
import io.nosqlbench.fabric.EmbeddingFabric;
import io.nosqlbench.fabric.scale.Scale;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Splits an attention budget across components in proportion to activation.
///
/// ## Allocation
///
/// ```text
///   total          = Σ over scales Σ |a|
///   scale budget   = budget × Σ|a_scale| / total
///   component j    = scale budget × |a_j| / Σ|a_scale|
/// ```
///
/// When every activation is zero (or none is given) the budget is spread
/// uniformly over every component of every scale in the fabric. Otherwise
/// scales with zero total activation receive nothing and are absent from
/// the result.
public final class AttentionAllocator {

    private final EmbeddingFabric fabric;

    public AttentionAllocator(EmbeddingFabric fabric) {
        this.fabric = Objects.requireNonNull(fabric, "fabric cannot be null");
    }

    /// Allocates a budget across dense activation arrays.
    ///
    /// @param activations per-scale activations, each of the scale's cardinality
    /// @param budget total attention, finite and non-negative
    /// @return per-scale, per-component attention in schema and id order
    /// @throws IllegalArgumentException if an array has the wrong length or a
    ///     non-finite value
    public Map<Scale, Map<Integer, Double>> allocate(Map<Scale, double[]> activations, double budget) {
        Objects.requireNonNull(activations, "activations cannot be null");
        if (!(budget >= 0.0) || !Double.isFinite(budget)) {
            throw new IllegalArgumentException("budget must be finite and non-negative, got " + budget);
        }
        for (Scale scale : activations.keySet()) {
            fabric.config().schema().require(scale);
        }
        double total = 0.0;
        Map<Scale, double[]> ordered = new LinkedHashMap<>();
        for (Scale scale : fabric.scales()) {
            double[] values = activations.get(scale);
            if (values == null) {
                continue;
            }
            if (values.length != scale.cardinality()) {
                throw new IllegalArgumentException("activations for " + scale.name() + " have length "
                    + values.length + ", expected " + scale.cardinality());
            }
            for (double v : values) {
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("activations for " + scale.name() + " contain " + v);
                }
                total += Math.abs(v);
            }
            ordered.put(scale, values);
        }

        Map<Scale, Map<Integer, Double>> allocation = new LinkedHashMap<>();
        if (total == 0.0) {
            double uniform = budget / fabric.config().schema().totalComponents();
            for (Scale scale : fabric.scales()) {
                Map<Integer, Double> perComponent = new LinkedHashMap<>();
                for (int id = 0; id < scale.cardinality(); id++) {
                    perComponent.put(id, uniform);
                }
                allocation.put(scale, Collections.unmodifiableMap(perComponent));
            }
            return Collections.unmodifiableMap(allocation);
        }
        for (Map.Entry<Scale, double[]> entry : ordered.entrySet()) {
            double[] values = entry.getValue();
            double scaleSum = 0.0;
            for (double v : values) {
                scaleSum += Math.abs(v);
            }
            if (scaleSum == 0.0) {
                continue;
            }
            double scaleBudget = budget * scaleSum / total;
            Map<Integer, Double> perComponent = new LinkedHashMap<>();
            for (int id = 0; id < values.length; id++) {
                perComponent.put(id, scaleBudget * Math.abs(values[id]) / scaleSum);
            }
            allocation.put(entry.getKey(), Collections.unmodifiableMap(perComponent));
        }
        return Collections.unmodifiableMap(allocation);
    }

    /// Allocates a budget across sparse activations such as
    /// [EmbeddingFabric#propagateSignal] results. Missing ids count as zero.
    ///
    /// @throws ComponentIndexException if an id is out of range
    public Map<Scale, Map<Integer, Double>> allocateFromPropagation(Map<Scale, Map<Integer, Double>> activations,
                                                                    double budget) {
        Objects.requireNonNull(activations, "activations cannot be null");
        Map<Scale, double[]> dense = new LinkedHashMap<>();
        for (Map.Entry<Scale, Map<Integer, Double>> entry : activations.entrySet()) {
            Scale scale = fabric.config().schema().require(entry.getKey());
            double[] values = new double[scale.cardinality()];
            for (Map.Entry<Integer, Double> activation : entry.getValue().entrySet()) {
                int id = activation.getKey();
                if (!scale.contains(id)) {
                    throw new ComponentIndexException(scale.name(), id, scale.cardinality());
                }
                values[id] = activation.getValue();
            }
            dense.put(scale, values);
        }
        return allocate(dense, budget);
    }
}
