package io.nosqlbench.fabric;

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
import io.nosqlbench.fabric.scale.ScaleRegistry;
import io.nosqlbench.fabric.transform.CrossScaleTransformer;
import io.nosqlbench.fabric.vector.VectorUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Summary of a fabric's state: per-scale embedding norm statistics, the
/// number of registered transforms and the registered collaborators.
public final class FabricStatistics {

    private final int dimension;
    private final List<ScaleStatistics> scales;
    private final int transformCount;
    private final List<String> integrations;

    private FabricStatistics(int dimension, List<ScaleStatistics> scales, int transformCount,
                             List<String> integrations) {
        this.dimension = dimension;
        this.scales = Collections.unmodifiableList(scales);
        this.transformCount = transformCount;
        this.integrations = integrations;
    }

    static FabricStatistics compute(ScaleRegistry registry, CrossScaleTransformer transformer,
                                    IntegrationRegistry integrations) {
        List<ScaleStatistics> perScale = new ArrayList<>();
        for (EmbeddingStore store : registry.stores()) {
            double[] norms = new double[store.count()];
            store.forEach((id, embedding) -> norms[id] = VectorUtils.norm(embedding));
            perScale.add(new ScaleStatistics(store.scale().name(), store.scale().level(), store.count(),
                VectorUtils.computeStatistics(norms)));
        }
        return new FabricStatistics(registry.dimension(), perScale, transformer.pairs().size(),
            integrations.names());
    }

    public int dimension() {
        return dimension;
    }

    public List<ScaleStatistics> scales() {
        return scales;
    }

    public int transformCount() {
        return transformCount;
    }

    /// Names of the registered collaborators, in registration order.
    public List<String> integrations() {
        return integrations;
    }

    public int totalComponents() {
        int total = 0;
        for (ScaleStatistics s : scales) {
            total += s.count();
        }
        return total;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("FabricStatistics[D=").append(dimension)
            .append(", components=").append(totalComponents())
            .append(", transforms=").append(transformCount)
            .append(", integrations=").append(integrations).append("]");
        for (ScaleStatistics s : scales) {
            sb.append("\n  ").append(s);
        }
        return sb.toString();
    }

    /// Norm statistics for one scale.
    ///
    /// @param name scale name
    /// @param level hierarchy level
    /// @param count number of components
    /// @param norms statistics of the L2 norms of the scale's embeddings
    public record ScaleStatistics(String name, int level, int count, VectorUtils.Statistics norms) {
        @Override
        public String toString() {
            return String.format("%s(L%d): count=%d, norm mean=%.6f std=%.6f min=%.6f max=%.6f",
                name, level, count, norms.mean, norms.stdDev, norms.min, norms.max);
        }
    }
}
