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

import io.nosqlbench.fabric.scale.DefaultComponentCatalog;
import io.nosqlbench.fabric.scale.EmbeddingStore;
import io.nosqlbench.fabric.scale.ScaleRegistry;
import io.nosqlbench.fabric.transform.CrossScaleTransformer;
import io.nosqlbench.fabric.vector.GaussianInitializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Creates initialized fabrics.
///
/// ## Initialization Order
///
/// ```text
///   1. every embedding ~ N(0, init_std²), scales in schema order
///   2. default catalog metadata for the skin scales
///   3. transform matrices per TransformInit, pairs in schema order
/// ```
///
/// With a seed the whole sequence draws from one generator, so two fabrics
/// created from the same configuration are identical.
public final class FabricFactory {

    private static final Logger logger = LogManager.getLogger(FabricFactory.class);

    private FabricFactory() {
        // Utility class
    }

    /// Creates a fabric with the default configuration (D=128, std 0.01).
    public static EmbeddingFabric createFabric() {
        return createFabric(FabricConfig.defaults());
    }

    /// Creates a fabric of the given dimension with the default init std.
    public static EmbeddingFabric createFabric(int dimension) {
        return createFabric(FabricConfig.builder().dimension(dimension).build());
    }

    /// Creates a fabric of the given dimension and init std.
    ///
    /// @throws IllegalArgumentException if dimension < 1 or initStd is not
    ///     positive and finite
    public static EmbeddingFabric createFabric(int dimension, double initStd) {
        return createFabric(FabricConfig.builder().dimension(dimension).initStd(initStd).build());
    }

    /// Creates a fabric from a full configuration.
    public static EmbeddingFabric createFabric(FabricConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        GaussianInitializer initializer = new GaussianInitializer(config.initStd(), config.seed());

        ScaleRegistry registry = new ScaleRegistry(config.schema(), config.dimension());
        for (EmbeddingStore store : registry.stores()) {
            store.initialize(initializer);
        }
        int annotated = DefaultComponentCatalog.apply(registry);

        CrossScaleTransformer transformer = new CrossScaleTransformer(config.schema(), config.dimension());
        transformer.initialize(config.transformInit(), initializer);

        logger.info("Created fabric: D={}, {} scales, {} components ({} annotated), {} transforms ({})",
            config.dimension(), config.schema().size(), config.schema().totalComponents(),
            annotated, transformer.pairs().size(), config.transformInit());
        return new EmbeddingFabric(config, registry, transformer);
    }
}
