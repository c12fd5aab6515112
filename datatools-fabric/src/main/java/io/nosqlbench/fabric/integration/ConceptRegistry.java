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

import io.nosqlbench.fabric.EmbeddingFabric;
import io.nosqlbench.fabric.FabricException;
import io.nosqlbench.fabric.scale.ComponentMetadata;
import io.nosqlbench.fabric.scale.MetadataKeys;
import io.nosqlbench.fabric.scale.Scale;
import io.nosqlbench.fabric.similarity.SimilarityMatch;
import io.nosqlbench.fabric.vector.VectorUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/// Binds named concepts to fabric components.
///
/// A binding is nothing more than a `concept_name` metadata entry, so
/// bindings survive save and load without any extra state:
///
/// ```text
///   bind("inflammation", tissue)
///     ├─ component with concept_name == "inflammation"? ──► reuse its id
///     └─ otherwise claim the lowest id without concept_name
///          metadata ← {concept_name, source: knowledge_mapping, type: knowledge_concept}
///          embedding ← features (if given)
/// ```
///
/// Claiming a component is a single atomic metadata update, so registries
/// sharing a fabric never bind two concepts to one component.
public final class ConceptRegistry {

    private static final Logger logger = LogManager.getLogger(ConceptRegistry.class);

    /// Value of the `source` key on claimed components.
    public static final String SOURCE = "knowledge_mapping";
    /// Value of the `type` key on claimed components.
    public static final String CONCEPT_TYPE = "knowledge_concept";

    private final EmbeddingFabric fabric;

    public ConceptRegistry(EmbeddingFabric fabric) {
        this.fabric = Objects.requireNonNull(fabric, "fabric cannot be null");
    }

    /// Binds a concept without changing the component's embedding.
    public int bind(String conceptName, Scale scale) {
        return bind(conceptName, scale, null);
    }

    /// Binds a concept to a component of `scale`, reusing an existing binding.
    ///
    /// @param conceptName the concept's name
    /// @param scale the scale to bind at
    /// @param features embedding for a newly claimed component, or null to
    ///     keep its current embedding; ignored for existing bindings
    /// @return the bound component id
    /// @throws FabricException if every component of the scale is already bound
    /// @throws io.nosqlbench.fabric.DimensionMismatchException if features
    ///     has the wrong length
    public int bind(String conceptName, Scale scale, float[] features) {
        requireName(conceptName);
        OptionalInt existing = lookup(conceptName, scale);
        if (existing.isPresent()) {
            return existing.getAsInt();
        }
        if (features != null) {
            VectorUtils.requireDimension(features, fabric.dimension());
            VectorUtils.requireFinite(features, "concept features");
        }
        ComponentMetadata binding = ComponentMetadata.builder()
            .put(MetadataKeys.CONCEPT_NAME, conceptName)
            .put(MetadataKeys.SOURCE, SOURCE)
            .put(MetadataKeys.TYPE, CONCEPT_TYPE)
            .build();
        for (int id = 0; id < scale.cardinality(); id++) {
            ComponentMetadata stored = fabric.updateMetadata(scale, id,
                current -> current.containsKey(MetadataKeys.CONCEPT_NAME) ? current : binding);
            if (stored == binding) {
                if (features != null) {
                    fabric.setEmbedding(scale, id, features);
                }
                logger.debug("Bound concept '{}' to {}[{}]", conceptName, scale.name(), id);
                return id;
            }
            if (stored.getString(MetadataKeys.CONCEPT_NAME).filter(conceptName::equals).isPresent()) {
                return id;
            }
        }
        throw new FabricException("No free component at scale " + scale.name() + " for concept '" + conceptName + "'");
    }

    /// Finds the component bound to a concept.
    public OptionalInt lookup(String conceptName, Scale scale) {
        requireName(conceptName);
        for (int id = 0; id < scale.cardinality(); id++) {
            if (fabric.getMetadata(scale, id).getString(MetadataKeys.CONCEPT_NAME)
                .filter(conceptName::equals).isPresent()) {
                return OptionalInt.of(id);
            }
        }
        return OptionalInt.empty();
    }

    /// Describes a bound concept: its embedding, metadata and the `k`
    /// components most similar to it, excluding itself.
    ///
    /// @throws FabricException if the concept is not bound at this scale
    public ConceptDescription describe(String conceptName, Scale scale, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be non-negative, got " + k);
        }
        int id = lookup(conceptName, scale)
            .orElseThrow(() -> new FabricException("Concept '" + conceptName + "' is not bound at scale " + scale.name()));
        float[] embedding = fabric.getEmbedding(scale, id);
        List<SimilarityMatch> related = new ArrayList<>();
        if (k > 0) {
            int topK = Math.min(k, scale.cardinality() - 1) + 1;
            for (SimilarityMatch match : fabric.querySimilar(embedding, scale, topK)) {
                if (match.id() != id && related.size() < k) {
                    related.add(match);
                }
            }
        }
        return new ConceptDescription(conceptName, scale, id, embedding, fabric.getMetadata(scale, id), List.copyOf(related));
    }

    private static void requireName(String conceptName) {
        if (conceptName == null || conceptName.isBlank()) {
            throw new IllegalArgumentException("concept name cannot be blank");
        }
    }

    /// A bound concept and its nearest neighbours.
    ///
    /// @param conceptName the concept
    /// @param scale scale of the binding
    /// @param componentId bound component
    /// @param embedding copy of the component's embedding
    /// @param metadata the component's metadata
    /// @param related most similar other components, best first
    public record ConceptDescription(String conceptName, Scale scale, int componentId, float[] embedding,
                                     ComponentMetadata metadata, List<SimilarityMatch> related) {
    }
}
