package io.nosqlbench.fabric.persist;

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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.fabric.FabricConfig;
import io.nosqlbench.fabric.IntegrationRegistry;
import io.nosqlbench.fabric.SchemaException;
import io.nosqlbench.fabric.TransformInit;
import io.nosqlbench.fabric.scale.ComponentMetadata;
import io.nosqlbench.fabric.scale.EmbeddingStore;
import io.nosqlbench.fabric.scale.Scale;
import io.nosqlbench.fabric.scale.ScalePair;
import io.nosqlbench.fabric.scale.ScaleRegistry;
import io.nosqlbench.fabric.scale.ScaleSchema;
import io.nosqlbench.fabric.transform.CrossScaleTransformer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The serialized form of a whole fabric.
///
/// ## Layout
///
/// ```json
/// {
///   "schema_version": 1,
///   "checksum": "sha256:...",
///   "dimension": 128,
///   "init_std": 0.01,
///   "learning_rate": 0.01,
///   "seed": 42,
///   "transform_init": "GAUSSIAN",
///   "scales": {
///     "cellular": {"level": 1, "cardinality": 1000,
///                  "embeddings": [[...], ...], "metadata": [{...}, ...]}
///   },
///   "transforms": {"cellular->tissue": [[...], ...]},
///   "integrations": {"atomspace": {"mode": "bidirectional"}}
/// }
/// ```
///
/// Instances are plain data holders for Gson. Everything read from a file is
/// untrusted until [#validate()] has passed; [#applyTo] validates before it
/// writes anything, so a bad snapshot never leaves a fabric half-loaded.
///
/// Every ordered scale pair must have a transform. `integrations` may be
/// absent, which loads as no registered collaborators.
///
/// @see PersistenceManager
public final class FabricSnapshot {

    /// Current snapshot format version.
    public static final int CURRENT_VERSION = 1;

    @SerializedName("schema_version")
    private Integer schemaVersion;

    @SerializedName("checksum")
    private String checksum;

    @SerializedName("dimension")
    private Integer dimension;

    @SerializedName("init_std")
    private Double initStd;

    @SerializedName("learning_rate")
    private Double learningRate;

    @SerializedName("seed")
    private Long seed;

    @SerializedName("transform_init")
    private TransformInit transformInit;

    @SerializedName("scales")
    private LinkedHashMap<String, ScaleSection> scales;

    @SerializedName("transforms")
    private LinkedHashMap<String, float[][]> transforms;

    @SerializedName("integrations")
    private LinkedHashMap<String, Map<String, Object>> integrations;

    FabricSnapshot() {
    }

    /// Captures the state of a fabric's parts.
    ///
    /// Each store is copied under its own read lock; callers that need a
    /// consistent view across stores must hold a lock that excludes writers.
    ///
    /// @param config the fabric configuration
    /// @param registry the embedding stores
    /// @param transformer the transform matrices
    /// @param integrations the registered collaborators
    /// @return a snapshot without checksum
    public static FabricSnapshot capture(FabricConfig config, ScaleRegistry registry, CrossScaleTransformer transformer,
                                         IntegrationRegistry integrations) {
        FabricSnapshot snapshot = new FabricSnapshot();
        snapshot.schemaVersion = CURRENT_VERSION;
        snapshot.dimension = config.dimension();
        snapshot.initStd = config.initStd();
        snapshot.learningRate = config.learningRate();
        snapshot.seed = config.seed();
        snapshot.transformInit = config.transformInit();
        snapshot.scales = new LinkedHashMap<>();
        for (EmbeddingStore store : registry.stores()) {
            ScaleSection section = new ScaleSection();
            section.level = store.scale().level();
            section.cardinality = store.scale().cardinality();
            section.embeddings = store.copyEmbeddings();
            section.metadata = new ArrayList<>(store.count());
            for (ComponentMetadata entry : store.copyMetadata()) {
                section.metadata.add(entry.asMap());
            }
            snapshot.scales.put(store.scale().name(), section);
        }
        snapshot.transforms = new LinkedHashMap<>();
        for (Map.Entry<ScalePair, float[][]> entry : transformer.copyAll().entrySet()) {
            snapshot.transforms.put(entry.getKey().key(), entry.getValue());
        }
        snapshot.integrations = new LinkedHashMap<>();
        for (Map.Entry<String, ComponentMetadata> entry : integrations.copyAll().entrySet()) {
            snapshot.integrations.put(entry.getKey(), entry.getValue().asMap());
        }
        return snapshot;
    }

    public Integer schemaVersion() {
        return schemaVersion;
    }

    public String checksum() {
        return checksum;
    }

    public Integer dimension() {
        return dimension;
    }

    /// Scale names in snapshot order.
    public List<String> scaleNames() {
        return scales == null ? List.of() : List.copyOf(scales.keySet());
    }

    /// Transform keys in snapshot order, like `cellular->tissue`.
    public List<String> transformKeys() {
        return transforms == null ? List.of() : List.copyOf(transforms.keySet());
    }

    /// Integration names in snapshot order.
    public List<String> integrationNames() {
        return integrations == null ? List.of() : List.copyOf(integrations.keySet());
    }

    /// Returns a shallow copy carrying the given checksum.
    public FabricSnapshot withChecksum(String value) {
        FabricSnapshot copy = new FabricSnapshot();
        copy.schemaVersion = schemaVersion;
        copy.checksum = value;
        copy.dimension = dimension;
        copy.initStd = initStd;
        copy.learningRate = learningRate;
        copy.seed = seed;
        copy.transformInit = transformInit;
        copy.scales = scales;
        copy.transforms = transforms;
        copy.integrations = integrations;
        return copy;
    }

    /// Rebuilds the configuration recorded in this snapshot.
    ///
    /// @throws SchemaException if a value is missing or out of range
    public FabricConfig toConfig() {
        if (dimension == null) {
            throw new SchemaException("Snapshot is missing 'dimension'");
        }
        if (scales == null || scales.isEmpty()) {
            throw new SchemaException("Snapshot has no scales");
        }
        List<Scale> parsed = new ArrayList<>(scales.size());
        for (Map.Entry<String, ScaleSection> entry : scales.entrySet()) {
            ScaleSection section = entry.getValue();
            if (section == null || section.level == null || section.cardinality == null) {
                throw new SchemaException("Scale '" + entry.getKey() + "' needs level and cardinality");
            }
            try {
                parsed.add(Scale.of(entry.getKey(), section.level, section.cardinality));
            } catch (IllegalArgumentException e) {
                throw new SchemaException("Invalid scale '" + entry.getKey() + "': " + e.getMessage(), e);
            }
        }
        try {
            FabricConfig.Builder builder = FabricConfig.builder()
                .dimension(dimension)
                .seed(seed)
                .schema(ScaleSchema.ofUnordered(parsed));
            if (initStd != null) builder.initStd(initStd);
            if (learningRate != null) builder.learningRate(learningRate);
            if (transformInit != null) builder.transformInit(transformInit);
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new SchemaException("Invalid snapshot configuration: " + e.getMessage(), e);
        }
    }

    /// Checks version, layout and every value of this snapshot.
    ///
    /// @return the configuration recorded in the snapshot
    /// @throws SchemaException if anything is missing, inconsistent or non-finite
    public FabricConfig validate() {
        requireVersion();
        FabricConfig config = toConfig();
        prepare(config.schema(), config.dimension());
        return config;
    }

    /// Validates this snapshot and checks that it matches an expected layout.
    ///
    /// @param expected the dimension and scales the loader requires
    /// @throws SchemaException if the dimension, a scale name, level or
    ///     cardinality differs
    public void validateAgainst(FabricConfig expected) {
        Objects.requireNonNull(expected, "expected cannot be null");
        FabricConfig actual = validate();
        if (actual.dimension() != expected.dimension()) {
            throw new SchemaException("Snapshot dimension " + actual.dimension()
                + " does not match expected dimension " + expected.dimension());
        }
        if (!actual.schema().equals(expected.schema())) {
            throw new SchemaException("Snapshot scales " + actual.schema()
                + " do not match expected scales " + expected.schema());
        }
    }

    /// Replaces the contents of the given stores, transformer and integrations
    /// with this snapshot's data. Nothing is written unless every value is valid.
    ///
    /// @param registry stores whose schema and dimension must match the snapshot
    /// @param transformer transformer of the same schema and dimension
    /// @param integrationRegistry collaborator registrations to replace
    /// @throws SchemaException if the snapshot does not fit
    public void applyTo(ScaleRegistry registry, CrossScaleTransformer transformer,
                        IntegrationRegistry integrationRegistry) {
        requireVersion();
        FabricConfig config = toConfig();
        if (config.dimension() != registry.dimension() || !config.schema().equals(registry.schema())) {
            throw new SchemaException("Snapshot layout " + config.schema() + " (D=" + config.dimension()
                + ") does not match fabric layout " + registry.schema() + " (D=" + registry.dimension() + ")");
        }
        Prepared prepared = prepare(registry.schema(), registry.dimension());
        for (Scale scale : registry.schema().scales()) {
            registry.store(scale).replaceAll(prepared.embeddings.get(scale.name()), prepared.metadata.get(scale.name()));
        }
        transformer.replaceAll(prepared.matrices);
        integrationRegistry.replaceAll(prepared.integrations);
    }

    private void requireVersion() {
        if (schemaVersion == null || schemaVersion != CURRENT_VERSION) {
            throw new SchemaException("Unsupported snapshot version: " + schemaVersion
                + " (expected: " + CURRENT_VERSION + ")");
        }
    }

    private Prepared prepare(ScaleSchema schema, int dim) {
        Prepared prepared = new Prepared();
        for (Scale scale : schema.scales()) {
            ScaleSection section = scales.get(scale.name());
            float[][] rows = section.embeddings;
            if (rows == null || rows.length != scale.cardinality()) {
                throw new SchemaException("Scale '" + scale.name() + "' has "
                    + (rows == null ? 0 : rows.length) + " embeddings, expected " + scale.cardinality());
            }
            for (int id = 0; id < rows.length; id++) {
                requireRow(rows[id], dim, "embedding " + scale.name() + "[" + id + "]");
            }
            List<ComponentMetadata> metadata = new ArrayList<>(scale.cardinality());
            if (section.metadata == null) {
                for (int id = 0; id < scale.cardinality(); id++) {
                    metadata.add(ComponentMetadata.EMPTY);
                }
            } else {
                if (section.metadata.size() != scale.cardinality()) {
                    throw new SchemaException("Scale '" + scale.name() + "' has " + section.metadata.size()
                        + " metadata entries, expected " + scale.cardinality());
                }
                for (int id = 0; id < section.metadata.size(); id++) {
                    try {
                        metadata.add(ComponentMetadata.of(section.metadata.get(id)));
                    } catch (IllegalArgumentException e) {
                        throw new SchemaException("Invalid metadata for " + scale.name() + "[" + id + "]: "
                            + e.getMessage(), e);
                    }
                }
            }
            prepared.embeddings.put(scale.name(), rows);
            prepared.metadata.put(scale.name(), metadata);
        }
        Map<String, float[][]> present = transforms == null ? Map.of() : transforms;
        for (ScalePair pair : schema.orderedPairs()) {
            if (!present.containsKey(pair.key())) {
                throw new SchemaException("Snapshot is missing transform '" + pair.key() + "'");
            }
        }
        if (transforms != null) {
            for (Map.Entry<String, float[][]> entry : transforms.entrySet()) {
                ScalePair pair = ScalePair.parse(entry.getKey(), schema);
                float[][] matrix = entry.getValue();
                if (matrix == null || matrix.length != dim) {
                    throw new SchemaException("Transform '" + entry.getKey() + "' has "
                        + (matrix == null ? 0 : matrix.length) + " rows, expected " + dim);
                }
                for (int r = 0; r < matrix.length; r++) {
                    requireRow(matrix[r], dim, "transform " + entry.getKey() + " row " + r);
                }
                prepared.matrices.put(pair, matrix);
            }
        }
        if (integrations != null) {
            for (Map.Entry<String, Map<String, Object>> entry : integrations.entrySet()) {
                String name = entry.getKey();
                if (name == null || name.isBlank()) {
                    throw new SchemaException("Integration names cannot be blank");
                }
                try {
                    prepared.integrations.put(name, ComponentMetadata.of(entry.getValue()));
                } catch (IllegalArgumentException e) {
                    throw new SchemaException("Invalid settings for integration '" + name + "': "
                        + e.getMessage(), e);
                }
            }
        }
        return prepared;
    }

    private static void requireRow(float[] row, int dim, String what) {
        if (row == null || row.length != dim) {
            throw new SchemaException(what + " has length " + (row == null ? 0 : row.length) + ", expected " + dim);
        }
        for (float v : row) {
            if (!Float.isFinite(v)) {
                throw new SchemaException(what + " contains a non-finite value");
            }
        }
    }

    private static final class Prepared {
        final Map<String, float[][]> embeddings = new LinkedHashMap<>();
        final Map<String, List<ComponentMetadata>> metadata = new LinkedHashMap<>();
        final Map<ScalePair, float[][]> matrices = new LinkedHashMap<>();
        final Map<String, ComponentMetadata> integrations = new LinkedHashMap<>();
    }

    /// One scale's section of a snapshot.
    static final class ScaleSection {
        @SerializedName("level")
        Integer level;

        @SerializedName("cardinality")
        Integer cardinality;

        @SerializedName("embeddings")
        float[][] embeddings;

        @SerializedName("metadata")
        List<Map<String, Object>> metadata;
    }
}
