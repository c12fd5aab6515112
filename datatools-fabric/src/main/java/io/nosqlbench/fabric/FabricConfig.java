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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.fabric.scale.Scale;
import io.nosqlbench.fabric.scale.ScaleSchema;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Immutable global configuration of an embedding fabric.
///
/// ## Settings
///
/// | Setting | Default | Constraint |
/// |---------|---------|------------|
/// | dimension | 128 | at least 1 |
/// | initStd | 0.01 | positive, finite |
/// | learningRate | 0.01 | in [0, 1] |
/// | seed | none (entropy) | any long |
/// | transformInit | [TransformInit#GAUSSIAN] | |
/// | schema | [ScaleSchema#defaultSchema()] | |
///
/// ## JSON Form
///
/// ```json
/// {
///   "dimension": 64,
///   "init_std": 0.01,
///   "learning_rate": 0.05,
///   "seed": 42,
///   "transform_init": "GAUSSIAN",
///   "scales": [
///     {"name": "cellular", "level": 1, "cardinality": 1000},
///     {"name": "tissue", "level": 2, "cardinality": 50}
///   ]
/// }
/// ```
///
/// Every key is optional; omitted keys take the defaults above.
public final class FabricConfig {

    public static final int DEFAULT_DIMENSION = 128;
    public static final double DEFAULT_INIT_STD = 0.01;
    public static final double DEFAULT_LEARNING_RATE = 0.01;

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    private final int dimension;
    private final double initStd;
    private final double learningRate;
    private final Long seed;
    private final TransformInit transformInit;
    private final ScaleSchema schema;

    private FabricConfig(Builder builder) {
        if (builder.dimension < 1) {
            throw new IllegalArgumentException("dimension must be at least 1, got " + builder.dimension);
        }
        if (!(builder.initStd > 0.0) || !Double.isFinite(builder.initStd)) {
            throw new IllegalArgumentException("initStd must be positive and finite, got " + builder.initStd);
        }
        if (!(builder.learningRate >= 0.0 && builder.learningRate <= 1.0)) {
            throw new IllegalArgumentException("learningRate must be in [0, 1], got " + builder.learningRate);
        }
        this.dimension = builder.dimension;
        this.initStd = builder.initStd;
        this.learningRate = builder.learningRate;
        this.seed = builder.seed;
        this.transformInit = Objects.requireNonNull(builder.transformInit, "transformInit cannot be null");
        this.schema = Objects.requireNonNull(builder.schema, "schema cannot be null");
    }

    /// Configuration with every default.
    public static FabricConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int dimension() { return dimension; }
    public double initStd() { return initStd; }
    public double learningRate() { return learningRate; }
    /// Seed for initialization noise, or null when seeded from entropy.
    public Long seed() { return seed; }
    public TransformInit transformInit() { return transformInit; }
    public ScaleSchema schema() { return schema; }

    /// Returns a builder pre-filled with this configuration.
    public Builder toBuilder() {
        return new Builder()
            .dimension(dimension)
            .initStd(initStd)
            .learningRate(learningRate)
            .seed(seed)
            .transformInit(transformInit)
            .schema(schema);
    }

    /// Loads a configuration from a JSON file.
    ///
    /// @param path the JSON file
    /// @return the configuration
    /// @throws IOException if reading fails
    /// @throws SchemaException if the JSON is malformed
    /// @throws IllegalArgumentException if a value is out of range
    public static FabricConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    /// Parses a configuration from JSON text.
    public static FabricConfig fromJson(String json) {
        return fromJson(new StringReader(json));
    }

    /// Parses a configuration from a JSON reader.
    public static FabricConfig fromJson(Reader reader) {
        ConfigJson parsed;
        try {
            parsed = GSON.fromJson(reader, ConfigJson.class);
        } catch (JsonParseException e) {
            throw new SchemaException("Invalid fabric config JSON: " + e.getMessage(), e);
        }
        if (parsed == null) {
            return defaults();
        }
        return parsed.toConfig();
    }

    /// Renders this configuration as JSON.
    public String toJson() {
        return GSON.toJson(ConfigJson.from(this));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FabricConfig that = (FabricConfig) o;
        return dimension == that.dimension
            && Double.compare(initStd, that.initStd) == 0
            && Double.compare(learningRate, that.learningRate) == 0
            && Objects.equals(seed, that.seed)
            && transformInit == that.transformInit
            && schema.equals(that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, initStd, learningRate, seed, transformInit, schema);
    }

    @Override
    public String toString() {
        return "FabricConfig{" +
               "dimension=" + dimension +
               ", initStd=" + initStd +
               ", learningRate=" + learningRate +
               ", seed=" + seed +
               ", transformInit=" + transformInit +
               ", schema=" + schema +
               '}';
    }

    /// Builder for [FabricConfig].
    public static final class Builder {
        private int dimension = DEFAULT_DIMENSION;
        private double initStd = DEFAULT_INIT_STD;
        private double learningRate = DEFAULT_LEARNING_RATE;
        private Long seed;
        private TransformInit transformInit = TransformInit.GAUSSIAN;
        private ScaleSchema schema = ScaleSchema.defaultSchema();

        public Builder dimension(int dimension) { this.dimension = dimension; return this; }
        public Builder initStd(double initStd) { this.initStd = initStd; return this; }
        public Builder learningRate(double learningRate) { this.learningRate = learningRate; return this; }
        public Builder seed(Long seed) { this.seed = seed; return this; }
        public Builder transformInit(TransformInit transformInit) { this.transformInit = transformInit; return this; }
        public Builder schema(ScaleSchema schema) { this.schema = schema; return this; }

        public FabricConfig build() {
            return new FabricConfig(this);
        }
    }

    /// JSON shape of a configuration file.
    static final class ConfigJson {
        @SerializedName("dimension")
        Integer dimension;

        @SerializedName("init_std")
        Double initStd;

        @SerializedName("learning_rate")
        Double learningRate;

        @SerializedName("seed")
        Long seed;

        @SerializedName("transform_init")
        TransformInit transformInit;

        @SerializedName("scales")
        List<ScaleJson> scales;

        static ConfigJson from(FabricConfig config) {
            ConfigJson json = new ConfigJson();
            json.dimension = config.dimension;
            json.initStd = config.initStd;
            json.learningRate = config.learningRate;
            json.seed = config.seed;
            json.transformInit = config.transformInit;
            json.scales = new ArrayList<>();
            for (Scale scale : config.schema.scales()) {
                ScaleJson s = new ScaleJson();
                s.name = scale.name();
                s.level = scale.level();
                s.cardinality = scale.cardinality();
                json.scales.add(s);
            }
            return json;
        }

        FabricConfig toConfig() {
            Builder builder = builder();
            if (dimension != null) builder.dimension(dimension);
            if (initStd != null) builder.initStd(initStd);
            if (learningRate != null) builder.learningRate(learningRate);
            if (seed != null) builder.seed(seed);
            if (transformInit != null) builder.transformInit(transformInit);
            if (scales != null) {
                List<Scale> parsed = new ArrayList<>();
                for (ScaleJson s : scales) {
                    if (s == null || s.name == null || s.level == null || s.cardinality == null) {
                        throw new SchemaException("Each scale needs name, level and cardinality");
                    }
                    parsed.add(Scale.of(s.name, s.level, s.cardinality));
                }
                builder.schema(ScaleSchema.ofUnordered(parsed));
            }
            return builder.build();
        }
    }

    static final class ScaleJson {
        @SerializedName("name")
        String name;

        @SerializedName("level")
        Integer level;

        @SerializedName("cardinality")
        Integer cardinality;
    }
}
