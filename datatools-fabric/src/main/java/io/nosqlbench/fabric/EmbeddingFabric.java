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

import io.nosqlbench.fabric.learn.LearningUpdater;
import io.nosqlbench.fabric.learn.Observation;
import io.nosqlbench.fabric.persist.FabricSnapshot;
import io.nosqlbench.fabric.persist.PersistenceManager;
import io.nosqlbench.fabric.propagate.SignalPropagator;
import io.nosqlbench.fabric.scale.ComponentMetadata;
import io.nosqlbench.fabric.scale.Scale;
import io.nosqlbench.fabric.scale.ScaleRegistry;
import io.nosqlbench.fabric.similarity.SimilarityIndex;
import io.nosqlbench.fabric.similarity.SimilarityMatch;
import io.nosqlbench.fabric.transform.CrossScaleTransformer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/// A multi-scale embedding fabric: one embedding store per scale, a learned
/// linear transform per ordered pair of scales, and the operations that read
/// and update them.
///
/// ## Structure
///
/// ```text
///   ┌────────────┐  W(c->t)  ┌────────────┐  W(t->r)  ┌────────────┐
///   │ cellular   │ ────────► │ tissue     │ ────────► │ region     │ ...
///   │ 1000 x D   │ ◄──────── │ 50 x D     │ ◄──────── │ 20 x D     │
///   └────────────┘  W(t->c)  └────────────┘  W(r->t)  └────────────┘
/// ```
///
/// Every pair has its own matrix; `W(a->b)` and `W(b->a)` are independent.
///
/// ## Concurrency
///
/// Stores and matrices carry their own read/write locks. On top of these a
/// fabric-wide gate is held in shared mode by every ordinary operation and in
/// exclusive mode by [#snapshot()] and [#restore], so a snapshot never
/// observes a half-applied update and a restore is never interleaved with
/// other operations.
///
/// ## Errors
///
/// All fabric errors are unchecked subclasses of [FabricException] and are
/// raised before any state changes.
///
/// @see FabricFactory
/// @see PersistenceManager
public final class EmbeddingFabric {

    private static final Logger logger = LogManager.getLogger(EmbeddingFabric.class);

    private final FabricConfig config;
    private final ScaleRegistry registry;
    private final CrossScaleTransformer transformer;
    private final SimilarityIndex similarityIndex;
    private final SignalPropagator propagator;
    private final LearningUpdater learner;
    private final IntegrationRegistry integrations;
    private final ReadWriteLock gate = new ReentrantReadWriteLock();

    /// Assembles a fabric from already populated parts.
    ///
    /// Most callers want [FabricFactory#createFabric(FabricConfig)] or
    /// [#load(Path)] instead.
    ///
    /// @throws IllegalArgumentException if the parts disagree with the config
    ///     on dimension or scales
    public EmbeddingFabric(FabricConfig config, ScaleRegistry registry, CrossScaleTransformer transformer) {
        this(config, registry, transformer, new IntegrationRegistry());
    }

    /// Assembles a fabric that starts with the given collaborator registrations.
    public EmbeddingFabric(FabricConfig config, ScaleRegistry registry, CrossScaleTransformer transformer,
                           IntegrationRegistry integrations) {
        this.integrations = Objects.requireNonNull(integrations, "integrations cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.transformer = Objects.requireNonNull(transformer, "transformer cannot be null");
        if (registry.dimension() != config.dimension() || transformer.dimension() != config.dimension()) {
            throw new IllegalArgumentException("registry and transformer must have dimension " + config.dimension());
        }
        if (!registry.schema().equals(config.schema())) {
            throw new IllegalArgumentException("registry schema " + registry.schema()
                + " does not match config schema " + config.schema());
        }
        this.similarityIndex = new SimilarityIndex(registry);
        this.propagator = new SignalPropagator(registry, transformer);
        this.learner = new LearningUpdater(registry, config.learningRate());
    }

    public FabricConfig config() {
        return config;
    }

    public int dimension() {
        return config.dimension();
    }

    /// The fabric's scales, ordered by level.
    public List<Scale> scales() {
        return config.schema().scales();
    }

    /// Looks up a scale by name.
    ///
    /// @throws UnknownScaleException if this fabric has no such scale
    public Scale scale(String name) {
        return config.schema().scale(name);
    }

    // ---- embeddings and metadata ----

    /// Returns a copy of a component's embedding.
    public float[] getEmbedding(Scale scale, int id) {
        return shared(() -> registry.store(scale).get(id));
    }

    /// Replaces a component's embedding with a copy of `vector`.
    public void setEmbedding(Scale scale, int id, float[] vector) {
        shared(() -> registry.store(scale).set(id, vector));
    }

    public ComponentMetadata getMetadata(Scale scale, int id) {
        return shared(() -> registry.store(scale).getMetadata(id));
    }

    public void setMetadata(Scale scale, int id, ComponentMetadata metadata) {
        shared(() -> registry.store(scale).setMetadata(id, metadata));
    }

    /// Atomically replaces a component's metadata with a function of its
    /// current value. No other metadata write to the component can land
    /// between the read and the write.
    ///
    /// @return the stored metadata
    public ComponentMetadata updateMetadata(Scale scale, int id, UnaryOperator<ComponentMetadata> operator) {
        Objects.requireNonNull(operator, "operator cannot be null");
        return shared(() -> registry.store(scale).updateMetadata(id, operator));
    }

    /// Merges entries into a component's existing metadata. The read and the
    /// write happen under one store lock, so concurrent merges all land.
    public ComponentMetadata mergeMetadata(Scale scale, int id, Map<String, ?> entries) {
        ComponentMetadata additions = ComponentMetadata.of(entries);
        return shared(() -> registry.store(scale).updateMetadata(id, current -> current.merge(additions)));
    }

    // ---- transforms ----

    /// Maps a vector from one scale's space into another's.
    ///
    /// @return a new vector; a copy of the input when both scales are equal
    /// @throws MissingTransformException if no matrix exists for the pair
    public float[] transformAcrossScales(float[] vector, Scale from, Scale to) {
        return shared(() -> transformer.transform(vector, from, to));
    }

    /// Installs or replaces the `from -> to` matrix.
    public void registerTransform(Scale from, Scale to, float[][] matrix) {
        shared(() -> transformer.register(from, to, matrix));
    }

    /// Returns a copy of the `from -> to` matrix.
    public float[][] transformMatrix(Scale from, Scale to) {
        return shared(() -> transformer.matrix(from, to));
    }

    public boolean hasTransform(Scale from, Scale to) {
        return shared(() -> transformer.contains(from, to));
    }

    /// One delta-rule step on the `from -> to` matrix.
    ///
    /// @return the prediction error norm before the step
    public double trainTransform(Scale from, Scale to, float[] input, float[] target, double rate) {
        return shared(() -> transformer.train(from, to, input, target, rate));
    }

    // ---- similarity and propagation ----

    /// Ranks a scale's components by cosine similarity to `vector`.
    public List<SimilarityMatch> querySimilar(float[] vector, Scale scale, int topK) {
        return shared(() -> similarityIndex.query(vector, scale, topK));
    }

    /// Cosine similarity between two components of one scale.
    public double similarity(Scale scale, int a, int b) {
        return shared(() -> similarityIndex.similarity(scale, a, b));
    }

    /// Spreads a signal from a source component into every component of the target scale.
    ///
    /// @return non-negative activation per target id, ordered by id
    public Map<Integer, Double> propagateSignal(Scale sourceScale, int sourceId, Scale targetScale, double strength) {
        return shared(() -> propagator.propagate(sourceScale, sourceId, targetScale, strength));
    }

    // ---- learning ----

    /// Moves an embedding toward an observation with the configured learning rate.
    public float[] updateFromObservation(Scale scale, int id, float[] observation) {
        return shared(() -> learner.updateFromObservation(scale, id, observation));
    }

    /// Moves an embedding toward an observation.
    ///
    /// @param rate in [0, 1]; 1 replaces the embedding, 0 leaves it unchanged
    /// @return a copy of the updated embedding
    public float[] updateFromObservation(Scale scale, int id, float[] observation, double rate) {
        return shared(() -> learner.updateFromObservation(scale, id, observation, rate));
    }

    /// Applies a batch of observations with the configured learning rate.
    public int updateBatch(List<Observation> observations) {
        return updateBatch(observations, config.learningRate(), () -> false);
    }

    /// Applies a batch of observations, stopping early when `cancelled` turns true.
    ///
    /// @return how many observations were applied
    public int updateBatch(List<Observation> observations, double rate, BooleanSupplier cancelled) {
        return shared(() -> learner.updateBatch(observations, rate, cancelled));
    }

    // ---- collaborators ----

    /// Registers a collaborating system and its integration settings,
    /// replacing any earlier registration under the same name.
    ///
    /// @param name collaborator name, not blank
    /// @param settings JSON-compatible settings, may be null
    /// @return the stored settings
    public ComponentMetadata registerIntegration(String name, Map<String, ?> settings) {
        ComponentMetadata stored = shared(() -> integrations.register(name, settings));
        logger.debug("Registered integration '{}'", name);
        return stored;
    }

    /// Registered collaborators and their settings, in registration order.
    public Map<String, ComponentMetadata> integrations() {
        return shared(integrations::copyAll);
    }

    // ---- persistence ----

    /// Captures the whole fabric while excluding all other operations.
    public FabricSnapshot snapshot() {
        gate.writeLock().lock();
        try {
            return FabricSnapshot.capture(config, registry, transformer, integrations);
        } finally {
            gate.writeLock().unlock();
        }
    }

    /// Saves this fabric to a file atomically.
    public void save(Path path) throws IOException {
        PersistenceManager.save(this, path);
    }

    /// Writes this fabric as JSON. The writer is not closed.
    public void save(Writer writer) throws IOException {
        PersistenceManager.save(this, writer);
    }

    /// Loads a fabric from a snapshot file.
    ///
    /// @throws SchemaException if the snapshot is corrupt or inconsistent
    public static EmbeddingFabric load(Path path) throws IOException {
        return PersistenceManager.load(path);
    }

    /// Loads a fabric from a snapshot reader.
    public static EmbeddingFabric load(Reader reader) throws IOException {
        return PersistenceManager.load(reader);
    }

    /// Replaces this fabric's state with a snapshot file's.
    ///
    /// @throws SchemaException if the snapshot's dimension or scales differ
    ///     from this fabric's; the fabric is left unchanged
    public void restore(Path path) throws IOException {
        restore(PersistenceManager.read(path, true));
        logger.info("Restored fabric state from {}", path);
    }

    /// Replaces this fabric's state with a snapshot read from `reader`.
    public void restore(Reader reader) throws IOException {
        restore(PersistenceManager.read(reader, true));
    }

    /// Replaces this fabric's state with a snapshot's, validating it fully first.
    public void restore(FabricSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        gate.writeLock().lock();
        try {
            snapshot.validateAgainst(config);
            snapshot.applyTo(registry, transformer, integrations);
        } finally {
            gate.writeLock().unlock();
        }
    }

    // ---- introspection ----

    /// Per-scale norm statistics and transform count.
    public FabricStatistics statistics() {
        return shared(() -> FabricStatistics.compute(registry, transformer, integrations));
    }

    @Override
    public String toString() {
        return "EmbeddingFabric[D=" + config.dimension() + ", scales=" + config.schema().scales() + "]";
    }

    private <T> T shared(Supplier<T> operation) {
        gate.readLock().lock();
        try {
            return operation.get();
        } finally {
            gate.readLock().unlock();
        }
    }

    private void shared(Runnable operation) {
        gate.readLock().lock();
        try {
            operation.run();
        } finally {
            gate.readLock().unlock();
        }
    }
}
