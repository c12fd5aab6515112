package io.nosqlbench.fabric.scale;

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
import io.nosqlbench.fabric.DimensionMismatchException;
import io.nosqlbench.fabric.vector.GaussianInitializer;
import io.nosqlbench.fabric.vector.VectorUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/// Embeddings and metadata for every component of one scale.
///
/// ## Layout
///
/// ```text
///   id   embedding (float[D])            metadata
///   ───  ──────────────────────────────  ────────────────────────
///   0    [ 0.0031, -0.0117, ..., 0.0042] {name=keratinocyte, ...}
///   1    [-0.0090,  0.0021, ..., 0.0008] {name=melanocyte, ...}
///   ...
///   N-1  [ ...                          ] {}
/// ```
///
/// The component count is fixed at construction. Components are never
/// added or removed; learning only rewrites existing rows.
///
/// ## Thread Safety
///
/// One [ReentrantReadWriteLock] guards the whole store: reads share it,
/// writes to any component are serialized. Reads return copies and writes
/// copy their input, so callers never alias stored state.
public final class EmbeddingStore {

    private final Scale scale;
    private final int dimension;
    private final float[][] embeddings;
    private final ComponentMetadata[] metadata;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /// Creates a store of zero vectors with empty metadata.
    ///
    /// @param scale the scale this store holds
    /// @param dimension the embedding dimension
    public EmbeddingStore(Scale scale, int dimension) {
        this.scale = Objects.requireNonNull(scale, "scale cannot be null");
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be at least 1, got " + dimension);
        }
        this.dimension = dimension;
        this.embeddings = new float[scale.cardinality()][dimension];
        this.metadata = new ComponentMetadata[scale.cardinality()];
        Arrays.fill(this.metadata, ComponentMetadata.EMPTY);
    }

    public Scale scale() {
        return scale;
    }

    public int dimension() {
        return dimension;
    }

    /// Number of components at this scale.
    public int count() {
        return embeddings.length;
    }

    /// Returns a copy of a component's embedding.
    ///
    /// @throws ComponentIndexException if the id is out of range
    public float[] get(int id) {
        checkIndex(id);
        lock.readLock().lock();
        try {
            return embeddings[id].clone();
        } finally {
            lock.readLock().unlock();
        }
    }

    /// Replaces a component's embedding with a copy of `vector`.
    ///
    /// @throws ComponentIndexException if the id is out of range
    /// @throws DimensionMismatchException if the length isn't the dimension
    /// @throws io.nosqlbench.fabric.InvalidVectorException if the vector has NaN or infinite values
    public void set(int id, float[] vector) {
        checkIndex(id);
        float[] copy = validated(vector, "embedding").clone();
        lock.writeLock().lock();
        try {
            embeddings[id] = copy;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /// Atomically rewrites a component's embedding.
    ///
    /// The operator receives a copy of the current embedding and returns the
    /// replacement. The write lock is held across read and write, so
    /// concurrent updates to the same store never lose each other. If the
    /// operator throws or returns an invalid vector, nothing is written.
    ///
    /// @param id the component id
    /// @param operator computes the new embedding from the current one
    /// @return a copy of the stored result
    public float[] update(int id, UnaryOperator<float[]> operator) {
        checkIndex(id);
        lock.writeLock().lock();
        try {
            float[] next = validated(operator.apply(embeddings[id].clone()), "updated embedding").clone();
            embeddings[id] = next;
            return next.clone();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /// Returns a component's metadata.
    public ComponentMetadata getMetadata(int id) {
        checkIndex(id);
        lock.readLock().lock();
        try {
            return metadata[id];
        } finally {
            lock.readLock().unlock();
        }
    }

    /// Replaces a component's metadata.
    public void setMetadata(int id, ComponentMetadata value) {
        checkIndex(id);
        Objects.requireNonNull(value, "metadata cannot be null, use ComponentMetadata.EMPTY");
        lock.writeLock().lock();
        try {
            metadata[id] = value;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /// Atomically rewrites a component's metadata.
    ///
    /// Like [#update], the write lock is held from the read of the current
    /// entry until the replacement is stored. If the operator throws or
    /// returns null, nothing is written.
    ///
    /// @param id the component id
    /// @param operator computes the new metadata from the current entry
    /// @return the stored result
    public ComponentMetadata updateMetadata(int id, UnaryOperator<ComponentMetadata> operator) {
        checkIndex(id);
        lock.writeLock().lock();
        try {
            ComponentMetadata next = Objects.requireNonNull(operator.apply(metadata[id]),
                "updated metadata cannot be null");
            metadata[id] = next;
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /// Visits every embedding under the read lock.
    ///
    /// The visitor sees the stored arrays directly and must neither modify
    /// nor retain them.
    public void forEach(EmbeddingVisitor visitor) {
        lock.readLock().lock();
        try {
            for (int id = 0; id < embeddings.length; id++) {
                visitor.visit(id, embeddings[id]);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    /// Fills every embedding with Gaussian noise.
    public void initialize(GaussianInitializer initializer) {
        lock.writeLock().lock();
        try {
            for (int id = 0; id < embeddings.length; id++) {
                embeddings[id] = initializer.vector(dimension);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /// Deep copy of all embeddings, in id order.
    public float[][] copyEmbeddings() {
        lock.readLock().lock();
        try {
            return VectorUtils.copy(embeddings);
        } finally {
            lock.readLock().unlock();
        }
    }

    /// All metadata, in id order.
    public List<ComponentMetadata> copyMetadata() {
        lock.readLock().lock();
        try {
            return List.of(metadata);
        } finally {
            lock.readLock().unlock();
        }
    }

    /// Replaces every embedding and metadata entry at once.
    ///
    /// Everything is validated before the first row is written.
    ///
    /// @param rows one embedding per component
    /// @param entries one metadata entry per component
    public void replaceAll(float[][] rows, List<ComponentMetadata> entries) {
        if (rows.length != embeddings.length || entries.size() != metadata.length) {
            throw new IllegalArgumentException("scale '" + scale.name() + "' holds " + embeddings.length
                + " components, got " + rows.length + " embeddings and " + entries.size() + " metadata entries");
        }
        float[][] copies = new float[rows.length][];
        for (int id = 0; id < rows.length; id++) {
            copies[id] = validated(rows[id], "embedding " + id).clone();
        }
        List<ComponentMetadata> entryCopies = new ArrayList<>(entries);
        if (entryCopies.contains(null)) {
            throw new NullPointerException("metadata entries cannot be null");
        }
        lock.writeLock().lock();
        try {
            System.arraycopy(copies, 0, embeddings, 0, copies.length);
            for (int id = 0; id < metadata.length; id++) {
                metadata[id] = entryCopies.get(id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /// Verifies a component id.
    ///
    /// @throws ComponentIndexException if the id is out of range
    public void checkIndex(int id) {
        if (!scale.contains(id)) {
            throw new ComponentIndexException(scale.name(), id, scale.cardinality());
        }
    }

    private float[] validated(float[] vector, String what) {
        VectorUtils.requireDimension(vector, dimension);
        return VectorUtils.requireFinite(vector, what);
    }

    @Override
    public String toString() {
        return "EmbeddingStore{scale=" + scale + ", dimension=" + dimension + "}";
    }

    /// Callback for [#forEach].
    @FunctionalInterface
    public interface EmbeddingVisitor {
        /// @param id the component id
        /// @param embedding the stored embedding, read-only
        void visit(int id, float[] embedding);
    }
}
