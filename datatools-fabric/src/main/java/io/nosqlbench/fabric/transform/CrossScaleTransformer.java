package io.nosqlbench.fabric.transform;

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

import io.nosqlbench.fabric.MissingTransformException;
import io.nosqlbench.fabric.TransformInit;
import io.nosqlbench.fabric.scale.Scale;
import io.nosqlbench.fabric.scale.ScalePair;
import io.nosqlbench.fabric.scale.ScaleSchema;
import io.nosqlbench.fabric.vector.GaussianInitializer;
import io.nosqlbench.fabric.vector.VectorUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/// Learnable linear maps between the vector spaces of different scales.
///
/// ## Pairs
///
/// One [TransformMatrix] per ordered pair of distinct scales. The matrix for
/// `b -> a` is independent of the one for `a -> b`: it is sampled separately
/// and trained separately, never derived by transpose or inversion.
///
/// ```text
///              cellular ──M(c,t)──► tissue
///              cellular ◄──M(t,c)── tissue      M(t,c) ≠ M(c,t)ᵀ
/// ```
///
/// ## Lookup
///
/// A pair without a registered matrix is an error
/// ([MissingTransformException]). There is no fallback to the identity, to
/// the reverse matrix, or to composition through intermediate scales.
/// Transforming a vector to its own scale returns a copy.
public final class CrossScaleTransformer {

    private final ScaleSchema schema;
    private final int dimension;
    private final Map<ScalePair, TransformMatrix> matrices = new ConcurrentHashMap<>();

    /// Creates a transformer with no matrices.
    public CrossScaleTransformer(ScaleSchema schema, int dimension) {
        this.schema = Objects.requireNonNull(schema, "schema cannot be null");
        this.dimension = dimension;
    }

    /// Registers a matrix for every ordered pair of the schema.
    ///
    /// Pairs are visited in [ScaleSchema#orderedPairs()] order so a seeded
    /// initializer always yields the same matrices.
    ///
    /// @param mode how to populate the matrices
    /// @param initializer noise source
    public void initialize(TransformInit mode, GaussianInitializer initializer) {
        for (ScalePair pair : schema.orderedPairs()) {
            float[][] values = mode == TransformInit.IDENTITY_PERTURBED
                ? initializer.perturbedIdentity(dimension)
                : initializer.matrix(dimension);
            matrices.put(pair, new TransformMatrix(pair, values));
        }
    }

    public int dimension() {
        return dimension;
    }

    /// Installs or replaces the matrix for `from -> to`.
    ///
    /// @param values a finite `D x D` matrix, copied
    public void register(Scale from, Scale to, float[][] values) {
        ScalePair pair = pairOf(from, to);
        matrices.put(pair, new TransformMatrix(pair, VectorUtils.requireSquare(values, dimension)));
    }

    public boolean contains(Scale from, Scale to) {
        return matrices.containsKey(pairOf(from, to));
    }

    /// Returns a copy of the matrix for `from -> to`.
    ///
    /// @throws MissingTransformException if none is registered
    public float[][] matrix(Scale from, Scale to) {
        return require(from, to).values();
    }

    /// Registered pairs in schema order.
    public List<ScalePair> pairs() {
        List<ScalePair> present = new ArrayList<>();
        for (ScalePair pair : schema.orderedPairs()) {
            if (matrices.containsKey(pair)) {
                present.add(pair);
            }
        }
        return Collections.unmodifiableList(present);
    }

    /// Maps a vector from one scale's space into another's.
    ///
    /// @param vector vector of length D
    /// @param from source scale
    /// @param to target scale
    /// @return a new vector; a copy of the input when `from` equals `to`
    /// @throws MissingTransformException if no matrix is registered for the pair
    public float[] transform(float[] vector, Scale from, Scale to) {
        schema.require(from);
        schema.require(to);
        VectorUtils.requireDimension(vector, dimension);
        VectorUtils.requireFinite(vector, "transform input");
        if (from.equals(to)) {
            return vector.clone();
        }
        return require(from, to).apply(vector);
    }

    /// Trains the matrix for `from -> to` on one example.
    ///
    /// @return the prediction error before the step
    /// @see TransformMatrix#train(float[], float[], double)
    public double train(Scale from, Scale to, float[] input, float[] target, double rate) {
        return require(from, to).train(input, target, rate);
    }

    /// Deep copy of every registered matrix, in schema order.
    public Map<ScalePair, float[][]> copyAll() {
        Map<ScalePair, float[][]> copy = new LinkedHashMap<>();
        for (ScalePair pair : pairs()) {
            TransformMatrix matrix = matrices.get(pair);
            if (matrix != null) {
                copy.put(pair, matrix.values());
            }
        }
        return copy;
    }

    /// Replaces every matrix at once. All values are validated first.
    ///
    /// @param replacement the complete new set of matrices
    /// @throws MissingTransformException if an ordered pair of the schema is absent
    public void replaceAll(Map<ScalePair, float[][]> replacement) {
        for (ScalePair pair : schema.orderedPairs()) {
            if (!replacement.containsKey(pair)) {
                throw new MissingTransformException(pair.from().name(), pair.to().name());
            }
        }
        Map<ScalePair, TransformMatrix> next = new LinkedHashMap<>();
        for (Map.Entry<ScalePair, float[][]> entry : replacement.entrySet()) {
            ScalePair pair = entry.getKey();
            schema.require(pair.from());
            schema.require(pair.to());
            next.put(pair, new TransformMatrix(pair, VectorUtils.requireSquare(entry.getValue(), dimension)));
        }
        matrices.clear();
        matrices.putAll(next);
    }

    private TransformMatrix require(Scale from, Scale to) {
        TransformMatrix matrix = matrices.get(pairOf(from, to));
        if (matrix == null) {
            throw new MissingTransformException(from.name(), to.name());
        }
        return matrix;
    }

    private ScalePair pairOf(Scale from, Scale to) {
        return new ScalePair(schema.require(from), schema.require(to));
    }
}
