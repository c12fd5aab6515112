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

import io.nosqlbench.fabric.InvalidVectorException;
import io.nosqlbench.fabric.scale.ScalePair;
import io.nosqlbench.fabric.vector.VectorUtils;

import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/// Learnable `D x D` linear map for one ordered scale pair.
///
/// Stored row-major; [#apply] computes `matrix · vector`. Each matrix has its
/// own read/write lock, so training one pair never blocks transforms over
/// another.
public final class TransformMatrix {

    private final ScalePair pair;
    private final int dimension;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private float[][] values;

    /// Creates a matrix holding a copy of `values`.
    ///
    /// @param pair the ordered pair this matrix maps
    /// @param values a finite `D x D` matrix
    public TransformMatrix(ScalePair pair, float[][] values) {
        this.pair = Objects.requireNonNull(pair, "pair cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        this.dimension = values.length;
        this.values = VectorUtils.copy(VectorUtils.requireSquare(values, dimension));
    }

    public ScalePair pair() {
        return pair;
    }

    public int dimension() {
        return dimension;
    }

    /// Maps a vector through this matrix.
    ///
    /// @param vector a vector of length D
    /// @return `matrix · vector`
    public float[] apply(float[] vector) {
        VectorUtils.requireDimension(vector, dimension);
        lock.readLock().lock();
        try {
            return VectorUtils.multiply(values, vector);
        } finally {
            lock.readLock().unlock();
        }
    }

    /// Deep copy of the current values.
    public float[][] values() {
        lock.readLock().lock();
        try {
            return VectorUtils.copy(values);
        } finally {
            lock.readLock().unlock();
        }
    }

    /// Moves the matrix so that `input` maps closer to `target`.
    ///
    /// Normalized delta rule:
    /// `W ← W + rate · (target − W·input) · inputᵀ / ‖input‖²`.
    /// With rate 1 the updated matrix maps `input` exactly onto `target`
    /// (up to float rounding). A zero input leaves the matrix unchanged.
    ///
    /// @param input source-scale vector
    /// @param target desired target-scale vector
    /// @param rate step size in [0, 1]
    /// @return the Euclidean error `‖target − W·input‖` before the step
    public double train(float[] input, float[] target, double rate) {
        VectorUtils.requireDimension(input, dimension);
        VectorUtils.requireDimension(target, dimension);
        VectorUtils.requireFinite(input, "training input");
        VectorUtils.requireFinite(target, "training target");
        if (!(rate >= 0.0 && rate <= 1.0)) {
            throw new IllegalArgumentException("learning rate must be in [0, 1], got " + rate);
        }
        double inputNorm2 = VectorUtils.dot(input, input);
        lock.writeLock().lock();
        try {
            float[] predicted = VectorUtils.multiply(values, input);
            double[] error = new double[dimension];
            double errorNorm2 = 0.0;
            for (int r = 0; r < dimension; r++) {
                error[r] = (double) target[r] - predicted[r];
                errorNorm2 += error[r] * error[r];
            }
            if (rate == 0.0 || Math.sqrt(inputNorm2) < VectorUtils.NORM_EPSILON) {
                return Math.sqrt(errorNorm2);
            }
            float[][] next = new float[dimension][dimension];
            for (int r = 0; r < dimension; r++) {
                double scale = rate * error[r] / inputNorm2;
                for (int c = 0; c < dimension; c++) {
                    next[r][c] = (float) (values[r][c] + scale * input[c]);
                    if (!Float.isFinite(next[r][c])) {
                        throw new InvalidVectorException("training " + pair + " produced a non-finite weight at ["
                            + r + "," + c + "]");
                    }
                }
            }
            values = next;
            return Math.sqrt(errorNorm2);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "TransformMatrix{" + pair + ", " + dimension + "x" + dimension + "}";
    }
}
