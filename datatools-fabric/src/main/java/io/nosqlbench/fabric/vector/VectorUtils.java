package io.nosqlbench.fabric.vector;

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

import io.nosqlbench.fabric.DimensionMismatchException;
import io.nosqlbench.fabric.InvalidVectorException;

/// # VectorUtils
///
/// Low-level vector and matrix arithmetic shared by the fabric components.
///
/// ## Purpose
/// - **Similarity**: cosine similarity with a defined zero-norm fallback
/// - **Distances**: Euclidean distance variants
/// - **Linear maps**: dense matrix-vector products
/// - **Validation**: dimension and finiteness checks
/// - **Statistics**: basic statistical measures for arrays of values
///
/// All accumulation happens in `double`, even though embeddings are stored
/// as `float[]`.
///
/// ## Usage
/// ```java
/// double sim = VectorUtils.cosineSimilarity(a, b);
/// float[] mapped = VectorUtils.multiply(matrix, vector);
/// VectorUtils.Statistics stats = VectorUtils.computeStatistics(norms);
/// ```
public final class VectorUtils {

    /// Norms below this value are treated as zero by [#cosineSimilarity].
    public static final double NORM_EPSILON = 1e-10;

    private VectorUtils() {} // Utility class

    /// Computes the dot product of two vectors.
    ///
    /// @param a first vector
    /// @param b second vector
    /// @return the dot product
    /// @throws DimensionMismatchException if vectors have different dimensions
    public static double dot(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    /// Computes the L2 norm of a vector.
    ///
    /// @param v the vector
    /// @return sqrt(sum(v_i^2))
    public static double norm(float[] v) {
        return Math.sqrt(dot(v, v));
    }

    /// Computes cosine similarity between two vectors.
    ///
    /// Returns 0.0 when either norm is below [#NORM_EPSILON], so zero vectors
    /// never produce NaN. The result is clamped to [-1, 1]. Identical
    /// non-zero vectors score exactly 1.0, since `sqrt(x*x) == x` holds for
    /// IEEE doubles.
    ///
    /// @param a first vector
    /// @param b second vector
    /// @return cosine similarity in [-1, 1]
    /// @throws DimensionMismatchException if vectors have different dimensions
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        double dot = 0.0;
        double normA2 = 0.0;
        double normB2 = 0.0;
        for (int i = 0; i < a.length; i++) {
            double x = a[i];
            double y = b[i];
            dot += x * y;
            normA2 += x * x;
            normB2 += y * y;
        }
        if (Math.sqrt(normA2) < NORM_EPSILON || Math.sqrt(normB2) < NORM_EPSILON) {
            return 0.0;
        }
        double similarity = dot / Math.sqrt(normA2 * normB2);
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    /// Computes Euclidean distance between two vectors.
    /// Standard L2 distance: sqrt(sum((a_i - b_i)^2))
    ///
    /// @param a first vector
    /// @param b second vector
    /// @return Euclidean distance
    /// @throws DimensionMismatchException if vectors have different dimensions
    public static double euclideanDistance(float[] a, float[] b) {
        return Math.sqrt(squaredEuclideanDistance(a, b));
    }

    /// Computes squared Euclidean distance between two vectors.
    /// Avoids expensive sqrt operation for distance comparisons.
    ///
    /// @param a first vector
    /// @param b second vector
    /// @return squared Euclidean distance
    /// @throws DimensionMismatchException if vectors have different dimensions
    public static double squaredEuclideanDistance(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = (double) a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    /// Computes `matrix · vector` for a dense row-major matrix.
    ///
    /// @param matrix rows x columns matrix
    /// @param vector vector of length columns
    /// @return vector of length rows
    /// @throws DimensionMismatchException if a row length differs from the vector length
    /// @throws InvalidVectorException if the product overflows to a non-finite value
    public static float[] multiply(float[][] matrix, float[] vector) {
        float[] out = new float[matrix.length];
        for (int r = 0; r < matrix.length; r++) {
            float[] row = matrix[r];
            if (row.length != vector.length) {
                throw new DimensionMismatchException(row.length, vector.length);
            }
            double sum = 0.0;
            for (int c = 0; c < row.length; c++) {
                sum += (double) row[c] * vector[c];
            }
            out[r] = (float) sum;
            if (!Float.isFinite(out[r])) {
                throw new InvalidVectorException("Matrix product overflowed at row " + r);
            }
        }
        return out;
    }

    /// Verifies that a vector has the expected length.
    ///
    /// @param vector the vector to check
    /// @param dimension the required length
    /// @return the same vector
    /// @throws DimensionMismatchException on a length mismatch
    public static float[] requireDimension(float[] vector, int dimension) {
        if (vector == null) {
            throw new NullPointerException("vector cannot be null");
        }
        if (vector.length != dimension) {
            throw new DimensionMismatchException(dimension, vector.length);
        }
        return vector;
    }

    /// Verifies that every component of a vector is finite.
    ///
    /// @param vector the vector to check
    /// @param what a short description used in the error message
    /// @return the same vector
    /// @throws InvalidVectorException if any component is NaN or infinite
    public static float[] requireFinite(float[] vector, String what) {
        for (int i = 0; i < vector.length; i++) {
            if (!Float.isFinite(vector[i])) {
                throw new InvalidVectorException(what + " has non-finite value " + vector[i] + " at index " + i);
            }
        }
        return vector;
    }

    /// Verifies that a matrix is `dimension x dimension` and finite.
    ///
    /// @param matrix the matrix to check
    /// @param dimension the required row and column count
    /// @return the same matrix
    public static float[][] requireSquare(float[][] matrix, int dimension) {
        if (matrix == null) {
            throw new NullPointerException("matrix cannot be null");
        }
        if (matrix.length != dimension) {
            throw new DimensionMismatchException(dimension, matrix.length);
        }
        for (int r = 0; r < matrix.length; r++) {
            requireDimension(matrix[r], dimension);
            requireFinite(matrix[r], "matrix row " + r);
        }
        return matrix;
    }

    /// Deep-copies a row-major matrix.
    public static float[][] copy(float[][] matrix) {
        float[][] out = new float[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            out[i] = matrix[i].clone();
        }
        return out;
    }

    /// Creates a `dimension x dimension` identity matrix.
    public static float[][] identity(int dimension) {
        float[][] m = new float[dimension][dimension];
        for (int i = 0; i < dimension; i++) {
            m[i][i] = 1.0f;
        }
        return m;
    }

    /// Computes basic statistics (mean, std dev, min, max) for an array of values.
    ///
    /// @param values the values to analyze
    /// @return statistics object with computed measures
    public static Statistics computeStatistics(double[] values) {
        if (values.length == 0) {
            return new Statistics(0, 0, 0, 0);
        }

        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;

        for (double value : values) {
            sum += value;
            if (value < min) min = value;
            if (value > max) max = value;
        }

        double mean = sum / values.length;

        double sumSquaredDeviations = 0;
        for (double value : values) {
            double deviation = value - mean;
            sumSquaredDeviations += deviation * deviation;
        }

        double stdDev = Math.sqrt(sumSquaredDeviations / values.length);

        return new Statistics(mean, stdDev, min, max);
    }

    /// ## Statistics
    ///
    /// Container for basic statistical measures of a numeric array.
    ///
    /// ### Fields
    /// - **mean**: Arithmetic mean of the values
    /// - **stdDev**: Population standard deviation
    /// - **min**: Minimum value
    /// - **max**: Maximum value
    public static class Statistics {
        /// Arithmetic mean of the values
        public final double mean;
        /// Population standard deviation
        public final double stdDev;
        /// Minimum value in the dataset
        public final double min;
        /// Maximum value in the dataset
        public final double max;

        /// Creates a new statistics summary.
        ///
        /// @param mean arithmetic mean
        /// @param stdDev standard deviation
        /// @param min minimum value
        /// @param max maximum value
        public Statistics(double mean, double stdDev, double min, double max) {
            this.mean = mean;
            this.stdDev = stdDev;
            this.min = min;
            this.max = max;
        }

        @Override
        public String toString() {
            return String.format("Statistics{mean=%.4f, stdDev=%.4f, min=%.4f, max=%.4f}",
                               mean, stdDev, min, max);
        }
    }
}
