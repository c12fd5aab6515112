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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.GaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

/// Source of small-magnitude Gaussian noise for embeddings and transform matrices.
///
/// Uses the XoShiRo256++ generator from Apache Commons RNG. With a seed, the
/// sequence of values is fully reproducible; without one, the generator is
/// seeded from system entropy.
///
/// Not thread-safe. Fabric construction draws from a single instance in a
/// fixed order (scales in schema order, components by id, then transform
/// pairs), which is what makes seeded fabrics identical across runs.
public final class GaussianInitializer {

    private final double stdDev;
    private final ContinuousSampler sampler;

    /// Creates an initializer.
    ///
    /// @param stdDev standard deviation of the noise, must be positive and finite
    /// @param seed the seed, or null for a non-deterministic sequence
    public GaussianInitializer(double stdDev, Long seed) {
        if (!(stdDev > 0.0) || !Double.isFinite(stdDev)) {
            throw new IllegalArgumentException("stdDev must be positive and finite, got " + stdDev);
        }
        UniformRandomProvider rng = seed != null
            ? RandomSource.XO_SHI_RO_256_PP.create(seed)
            : RandomSource.XO_SHI_RO_256_PP.create();
        this.stdDev = stdDev;
        this.sampler = GaussianSampler.of(ZigguratSampler.NormalizedGaussian.of(rng), 0.0, stdDev);
    }

    public double stdDev() {
        return stdDev;
    }

    /// Draws a single noise value.
    public float next() {
        return (float) sampler.sample();
    }

    /// Draws a vector of noise values.
    ///
    /// @param dimension vector length
    /// @return a new vector
    public float[] vector(int dimension) {
        float[] v = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            v[i] = next();
        }
        return v;
    }

    /// Draws a `dimension x dimension` matrix of noise values.
    public float[][] matrix(int dimension) {
        float[][] m = new float[dimension][];
        for (int r = 0; r < dimension; r++) {
            m[r] = vector(dimension);
        }
        return m;
    }

    /// Draws an identity matrix with noise added to every entry.
    public float[][] perturbedIdentity(int dimension) {
        float[][] m = matrix(dimension);
        for (int i = 0; i < dimension; i++) {
            m[i][i] += 1.0f;
        }
        return m;
    }
}
