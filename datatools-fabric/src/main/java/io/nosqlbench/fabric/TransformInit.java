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

/// How a new fabric populates its cross-scale transform matrices.
public enum TransformInit {

    /// Every ordered pair gets a matrix of Gaussian noise with the configured
    /// init std, so untrained transforms carry almost no signal.
    GAUSSIAN,

    /// Every ordered pair gets the identity plus Gaussian noise. Each
    /// direction is sampled independently; the reverse matrix is never the
    /// transpose of the forward one.
    IDENTITY_PERTURBED
}
