/// Multi-scale embedding fabric.
///
/// A fabric holds one fixed-dimension embedding per component at each of a
/// small number of hierarchical scales, plus a learned linear transform for
/// every ordered pair of scales.
///
/// ## Key Components
///
/// - {@link io.nosqlbench.fabric.EmbeddingFabric}: the fabric and its operations
/// - {@link io.nosqlbench.fabric.FabricFactory}: creates initialized fabrics
/// - {@link io.nosqlbench.fabric.FabricConfig}: dimension, init std, learning rate, seed and scales
/// - {@link io.nosqlbench.fabric.FabricException}: root of all fabric errors
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
