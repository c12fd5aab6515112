package io.nosqlbench.fabric.similarity;

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

import java.util.Comparator;

/// One ranked result of a similarity query.
///
/// @param id the component id
/// @param score cosine similarity to the query, in [-1, 1]
public record SimilarityMatch(int id, double score) {

    /// Descending by score, then ascending by id.
    public static final Comparator<SimilarityMatch> RANKING =
        Comparator.comparingDouble(SimilarityMatch::score).reversed()
            .thenComparingInt(SimilarityMatch::id);
}
