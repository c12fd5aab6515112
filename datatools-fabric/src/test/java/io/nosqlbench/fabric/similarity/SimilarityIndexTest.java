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

import io.nosqlbench.fabric.DimensionMismatchException;
import io.nosqlbench.fabric.scale.EmbeddingStore;
import io.nosqlbench.fabric.scale.Scale;
import io.nosqlbench.fabric.scale.ScaleRegistry;
import io.nosqlbench.fabric.scale.ScaleSchema;
import io.nosqlbench.fabric.vector.GaussianInitializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class SimilarityIndexTest {

    private static final Scale SCALE = Scale.of("s", 1, 5);

    private ScaleRegistry registry;
    private SimilarityIndex index;

    @BeforeEach
    void setUp() {
        registry = new ScaleRegistry(ScaleSchema.of(SCALE), 2);
        EmbeddingStore store = registry.store(SCALE);
        store.set(0, new float[]{1f, 0f});
        store.set(1, new float[]{0f, 1f});
        store.set(2, new float[]{2f, 0f});
        store.set(3, new float[]{-1f, 0f});
        // component 4 stays the zero vector
        index = new SimilarityIndex(registry);
    }

    @Test
    void ranksByDescendingScoreThenAscendingId() {
        List<SimilarityMatch> matches = index.query(new float[]{1f, 0f}, SCALE, 5);
        assertThat(matches).extracting(SimilarityMatch::id).containsExactly(0, 2, 1, 4, 3);
        assertThat(matches.get(0).score()).isCloseTo(1.0, within(1e-12));
        assertThat(matches.get(1).score()).isCloseTo(1.0, within(1e-12));
        assertThat(matches.get(4).score()).isCloseTo(-1.0, within(1e-12));
    }

    @Test
    void returnsMinOfTopKAndCardinality() {
        assertThat(index.query(new float[]{0f, 1f}, SCALE, 2)).hasSize(2);
        assertThat(index.query(new float[]{0f, 1f}, SCALE, 50)).hasSize(5);
    }

    @Test
    void zeroComponentScoresZero() {
        List<SimilarityMatch> matches = index.query(new float[]{0f, 1f}, SCALE, 5);
        assertThat(matches).filteredOn(m -> m.id() == 4).singleElement()
            .extracting(SimilarityMatch::score).isEqualTo(0.0);
    }

    @Test
    void zeroQueryScoresEverythingZero() {
        List<SimilarityMatch> matches = index.query(new float[2], SCALE, 5);
        assertThat(matches).extracting(SimilarityMatch::score).containsOnly(0.0);
        assertThat(matches).extracting(SimilarityMatch::id).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    void everyStoredEmbeddingIsMostSimilarToItself() {
        Scale scale = Scale.of("r", 1, 20);
        ScaleRegistry random = new ScaleRegistry(ScaleSchema.of(scale), 16);
        random.store(scale).initialize(new GaussianInitializer(0.01, 99L));
        SimilarityIndex randomIndex = new SimilarityIndex(random);
        for (int id = 0; id < scale.cardinality(); id++) {
            assertThat(randomIndex.similarity(scale, id, id)).isCloseTo(1.0, within(1e-12));
            SimilarityMatch best = randomIndex.query(random.store(scale).get(id), scale, 1).get(0);
            assertThat(best.id()).isEqualTo(id);
        }
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> index.query(new float[]{1f, 0f}, SCALE, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> index.query(new float[3], SCALE, 1))
            .isInstanceOf(DimensionMismatchException.class);
    }
}
