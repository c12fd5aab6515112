package io.nosqlbench.fabric.integration;

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
import io.nosqlbench.fabric.EmbeddingFabric;
import io.nosqlbench.fabric.FabricConfig;
import io.nosqlbench.fabric.FabricException;
import io.nosqlbench.fabric.FabricFactory;
import io.nosqlbench.fabric.scale.MetadataKeys;
import io.nosqlbench.fabric.scale.Scale;
import io.nosqlbench.fabric.scale.ScaleSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ConceptRegistryTest {

    private static final Scale CONCEPTS = Scale.of("concepts", 1, 3);

    private EmbeddingFabric fabric;
    private ConceptRegistry registry;

    @BeforeEach
    void setUp() {
        fabric = FabricFactory.createFabric(FabricConfig.builder()
            .dimension(4)
            .seed(17L)
            .schema(ScaleSchema.of(CONCEPTS))
            .build());
        registry = new ConceptRegistry(fabric);
    }

    @Test
    void bindClaimsLowestFreeIdAndSetsMetadata() {
        assertThat(registry.bind("inflammation", CONCEPTS)).isEqualTo(0);
        assertThat(registry.bind("healing", CONCEPTS)).isEqualTo(1);

        assertThat(fabric.getMetadata(CONCEPTS, 0).getString(MetadataKeys.CONCEPT_NAME)).contains("inflammation");
        assertThat(fabric.getMetadata(CONCEPTS, 0).getString(MetadataKeys.SOURCE)).contains(ConceptRegistry.SOURCE);
        assertThat(fabric.getMetadata(CONCEPTS, 0).getString(MetadataKeys.TYPE)).contains(ConceptRegistry.CONCEPT_TYPE);
    }

    @Test
    void rebindingReturnsExistingId() {
        int first = registry.bind("barrier", CONCEPTS, new float[]{1f, 0f, 0f, 0f});
        int again = registry.bind("barrier", CONCEPTS, new float[]{0f, 1f, 0f, 0f});
        assertThat(again).isEqualTo(first);
        assertThat(fabric.getEmbedding(CONCEPTS, first)).containsExactly(1f, 0f, 0f, 0f);
    }

    @Test
    void featuresMustMatchDimension() {
        assertThatThrownBy(() -> registry.bind("x", CONCEPTS, new float[3]))
            .isInstanceOf(DimensionMismatchException.class);
        assertThat(registry.lookup("x", CONCEPTS)).isEmpty();
    }

    @Test
    void fullScaleRejectsNewConcepts() {
        registry.bind("a", CONCEPTS);
        registry.bind("b", CONCEPTS);
        registry.bind("c", CONCEPTS);
        assertThatThrownBy(() -> registry.bind("d", CONCEPTS)).isInstanceOf(FabricException.class);
    }

    @Test
    void describeListsOtherComponents() {
        registry.bind("a", CONCEPTS, new float[]{1f, 0f, 0f, 0f});
        registry.bind("b", CONCEPTS, new float[]{1f, 0.1f, 0f, 0f});
        registry.bind("c", CONCEPTS, new float[]{0f, 0f, 1f, 0f});

        ConceptRegistry.ConceptDescription description = registry.describe("a", CONCEPTS, 5);
        assertThat(description.componentId()).isEqualTo(0);
        assertThat(description.related()).hasSize(2);
        assertThat(description.related().get(0).id()).isEqualTo(1);
        assertThat(description.related()).noneMatch(m -> m.id() == 0);

        assertThatThrownBy(() -> registry.describe("unbound", CONCEPTS, 1)).isInstanceOf(FabricException.class);
    }

    @Test
    void bindingsSurviveSaveAndLoad(@TempDir Path tempDir) throws Exception {
        registry.bind("a", CONCEPTS);
        int id = registry.bind("b", CONCEPTS);
        Path path = tempDir.resolve("concepts.json");
        fabric.save(path);

        ConceptRegistry reloaded = new ConceptRegistry(EmbeddingFabric.load(path));
        assertThat(reloaded.lookup("b", CONCEPTS)).hasValue(id);
        assertThat(reloaded.bind("c", CONCEPTS)).isEqualTo(2);
    }

    @Test
    void describeWithHugeKReturnsEveryOtherComponent() {
        registry.bind("a", CONCEPTS);
        ConceptRegistry.ConceptDescription description = registry.describe("a", CONCEPTS, Integer.MAX_VALUE);
        assertThat(description.related()).hasSize(2);
        assertThat(description.related()).noneMatch(m -> m.id() == 0);
    }

    @Test
    void registriesSharingAFabricNeverClaimTheSameComponent() throws Exception {
        Scale wide = Scale.of("wide", 1, 64);
        EmbeddingFabric shared = FabricFactory.createFabric(FabricConfig.builder()
            .dimension(4)
            .seed(3L)
            .schema(ScaleSchema.of(wide))
            .build());
        int threads = 8;
        int perThread = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<List<Integer>>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                ConceptRegistry own = new ConceptRegistry(shared);
                int thread = t;
                futures.add(pool.submit(() -> {
                    List<Integer> ids = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(own.bind("concept-" + thread + "-" + i, wide));
                    }
                    return ids;
                }));
            }
            Set<Integer> claimed = new HashSet<>();
            for (Future<List<Integer>> future : futures) {
                claimed.addAll(future.get(30, TimeUnit.SECONDS));
            }
            assertThat(claimed).hasSize(threads * perThread);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentBindsOfOneConceptAgreeOnItsComponent() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 4; t++) {
                ConceptRegistry own = new ConceptRegistry(fabric);
                futures.add(pool.submit(() -> own.bind("shared", CONCEPTS)));
            }
            Set<Integer> ids = new HashSet<>();
            for (Future<Integer> future : futures) {
                ids.add(future.get(30, TimeUnit.SECONDS));
            }
            assertThat(ids).containsExactly(0);
        } finally {
            pool.shutdownNow();
        }
    }
}
