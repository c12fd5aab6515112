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
import io.nosqlbench.fabric.InvalidVectorException;
import io.nosqlbench.fabric.vector.GaussianInitializer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class EmbeddingStoreTest {

    private static final Scale SCALE = Scale.of("a", 1, 3);

    @Test
    void newStoreHoldsZeroVectorsAndEmptyMetadata() {
        EmbeddingStore store = new EmbeddingStore(SCALE, 4);
        assertEquals(3, store.count());
        assertArrayEquals(new float[4], store.get(2));
        assertSame(ComponentMetadata.EMPTY, store.getMetadata(0));
    }

    @Test
    void getReturnsCopy() {
        EmbeddingStore store = new EmbeddingStore(SCALE, 2);
        store.set(0, new float[]{1f, 2f});
        float[] v = store.get(0);
        v[0] = 99f;
        assertArrayEquals(new float[]{1f, 2f}, store.get(0));
    }

    @Test
    void setCopiesInput() {
        EmbeddingStore store = new EmbeddingStore(SCALE, 2);
        float[] input = {1f, 2f};
        store.set(1, input);
        input[1] = -5f;
        assertArrayEquals(new float[]{1f, 2f}, store.get(1));
    }

    @Test
    void outOfRangeIdsAreRejected() {
        EmbeddingStore store = new EmbeddingStore(SCALE, 2);
        ComponentIndexException e = assertThrows(ComponentIndexException.class, () -> store.get(3));
        assertEquals("a", e.getScaleName());
        assertEquals(3, e.getComponentId());
        assertThrows(ComponentIndexException.class, () -> store.get(-1));
        assertThrows(ComponentIndexException.class, () -> store.set(3, new float[2]));
        assertThrows(ComponentIndexException.class, () -> store.getMetadata(7));
    }

    @Test
    void wrongDimensionIsRejectedWithoutMutation() {
        EmbeddingStore store = new EmbeddingStore(SCALE, 2);
        store.set(0, new float[]{1f, 1f});
        DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
            () -> store.set(0, new float[]{1f, 2f, 3f}));
        assertEquals(2, e.getExpected());
        assertEquals(3, e.getActual());
        assertArrayEquals(new float[]{1f, 1f}, store.get(0));
    }

    @Test
    void nonFiniteValuesAreRejected() {
        EmbeddingStore store = new EmbeddingStore(SCALE, 2);
        assertThrows(InvalidVectorException.class, () -> store.set(0, new float[]{Float.NaN, 0f}));
        assertThrows(InvalidVectorException.class,
            () -> store.update(0, v -> new float[]{Float.POSITIVE_INFINITY, 0f}));
        assertArrayEquals(new float[2], store.get(0));
    }

    @Test
    void forEachVisitsEveryComponentInOrder() {
        EmbeddingStore store = new EmbeddingStore(SCALE, 2);
        store.initialize(new GaussianInitializer(0.1, 1L));
        List<Integer> ids = new ArrayList<>();
        store.forEach((id, embedding) -> ids.add(id));
        assertEquals(List.of(0, 1, 2), ids);
    }

    @Test
    void replaceAllRequiresMatchingCounts() {
        EmbeddingStore store = new EmbeddingStore(SCALE, 2);
        float[][] rows = {{1f, 0f}, {0f, 1f}};
        assertThrows(IllegalArgumentException.class,
            () -> store.replaceAll(rows, Collections.nCopies(2, ComponentMetadata.EMPTY)));
    }

    @Test
    void concurrentUpdatesAreNotLost() throws Exception {
        EmbeddingStore store = new EmbeddingStore(SCALE, 1);
        int threads = 8;
        int perThread = 1000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.update(0, v -> new float[]{v[0] + 1f});
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        assertEquals(threads * perThread, store.get(0)[0]);
    }

    @Test
    void updateMetadataWritesNothingWhenOperatorFails() {
        EmbeddingStore store = new EmbeddingStore(SCALE, 2);
        ComponentMetadata original = ComponentMetadata.builder().name("keep").build();
        store.setMetadata(1, original);

        assertThrows(IllegalStateException.class, () -> store.updateMetadata(1, m -> {
            throw new IllegalStateException("boom");
        }));
        assertThrows(NullPointerException.class, () -> store.updateMetadata(1, m -> null));
        assertSame(original, store.getMetadata(1));
        assertThrows(ComponentIndexException.class, () -> store.updateMetadata(3, m -> m));
    }

    @Test
    void concurrentMetadataUpdatesAreNotLost() throws Exception {
        EmbeddingStore store = new EmbeddingStore(SCALE, 1);
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                int base = t * perThread;
                pool.submit(() -> {
                    start.await();
                    for (int i = base; i < base + perThread; i++) {
                        String key = "k" + i;
                        store.updateMetadata(2, m -> m.with(key, true));
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        assertEquals(threads * perThread, store.getMetadata(2).size());
    }
}
