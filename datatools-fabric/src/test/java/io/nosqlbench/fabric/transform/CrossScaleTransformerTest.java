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

import io.nosqlbench.fabric.DimensionMismatchException;
import io.nosqlbench.fabric.MissingTransformException;
import io.nosqlbench.fabric.TransformInit;
import io.nosqlbench.fabric.UnknownScaleException;
import io.nosqlbench.fabric.scale.Scale;
import io.nosqlbench.fabric.scale.ScalePair;
import io.nosqlbench.fabric.scale.ScaleSchema;
import io.nosqlbench.fabric.vector.GaussianInitializer;
import io.nosqlbench.fabric.vector.VectorUtils;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class CrossScaleTransformerTest {

    private static final Scale A = Scale.of("a", 1, 3);
    private static final Scale B = Scale.of("b", 2, 2);
    private static final Scale C = Scale.of("c", 3, 1);
    private static final ScaleSchema SCHEMA = ScaleSchema.of(A, B, C);

    @Test
    void initializesEveryOrderedPair() {
        CrossScaleTransformer transformer = new CrossScaleTransformer(SCHEMA, 4);
        transformer.initialize(TransformInit.GAUSSIAN, new GaussianInitializer(0.01, 5L));
        assertThat(transformer.pairs()).containsExactlyElementsOf(SCHEMA.orderedPairs());
    }

    @Test
    void sameScaleReturnsCopyOfInput() {
        CrossScaleTransformer transformer = new CrossScaleTransformer(SCHEMA, 2);
        float[] v = {1f, 2f};
        float[] out = transformer.transform(v, A, A);
        assertThat(out).containsExactly(1f, 2f);
        assertThat(out).isNotSameAs(v);
    }

    @Test
    void appliesRegisteredMatrix() {
        CrossScaleTransformer transformer = new CrossScaleTransformer(SCHEMA, 2);
        transformer.register(A, B, new float[][]{{0f, 1f}, {1f, 0f}});
        assertThat(transformer.transform(new float[]{3f, 4f}, A, B)).containsExactly(4f, 3f);
    }

    @Test
    void missingPairThrowsAndMutatesNothing() {
        CrossScaleTransformer transformer = new CrossScaleTransformer(SCHEMA, 2);
        transformer.register(A, B, VectorUtils.identity(2));
        float[] input = {1f, 2f};

        assertThatThrownBy(() -> transformer.transform(input, B, A))
            .isInstanceOf(MissingTransformException.class)
            .hasMessageContaining("b->a");
        assertThat(input).containsExactly(1f, 2f);
        assertThat(transformer.pairs()).containsExactly(ScalePair.of(A, B));
        assertThat(transformer.matrix(A, B)).isDeepEqualTo(VectorUtils.identity(2));
    }

    @Test
    void reverseMatrixIsIndependent() {
        CrossScaleTransformer transformer = new CrossScaleTransformer(SCHEMA, 2);
        transformer.register(A, B, VectorUtils.identity(2));
        transformer.register(B, A, VectorUtils.identity(2));

        transformer.train(A, B, new float[]{1f, 0f}, new float[]{0f, 1f}, 1.0);

        assertThat(transformer.matrix(B, A)).isDeepEqualTo(VectorUtils.identity(2));
        float[][] trained = transformer.matrix(A, B);
        assertThat(trained[0][0]).isEqualTo(0f);
        assertThat(trained[1][0]).isEqualTo(1f);
    }

    @Test
    void trainingWithFullRateMapsInputOntoTarget() {
        CrossScaleTransformer transformer = new CrossScaleTransformer(SCHEMA, 3);
        transformer.register(A, C, new GaussianInitializer(0.1, 11L).matrix(3));
        float[] input = {0.5f, -1f, 2f};
        float[] target = {1f, 0f, -1f};

        double before = transformer.train(A, C, input, target, 1.0);
        float[] mapped = transformer.transform(input, A, C);

        assertThat(before).isGreaterThan(0.0);
        for (int i = 0; i < 3; i++) {
            assertThat((double) mapped[i]).isCloseTo(target[i], within(1e-5));
        }
    }

    @Test
    void trainingReducesError() {
        CrossScaleTransformer transformer = new CrossScaleTransformer(SCHEMA, 3);
        transformer.register(A, B, new GaussianInitializer(0.1, 13L).matrix(3));
        float[] input = {1f, 1f, 0f};
        float[] target = {0f, 2f, 1f};
        double previous = Double.MAX_VALUE;
        for (int step = 0; step < 5; step++) {
            double error = transformer.train(A, B, input, target, 0.5);
            assertThat(error).isLessThan(previous);
            previous = error;
        }
    }

    @Test
    void validatesInputs() {
        CrossScaleTransformer transformer = new CrossScaleTransformer(SCHEMA, 2);
        transformer.register(A, B, VectorUtils.identity(2));
        assertThatThrownBy(() -> transformer.transform(new float[3], A, B))
            .isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> transformer.register(A, B, VectorUtils.identity(3)))
            .isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> transformer.transform(new float[2], Scale.of("z", 9, 1), A))
            .isInstanceOf(UnknownScaleException.class);
        assertThatThrownBy(() -> transformer.train(A, B, new float[2], new float[2], 1.5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void replaceAllSwapsEveryMatrix() {
        CrossScaleTransformer transformer = new CrossScaleTransformer(SCHEMA, 2);
        transformer.initialize(TransformInit.GAUSSIAN, new GaussianInitializer(0.01, 5L));
        Map<ScalePair, float[][]> replacement = new LinkedHashMap<>();
        for (ScalePair pair : SCHEMA.orderedPairs()) {
            replacement.put(pair, new float[][]{{2f, 0f}, {0f, 2f}});
        }
        transformer.replaceAll(replacement);
        assertThat(transformer.transform(new float[]{1f, 1f}, C, A)).containsExactly(2f, 2f);
        assertThat(transformer.transform(new float[]{1f, 3f}, A, B)).containsExactly(2f, 6f);
    }

    @Test
    void replaceAllRejectsIncompleteSetAndKeepsCurrentMatrices() {
        CrossScaleTransformer transformer = new CrossScaleTransformer(SCHEMA, 2);
        transformer.initialize(TransformInit.GAUSSIAN, new GaussianInitializer(0.01, 5L));
        Map<ScalePair, float[][]> before = transformer.copyAll();

        assertThatThrownBy(() -> transformer.replaceAll(Map.of(ScalePair.of(C, A), VectorUtils.identity(2))))
            .isInstanceOf(MissingTransformException.class)
            .hasMessageContaining("a->b");
        assertThat(transformer.pairs()).containsExactlyElementsOf(SCHEMA.orderedPairs());
        assertThat(transformer.matrix(A, B)).isDeepEqualTo(before.get(ScalePair.of(A, B)));
    }
}
