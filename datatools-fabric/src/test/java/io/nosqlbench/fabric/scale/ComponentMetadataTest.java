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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ComponentMetadataTest {

    @Test
    void builderSetsDocumentedKeys() {
        ComponentMetadata m = ComponentMetadata.builder()
            .name("keratinocyte")
            .description("Primary epidermal cell")
            .put(MetadataKeys.TYPE, "cell")
            .build();
        assertThat(m.name()).contains("keratinocyte");
        assertThat(m.description()).contains("Primary epidermal cell");
        assertThat(m.getString(MetadataKeys.TYPE)).contains("cell");
        assertThat(m.size()).isEqualTo(3);
    }

    @Test
    void integralNumbersAreNormalizedToLong() {
        ComponentMetadata m = ComponentMetadata.of(Map.of("count", 3, "weight", 0.5f));
        assertThat(m.get("count")).isEqualTo(3L);
        assertThat(m.get("weight")).isEqualTo(0.5d);
    }

    @Test
    void copiesAreDeepAndImmutable() {
        Map<String, Object> source = new HashMap<>();
        source.put("tags", List.of("a", "b"));
        ComponentMetadata m = ComponentMetadata.of(source);
        source.put("extra", 1);
        assertThat(m.containsKey("extra")).isFalse();
        assertThatThrownBy(() -> m.asMap().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void withAndMergeReturnNewInstances() {
        ComponentMetadata base = ComponentMetadata.builder().name("dermis").build();
        ComponentMetadata tagged = base.with(MetadataKeys.LAYER, "dermis");
        assertThat(base.containsKey(MetadataKeys.LAYER)).isFalse();
        assertThat(tagged.getString(MetadataKeys.LAYER)).contains("dermis");

        ComponentMetadata merged = tagged.merge(ComponentMetadata.of(Map.of(MetadataKeys.NAME, "renamed")));
        assertThat(merged.name()).contains("renamed");
        assertThat(merged.getString(MetadataKeys.LAYER)).contains("dermis");
    }

    @Test
    void rejectsNonJsonValues() {
        assertThatThrownBy(() -> ComponentMetadata.of(Map.of("bad", new Object())))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ComponentMetadata.of(Map.of("nan", Double.NaN)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalityIsByContent() {
        assertThat(ComponentMetadata.of(Map.of("n", 1)))
            .isEqualTo(ComponentMetadata.of(Map.of("n", 1L)))
            .hasSameHashCodeAs(ComponentMetadata.of(Map.of("n", 1L)));
        assertThat(ComponentMetadata.of(Map.of())).isSameAs(ComponentMetadata.EMPTY);
    }
}
