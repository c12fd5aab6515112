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

import java.util.List;
import java.util.Optional;

/// Default human-readable metadata for the skin scales.
///
/// | Scale | Entries | Extra key |
/// |-------|---------|-----------|
/// | cellular | cell types and dermal structures | `type`: `cell` or `structure` |
/// | tissue | epidermal strata, dermis, hypodermis | `layer` |
/// | region | body regions | `body_part` |
/// | system | whole-body functions | `function` |
///
/// Entries are applied by scale name, to the lowest component ids, and only
/// while ids are within the scale's cardinality. Scales with other names are
/// left untouched.
public final class DefaultComponentCatalog {

    static final List<String> CELLULAR = List.of(
        "keratinocyte", "melanocyte", "langerhans_cell", "merkel_cell",
        "fibroblast", "collagen", "elastin", "sebaceous_gland");

    static final List<String> TISSUE = List.of(
        "stratum_corneum", "stratum_lucidum", "stratum_granulosum",
        "stratum_spinosum", "stratum_basale", "papillary_dermis",
        "reticular_dermis", "hypodermis");

    static final List<String> REGION = List.of(
        "face", "scalp", "neck", "chest", "back", "arms", "hands",
        "abdomen", "legs", "feet");

    static final List<String> SYSTEM = List.of(
        "barrier_function", "immune_response", "thermal_regulation",
        "sensory_perception", "vitamin_synthesis");

    private DefaultComponentCatalog() {
    }

    /// Writes catalog metadata into every matching store of a registry.
    ///
    /// @param registry the registry to annotate
    /// @return the number of components annotated
    public static int apply(ScaleRegistry registry) {
        int annotated = 0;
        for (EmbeddingStore store : registry.stores()) {
            List<String> names = namesFor(store.scale().name()).orElse(List.of());
            int limit = Math.min(names.size(), store.count());
            for (int id = 0; id < limit; id++) {
                store.setMetadata(id, entry(store.scale().name(), names.get(id)));
                annotated++;
            }
        }
        return annotated;
    }

    /// Catalog names for a scale name, if the catalog covers it.
    public static Optional<List<String>> namesFor(String scaleName) {
        switch (scaleName) {
            case "cellular":
                return Optional.of(CELLULAR);
            case "tissue":
                return Optional.of(TISSUE);
            case "region":
                return Optional.of(REGION);
            case "system":
                return Optional.of(SYSTEM);
            default:
                return Optional.empty();
        }
    }

    static ComponentMetadata entry(String scaleName, String componentName) {
        ComponentMetadata.Builder builder = ComponentMetadata.builder().name(componentName);
        switch (scaleName) {
            case "cellular":
                boolean cell = componentName.contains("cell") || componentName.contains("cyte");
                builder.put(MetadataKeys.TYPE, cell ? "cell" : "structure");
                break;
            case "tissue":
                builder.put(MetadataKeys.LAYER, componentName.contains("stratum") ? "epidermis" : "dermis");
                break;
            case "region":
                builder.put(MetadataKeys.BODY_PART, componentName);
                break;
            case "system":
                builder.put(MetadataKeys.FUNCTION, componentName);
                break;
            default:
                break;
        }
        return builder.build();
    }
}
