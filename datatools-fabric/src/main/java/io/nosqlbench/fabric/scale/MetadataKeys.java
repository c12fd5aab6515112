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

/// Well-known component metadata keys.
///
/// Metadata maps are open, so collaborators may add keys beyond these.
public final class MetadataKeys {

    /// Human-readable component name.
    public static final String NAME = "name";
    /// Free-text description.
    public static final String DESCRIPTION = "description";
    /// Component kind, e.g. `cell` or `structure` at the cellular scale.
    public static final String TYPE = "type";
    /// Tissue layer, e.g. `epidermis`.
    public static final String LAYER = "layer";
    /// Body part at the region scale.
    public static final String BODY_PART = "body_part";
    /// Physiological function at the system scale.
    public static final String FUNCTION = "function";
    /// Concept bound to the component by knowledge mapping.
    public static final String CONCEPT_NAME = "concept_name";
    /// The collaborator that wrote the metadata.
    public static final String SOURCE = "source";

    private MetadataKeys() {
    }
}
