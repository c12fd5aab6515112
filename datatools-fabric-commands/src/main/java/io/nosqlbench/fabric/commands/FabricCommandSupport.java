package io.nosqlbench.fabric.commands;

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

import io.nosqlbench.fabric.EmbeddingFabric;
import io.nosqlbench.fabric.scale.ComponentMetadata;
import io.nosqlbench.fabric.scale.MetadataKeys;

import java.io.IOException;
import java.nio.file.Path;

/// Exit codes and helpers shared by the fabric subcommands.
final class FabricCommandSupport {

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FILE_ERROR = 1;
    static final int EXIT_ERROR = 2;

    private FabricCommandSupport() {
    }

    static EmbeddingFabric load(Path input) throws IOException {
        return EmbeddingFabric.load(input);
    }

    /// Short label for a component: its catalog or concept name, or empty.
    static String label(ComponentMetadata metadata) {
        return metadata.name()
            .or(() -> metadata.getString(MetadataKeys.CONCEPT_NAME))
            .orElse("");
    }
}
