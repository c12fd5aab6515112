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
import io.nosqlbench.fabric.FabricException;
import io.nosqlbench.fabric.scale.Scale;
import io.nosqlbench.fabric.similarity.SimilarityMatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_ERROR;
import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_FILE_ERROR;
import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_SUCCESS;

/// List the components most similar to a given component of the same scale.
///
/// The component itself is left out of the listing.
@CommandLine.Command(
    name = "query",
    header = "Find components similar to a component",
    description = "Ranks the components of a scale by cosine similarity to one of them.",
    exitCodeList = {
        "0: Success",
        "1: Error reading file",
        "2: Invalid arguments"
    }
)
public class CMD_fabric_query implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_fabric_query.class);

    @CommandLine.Option(names = {"--input", "-i"}, description = "Path to the fabric snapshot", required = true)
    private Path inputPath;

    @CommandLine.Option(names = {"--scale"}, description = "Scale to search", required = true)
    private String scaleName;

    @CommandLine.Option(names = {"--component", "-c"}, description = "Component id whose embedding is the query",
        required = true)
    private int componentId;

    @CommandLine.Option(names = {"-k", "--top-k"}, description = "Number of results (default: ${DEFAULT-VALUE})",
        defaultValue = "5")
    private int topK;

    @Override
    public Integer call() {
        if (topK < 1) {
            System.err.println("Error: -k must be at least 1");
            return EXIT_ERROR;
        }
        try {
            EmbeddingFabric fabric = FabricCommandSupport.load(inputPath);
            Scale scale = fabric.scale(scaleName);
            float[] query = fabric.getEmbedding(scale, componentId);
            int limit = Math.min(topK, scale.cardinality() - 1) + 1;
            List<SimilarityMatch> matches = fabric.querySimilar(query, scale, limit);

            System.out.printf("Most similar to %s[%d] %s%n", scale.name(), componentId,
                FabricCommandSupport.label(fabric.getMetadata(scale, componentId)));
            int rank = 0;
            for (SimilarityMatch match : matches) {
                if (match.id() == componentId || rank == topK) {
                    continue;
                }
                rank++;
                System.out.printf("%3d. %5d  %.6f  %s%n", rank, match.id(), match.score(),
                    FabricCommandSupport.label(fabric.getMetadata(scale, match.id())));
            }
            return EXIT_SUCCESS;
        } catch (IOException e) {
            logger.error("Error reading fabric snapshot", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_FILE_ERROR;
        } catch (FabricException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
