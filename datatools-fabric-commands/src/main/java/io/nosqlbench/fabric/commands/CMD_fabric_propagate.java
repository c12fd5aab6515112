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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_ERROR;
import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_FILE_ERROR;
import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_SUCCESS;

/// Propagate a signal from one component into every component of a target scale.
@CommandLine.Command(
    name = "propagate",
    header = "Propagate a signal across scales",
    description = "Transforms a source embedding into the target scale and prints the activation of every target component.",
    exitCodeList = {
        "0: Success",
        "1: Error reading file",
        "2: Invalid arguments or missing transform"
    }
)
public class CMD_fabric_propagate implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_fabric_propagate.class);

    @CommandLine.Option(names = {"--input", "-i"}, description = "Path to the fabric snapshot", required = true)
    private Path inputPath;

    @CommandLine.Option(names = {"--from"}, description = "Source scale", required = true)
    private String fromScale;

    @CommandLine.Option(names = {"--id"}, description = "Source component id", required = true)
    private int sourceId;

    @CommandLine.Option(names = {"--to"}, description = "Target scale", required = true)
    private String toScale;

    @CommandLine.Option(names = {"--strength"}, description = "Signal strength (default: ${DEFAULT-VALUE})",
        defaultValue = "1.0")
    private double strength;

    @Override
    public Integer call() {
        try {
            EmbeddingFabric fabric = FabricCommandSupport.load(inputPath);
            Scale from = fabric.scale(fromScale);
            Scale to = fabric.scale(toScale);
            Map<Integer, Double> activations = fabric.propagateSignal(from, sourceId, to, strength);

            System.out.printf("Propagated %s[%d] -> %s with strength %s%n", from.name(), sourceId, to.name(), strength);
            for (Map.Entry<Integer, Double> entry : activations.entrySet()) {
                System.out.printf("%5d  %.6f  %s%n", entry.getKey(), entry.getValue(),
                    FabricCommandSupport.label(fabric.getMetadata(to, entry.getKey())));
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
