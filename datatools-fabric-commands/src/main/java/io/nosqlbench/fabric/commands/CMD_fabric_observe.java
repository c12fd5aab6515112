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
import io.nosqlbench.fabric.vector.VectorUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_ERROR;
import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_FILE_ERROR;
import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_SUCCESS;

/// Apply one observation to a component and rewrite the snapshot in place.
///
/// ```bash
/// fabric observe -i skin.json --scale tissue --component 3 --values=0.1,-0.2,0.3,0.0 --rate 0.5
/// ```
@CommandLine.Command(
    name = "observe",
    header = "Update a component from an observation",
    description = "Moves a component's embedding toward an observed vector and saves the fabric.",
    exitCodeList = {
        "0: Success",
        "1: Error reading or writing file",
        "2: Invalid arguments"
    }
)
public class CMD_fabric_observe implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_fabric_observe.class);

    @CommandLine.Option(names = {"--input", "-i"}, description = "Path to the fabric snapshot", required = true)
    private Path inputPath;

    @CommandLine.Option(names = {"--scale"}, description = "Scale of the component", required = true)
    private String scaleName;

    @CommandLine.Option(names = {"--component", "-c"}, description = "Component id", required = true)
    private int componentId;

    @CommandLine.Option(names = {"--values"}, split = ",", description = "Observed vector, comma separated",
        required = true)
    private float[] values;

    @CommandLine.Option(names = {"--rate"}, description = "Learning rate in [0, 1] (default: the fabric's)")
    private Double rate;

    @Override
    public Integer call() {
        try {
            EmbeddingFabric fabric = FabricCommandSupport.load(inputPath);
            Scale scale = fabric.scale(scaleName);
            double effectiveRate = rate != null ? rate : fabric.config().learningRate();
            float[] before = fabric.getEmbedding(scale, componentId);
            float[] after = fabric.updateFromObservation(scale, componentId, values, effectiveRate);
            fabric.save(inputPath);

            System.out.printf("Updated %s[%d] at rate %s: distance to observation %.6f -> %.6f%n",
                scale.name(), componentId, effectiveRate,
                VectorUtils.euclideanDistance(before, values), VectorUtils.euclideanDistance(after, values));
            return EXIT_SUCCESS;
        } catch (IOException e) {
            logger.error("Error updating fabric snapshot", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_FILE_ERROR;
        } catch (FabricException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
