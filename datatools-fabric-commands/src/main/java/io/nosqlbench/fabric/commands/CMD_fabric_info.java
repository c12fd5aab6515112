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
import io.nosqlbench.fabric.FabricStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_ERROR;
import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_FILE_ERROR;
import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_SUCCESS;

/// Show the layout and embedding norm statistics of a fabric snapshot.
@CommandLine.Command(
    name = "info",
    header = "Show fabric snapshot information",
    description = "Displays dimension, scales, norm statistics per scale and the number of transforms.",
    exitCodeList = {
        "0: Success",
        "1: Error reading file",
        "2: Invalid snapshot"
    }
)
public class CMD_fabric_info implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_fabric_info.class);

    @CommandLine.Option(names = {"--input", "-i"}, description = "Path to the fabric snapshot", required = true)
    private Path inputPath;

    @Override
    public Integer call() {
        try {
            EmbeddingFabric fabric = FabricCommandSupport.load(inputPath);
            FabricStatistics stats = fabric.statistics();

            System.out.printf("Fabric:            %s%n", inputPath.toAbsolutePath());
            System.out.printf("Dimension:         %d%n", stats.dimension());
            System.out.printf("Components:        %,d%n", stats.totalComponents());
            System.out.printf("Transforms:        %d%n", stats.transformCount());
            System.out.printf("Learning rate:     %s%n", fabric.config().learningRate());
            System.out.printf("Integrations:      %s%n",
                stats.integrations().isEmpty() ? "(none)" : String.join(", ", stats.integrations()));
            System.out.println();
            System.out.printf("%-12s %5s %7s %12s %12s %12s %12s%n",
                "scale", "level", "count", "norm mean", "norm std", "norm min", "norm max");
            for (FabricStatistics.ScaleStatistics s : stats.scales()) {
                System.out.printf("%-12s %5d %7d %12.6f %12.6f %12.6f %12.6f%n",
                    s.name(), s.level(), s.count(), s.norms().mean, s.norms().stdDev, s.norms().min, s.norms().max);
            }
            return EXIT_SUCCESS;
        } catch (IOException e) {
            logger.error("Error reading fabric snapshot", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_FILE_ERROR;
        } catch (FabricException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
