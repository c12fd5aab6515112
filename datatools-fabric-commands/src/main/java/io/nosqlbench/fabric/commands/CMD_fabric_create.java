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
import io.nosqlbench.fabric.FabricConfig;
import io.nosqlbench.fabric.FabricException;
import io.nosqlbench.fabric.FabricFactory;
import io.nosqlbench.fabric.TransformInit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_ERROR;
import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_FILE_ERROR;
import static io.nosqlbench.fabric.commands.FabricCommandSupport.EXIT_SUCCESS;

/// Create a new fabric and write it as a snapshot.
///
/// Options given on the command line override values from `--config`.
///
/// ```bash
/// fabric create -o skin.json --seed 42
/// fabric create -o small.json --config small-fabric.json -d 16 --force
/// ```
@CommandLine.Command(
    name = "create",
    header = "Create a new fabric snapshot",
    description = "Initializes every embedding and transform and saves the fabric as JSON.",
    exitCodeList = {
        "0: Success",
        "1: Output exists without --force, or file error",
        "2: Invalid configuration"
    }
)
public class CMD_fabric_create implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_fabric_create.class);

    @CommandLine.Option(names = {"-o", "--output"}, description = "The snapshot file to write", required = true)
    private Path outputPath;

    @CommandLine.Option(names = {"--config"}, description = "Fabric configuration JSON")
    private Path configPath;

    @CommandLine.Option(names = {"-d", "--dimension"}, description = "Embedding dimension")
    private Integer dimension;

    @CommandLine.Option(names = {"--init-std"}, description = "Standard deviation of the initial embeddings")
    private Double initStd;

    @CommandLine.Option(names = {"--learning-rate"}, description = "Default learning rate stored with the fabric")
    private Double learningRate;

    @CommandLine.Option(names = {"-s", "--seed"}, description = "Random seed for reproducible initialization")
    private Long seed;

    @CommandLine.Option(names = {"--transform-init"},
        description = "Transform initialization (${COMPLETION-CANDIDATES})")
    private TransformInit transformInit;

    @CommandLine.Option(names = {"--force"}, description = "Force overwrite if output file already exists")
    private boolean force = false;

    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_fabric_create()).execute(args));
    }

    @Override
    public Integer call() {
        outputPath = outputPath.normalize();
        if (Files.exists(outputPath) && !force) {
            System.err.println("Error: Output file already exists. Use --force to overwrite.");
            return EXIT_FILE_ERROR;
        }

        FabricConfig config;
        try {
            FabricConfig base = configPath != null ? FabricConfig.load(configPath) : FabricConfig.defaults();
            FabricConfig.Builder builder = base.toBuilder();
            if (dimension != null) builder.dimension(dimension);
            if (initStd != null) builder.initStd(initStd);
            if (learningRate != null) builder.learningRate(learningRate);
            if (seed != null) builder.seed(seed);
            if (transformInit != null) builder.transformInit(transformInit);
            config = builder.build();
        } catch (IOException e) {
            System.err.println("Error: Cannot read config " + configPath + ": " + e.getMessage());
            return EXIT_FILE_ERROR;
        } catch (FabricException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        try {
            Path parent = outputPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            EmbeddingFabric fabric = FabricFactory.createFabric(config);
            fabric.save(outputPath);
            System.out.printf("Created fabric with dimension %d and %d components in %s%n",
                config.dimension(), config.schema().totalComponents(), outputPath);
            return EXIT_SUCCESS;
        } catch (IOException e) {
            logger.error("Error writing fabric snapshot", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_FILE_ERROR;
        }
    }
}
