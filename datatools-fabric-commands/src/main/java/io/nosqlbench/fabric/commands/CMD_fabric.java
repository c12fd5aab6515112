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

import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The fabric command contains subcommands to create, inspect, query and
/// update fabric snapshot files.
///
/// This is an umbrella command for the fabric subcommands.
///
/// ## Usage
///
/// ```bash
/// fabric create -o skin.json --seed 42
/// fabric info -i skin.json
/// fabric query -i skin.json --scale tissue --component 3 -k 5
/// fabric propagate -i skin.json --from cellular --id 0 --to tissue --strength 10
/// fabric observe -i skin.json --scale tissue --component 3 --values 0.1,0.2,...
/// ```
@CommandLine.Command(name = "fabric",
    header = "Create, inspect and update multi-scale embedding fabrics",
    description = "Contains subcommands that operate on fabric snapshot files",
    subcommands = {
        CMD_fabric_create.class,
        CMD_fabric_info.class,
        CMD_fabric_query.class,
        CMD_fabric_propagate.class,
        CMD_fabric_observe.class
    })
public class CMD_fabric implements Callable<Integer> {

    /// Run CMD_fabric
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_fabric()).execute(args));
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
