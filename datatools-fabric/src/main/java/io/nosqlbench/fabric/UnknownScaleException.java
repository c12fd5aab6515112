package io.nosqlbench.fabric;

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

/// Thrown when a scale is addressed that is not part of a fabric's schema.
public class UnknownScaleException extends FabricException {

    private final String scaleName;

    /// @param scaleName the name of the scale that could not be resolved
    public UnknownScaleException(String scaleName) {
        super("Unknown scale: " + scaleName);
        this.scaleName = scaleName;
    }

    public String getScaleName() {
        return scaleName;
    }
}
