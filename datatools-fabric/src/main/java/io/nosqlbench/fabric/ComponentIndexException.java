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

/// Thrown when a component id is outside `[0, cardinality)` for its scale.
public class ComponentIndexException extends FabricException {

    private final String scaleName;
    private final int componentId;
    private final int cardinality;

    /// Creates a new component index exception.
    ///
    /// @param scaleName the scale that was addressed
    /// @param componentId the offending id
    /// @param cardinality the number of components at that scale
    public ComponentIndexException(String scaleName, int componentId, int cardinality) {
        super("Component id " + componentId + " out of range for scale '" + scaleName
            + "' (cardinality " + cardinality + ")");
        this.scaleName = scaleName;
        this.componentId = componentId;
        this.cardinality = cardinality;
    }

    public String getScaleName() {
        return scaleName;
    }

    public int getComponentId() {
        return componentId;
    }

    public int getCardinality() {
        return cardinality;
    }
}
