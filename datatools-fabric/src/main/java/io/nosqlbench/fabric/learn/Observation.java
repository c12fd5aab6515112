package io.nosqlbench.fabric.learn;

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

import io.nosqlbench.fabric.scale.Scale;

import java.util.Arrays;
import java.util.Objects;

/// An observed vector for one component, the unit of batch learning.
///
/// @param scale the component's scale
/// @param componentId the component's id
/// @param values the observed vector
public record Observation(Scale scale, int componentId, float[] values) {

    public Observation {
        Objects.requireNonNull(scale, "scale cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        values = values.clone();
    }

    @Override
    public float[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Observation)) return false;
        Observation other = (Observation) o;
        return componentId == other.componentId
            && scale.equals(other.scale)
            && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(scale, componentId) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Observation[scale=" + scale.name() + ", componentId=" + componentId
            + ", values=" + Arrays.toString(values) + "]";
    }
}
