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

/// Thrown when no transform matrix is registered for an ordered scale pair.
///
/// The fabric never substitutes the identity or the reverse-direction matrix
/// for a missing one.
public class MissingTransformException extends FabricException {

    private final String fromScale;
    private final String toScale;

    /// Creates a new missing transform exception.
    ///
    /// @param fromScale name of the source scale
    /// @param toScale name of the target scale
    public MissingTransformException(String fromScale, String toScale) {
        super("No transform registered for " + fromScale + "->" + toScale);
        this.fromScale = fromScale;
        this.toScale = toScale;
    }

    public String getFromScale() {
        return fromScale;
    }

    public String getToScale() {
        return toScale;
    }
}
