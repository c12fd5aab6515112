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

/// Thrown when a vector's length doesn't match the fabric dimension.
public class DimensionMismatchException extends FabricException {

    private final int expected;
    private final int actual;

    /// Creates a new dimension mismatch exception.
    ///
    /// @param expected expected dimensions
    /// @param actual actual dimensions provided
    public DimensionMismatchException(int expected, int actual) {
        super("Dimension mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    /// Gets the expected dimension count.
    ///
    /// @return expected dimensions
    public int getExpected() {
        return expected;
    }

    /// Gets the actual dimension count that was provided.
    ///
    /// @return actual dimensions
    public int getActual() {
        return actual;
    }
}
