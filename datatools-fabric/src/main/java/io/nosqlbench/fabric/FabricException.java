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

/// Base exception for all embedding fabric failures.
///
/// Every fabric error is raised synchronously at the offending call, before
/// any state is mutated. Catch this type to handle all fabric errors at once.
public class FabricException extends RuntimeException {

    /// Creates a new exception with a message.
    ///
    /// @param message error message
    public FabricException(String message) {
        super(message);
    }

    /// Creates a new exception with a message and cause.
    ///
    /// @param message error message
    /// @param cause underlying cause
    public FabricException(String message, Throwable cause) {
        super(message, cause);
    }
}
