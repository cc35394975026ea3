package io.nosqlbench.mwm.model;

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

/// Base exception for failures of fitting or sampling a multifractal wavelet model.
///
/// Every instance carries an [ErrorKind] so callers can branch on the
/// category without inspecting the concrete subtype.
public class MultifractalModelException extends RuntimeException {

    private final ErrorKind kind;

    /// Creates an exception of the given kind.
    /// @param kind The failure category
    /// @param message The error message
    public MultifractalModelException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /// Gets the failure category.
    /// @return The error kind
    public ErrorKind getKind() {
        return kind;
    }
}
