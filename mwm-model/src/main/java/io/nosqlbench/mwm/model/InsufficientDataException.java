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

/// Thrown when a series holds fewer samples than a decomposition needs.
public class InsufficientDataException extends MultifractalModelException {

    private final long availableSamples;
    private final long requiredSamples;

    public InsufficientDataException(long availableSamples, long requiredSamples, String detail) {
        super(ErrorKind.INSUFFICIENT_DATA,
            String.format("Not enough data: %d samples available, at least %d required (%s)",
                availableSamples, requiredSamples, detail));
        this.availableSamples = availableSamples;
        this.requiredSamples = requiredSamples;
    }

    public long getAvailableSamples() {
        return availableSamples;
    }

    /// Gets the smallest series length that would satisfy the request.
    /// May exceed the largest Java array length when the scale count is huge.
    /// @return the required sample count
    public long getRequiredSamples() {
        return requiredSamples;
    }
}
