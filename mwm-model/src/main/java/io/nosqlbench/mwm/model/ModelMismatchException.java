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

/// Thrown when the multifractal wavelet model is not appropriate for the data.
///
/// During fitting this means the energy recursion produced a shape parameter
/// that is not a positive finite number; [#getScale()] names the scale.
/// During sampling it means the root draw was negative, which the
/// multiplicative cascade cannot expand into a non-negative path; the scale
/// is then [#ROOT].
public class ModelMismatchException extends MultifractalModelException {

    /// Scale index reported for failures of the root draw.
    public static final int ROOT = -1;

    private final int scale;

    public ModelMismatchException(int scale, String message) {
        super(ErrorKind.MODEL_MISMATCH, message);
        this.scale = scale;
    }

    /// Gets the scale at which the mismatch was detected.
    /// @return the scale index, or [#ROOT] for the root draw
    public int getScale() {
        return scale;
    }
}
