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

/// Classifies why fitting or sampling a [MultifractalWaveletModel] failed.
///
/// None of these failures is retried internally. A caller may fit again
/// with a different decomposition, or sample again with fresh randomness.
public enum ErrorKind {

    /// Zero (or fewer than two) coarse blocks, or zero scales, were requested.
    INVALID_CONFIGURATION,

    /// The series is too short for the requested blocks and scales.
    INSUFFICIENT_DATA,

    /// The data does not fit the model: a non-positive Beta shape was
    /// derived, or a negative root value was drawn.
    MODEL_MISMATCH
}
