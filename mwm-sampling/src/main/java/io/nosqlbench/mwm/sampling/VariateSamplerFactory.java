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

package io.nosqlbench.mwm.sampling;

import io.nosqlbench.mwm.model.ScalarModel;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;

/// Creates variate samplers bound to a scalar model and a randomness source.
///
/// Type dispatch happens once, when the sampler is created. The returned
/// sampler draws from the given provider on every call.
///
/// @see CommonsRngSamplerFactory
@FunctionalInterface
public interface VariateSamplerFactory {

    /// Creates a sampler for the given model.
    ///
    /// @param model the distribution to draw from
    /// @param rng the randomness source the sampler consumes
    /// @return a sampler bound to the model's parameters
    /// @throws IllegalArgumentException if the model type is not supported
    ContinuousSampler forModel(ScalarModel model, UniformRandomProvider rng);
}
