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

/// Single-variable distribution used as a building block of a
/// [MultifractalWaveletModel].
///
/// ## Models vs Samplers
///
/// ScalarModel is a pure data description. It holds distribution
/// parameters but does not know how to generate samples. Sampling is
/// handled in the sampling module, where a sampler factory binds each
/// model type to a concrete variate generator and a randomness source.
///
/// ## Implementations
///
/// | Model Type | Distribution | Parameters | Role in the cascade |
/// |------------|--------------|------------|---------------------|
/// | {@link NormalScalarModel} | Normal N(μ, σ²) | mean, stdDev | root (coarsest) value |
/// | {@link BetaScalarModel} | Beta(α, β) on [lower, upper] | alpha, beta, lower, upper | per-level multiplier |
///
/// @see MultifractalWaveletModel
public interface ScalarModel {

    /// Returns the model type identifier.
    ///
    /// @return the model type identifier (e.g., "normal", "beta")
    String getModelType();

    /// Returns the mean of this distribution.
    ///
    /// @return the mean
    double getMean();

    /// Returns the variance of this distribution.
    ///
    /// @return the variance
    double getVariance();

    /// Returns the standard deviation of this distribution.
    ///
    /// @return the standard deviation
    default double getStdDev() {
        return Math.sqrt(getVariance());
    }
}
