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

import io.nosqlbench.mwm.model.ModelMismatchException;
import io.nosqlbench.mwm.model.MultifractalWaveletModel;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Draws synthetic paths from a fitted [MultifractalWaveletModel] with a
/// multiplicative cascade.
///
/// # Algorithm
///
/// A root value `z = 2^(-S/2) * N(μ, σ)` is drawn and must be non-negative.
/// Each of the S levels then splits every value `x` into `(1 + a) x` and
/// `(1 - a) x`, where `a` follows the level's symmetric Beta law on [-1, 1].
/// The path has `2^S` values, all non-negative, summing to `2^S * z`.
///
/// The cascade runs in a single buffer. Parents at level `i` occupy
/// `[0, 2^i)` and are visited in descending order, so each one is read
/// before its children overwrite it.
///
/// # Thread Safety
///
/// Instances are immutable. Concurrent callers must each pass their own
/// [UniformRandomProvider].
public final class CascadeSampler {

    private static final Logger logger = LogManager.getLogger(CascadeSampler.class);

    private final MultifractalWaveletModel model;
    private final VariateSamplerFactory factory;
    private final double rootScale;

    /// Binds a sampler to the model using Commons RNG variates.
    ///
    /// @param model the fitted model
    public CascadeSampler(MultifractalWaveletModel model) {
        this(model, CommonsRngSamplerFactory.INSTANCE);
    }

    /// Binds a sampler to the model using the given variate factory.
    ///
    /// @param model the fitted model
    /// @param factory creates the root and multiplier samplers
    public CascadeSampler(MultifractalWaveletModel model, VariateSamplerFactory factory) {
        this.model = Objects.requireNonNull(model, "model cannot be null");
        this.factory = Objects.requireNonNull(factory, "factory cannot be null");
        this.rootScale = Math.pow(2.0, -model.getScales() / 2.0);
        logger.debug("Bound cascade sampler: {} scales, path length {}",
            model.getScales(), model.getPathLength());
    }

    /// Returns the length of every sampled path, `2^S`.
    ///
    /// @return the path length
    public int getPathLength() {
        return model.getPathLength();
    }

    /// Draws one path.
    ///
    /// @param rng the randomness source
    /// @return a new array of `2^S` non-negative values
    /// @throws ModelMismatchException if the root draw is negative
    public double[] sample(UniformRandomProvider rng) {
        Objects.requireNonNull(rng, "rng cannot be null");
        int scales = model.getScales();

        double z = rootScale * factory.forModel(model.getRoot(), rng).sample();
        if (z < 0) {
            logger.trace("Rejected negative root draw {}", z);
            throw new ModelMismatchException(ModelMismatchException.ROOT,
                "The model is not appropriate for the data: negative root value " + z);
        }

        double[] buffer = new double[model.getPathLength()];
        buffer[0] = z;
        for (int i = 0; i < scales; i++) {
            ContinuousSampler multiplier = factory.forModel(model.getMultiplier(i), rng);
            for (int j = (1 << i) - 1; j >= 0; j--) {
                double x = buffer[j];
                double a = multiplier.sample();
                buffer[2 * j] = (1 + a) * x;
                buffer[2 * j + 1] = (1 - a) * x;
            }
        }
        return buffer;
    }
}
