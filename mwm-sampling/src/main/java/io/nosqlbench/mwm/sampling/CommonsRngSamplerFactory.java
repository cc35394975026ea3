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

import io.nosqlbench.mwm.model.BetaScalarModel;
import io.nosqlbench.mwm.model.NormalScalarModel;
import io.nosqlbench.mwm.model.ScalarModel;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ChengBetaSampler;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.GaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

/// Variate samplers backed by Apache Commons RNG.
///
/// - [NormalScalarModel]: Ziggurat standard normal, shifted and scaled.
///   A zero standard deviation yields the mean on every draw.
/// - [BetaScalarModel]: Cheng's algorithm on [0, 1], mapped linearly onto
///   the model's support.
public final class CommonsRngSamplerFactory implements VariateSamplerFactory {

    /// Shared stateless instance.
    public static final CommonsRngSamplerFactory INSTANCE = new CommonsRngSamplerFactory();

    @Override
    public ContinuousSampler forModel(ScalarModel model, UniformRandomProvider rng) {
        if (model instanceof NormalScalarModel) {
            return normal((NormalScalarModel) model, rng);
        }
        if (model instanceof BetaScalarModel) {
            return beta((BetaScalarModel) model, rng);
        }
        throw new IllegalArgumentException(
            "No sampler for model type: " + (model == null ? "null" : model.getClass().getName()));
    }

    private static ContinuousSampler normal(NormalScalarModel model, UniformRandomProvider rng) {
        double mean = model.getMean();
        if (model.isDegenerate()) {
            return () -> mean;
        }
        return GaussianSampler.of(ZigguratSampler.NormalizedGaussian.of(rng), mean, model.getStdDev());
    }

    private static ContinuousSampler beta(BetaScalarModel model, UniformRandomProvider rng) {
        ContinuousSampler standard = ChengBetaSampler.of(rng, model.getAlpha(), model.getBeta());
        double lower = model.getLower();
        double range = model.getRange();
        return () -> lower + range * standard.sample();
    }
}
