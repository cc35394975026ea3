package io.nosqlbench.mwm.extract;

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

import io.nosqlbench.mwm.model.NormalScalarModel;

import java.util.Objects;

/**
 * Fits the root Gaussian law to the coarse scaling coefficients.
 *
 * <p>μ is the sample mean of block 0 and σ the square root of its unbiased
 * sample variance.
 */
public final class CoarseGaussianEstimator {

    private final SampleStatistics statistics;

    public CoarseGaussianEstimator(SampleStatistics statistics) {
        this.statistics = Objects.requireNonNull(statistics, "statistics cannot be null");
    }

    public NormalScalarModel estimate(WaveletCoefficients coefficients) {
        DecompositionShape shape = coefficients.getShape();
        double[] buffer = coefficients.buffer();
        int blocks = shape.blockLength(0);
        double mean = statistics.mean(buffer, 0, blocks);
        double stdDev = Math.sqrt(statistics.variance(buffer, 0, blocks));
        return new NormalScalarModel(mean, stdDev);
    }
}
