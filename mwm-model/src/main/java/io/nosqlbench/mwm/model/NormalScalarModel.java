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

import java.util.Objects;

/**
 * Normal (Gaussian) distribution of the root value of a multiplicative cascade.
 *
 * <h2>Purpose</h2>
 *
 * <p>In a multifractal wavelet model the coarsest scaling coefficients are
 * modelled as draws from N(μ, σ²). The cascade sampler scales one such draw
 * down to the root of the tree before splitting it.
 *
 * <h2>Degenerate Case</h2>
 *
 * <p>A standard deviation of zero is accepted and describes a point mass at
 * the mean. This happens when every coarse coefficient of the fitted series
 * is identical.
 *
 * @see ScalarModel
 * @see MultifractalWaveletModel#getRoot()
 */
public class NormalScalarModel implements ScalarModel {

    public static final String MODEL_TYPE = "normal";

    private final double mean;
    private final double stdDev;

    /**
     * Constructs a normal scalar model.
     *
     * @param mean the mean (μ) of the normal distribution; must be finite
     * @param stdDev the standard deviation (σ); must be finite and non-negative
     * @throws IllegalArgumentException if mean is not finite, or stdDev is negative or not finite
     */
    public NormalScalarModel(double mean, double stdDev) {
        if (!Double.isFinite(mean)) {
            throw new IllegalArgumentException("Mean must be finite, got: " + mean);
        }
        if (!Double.isFinite(stdDev) || stdDev < 0) {
            throw new IllegalArgumentException("Standard deviation must be finite and non-negative, got: " + stdDev);
        }
        this.mean = mean;
        this.stdDev = stdDev;
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    /**
     * Returns the mean of this normal distribution.
     * @return the mean (μ)
     */
    @Override
    public double getMean() {
        return mean;
    }

    /**
     * Returns the standard deviation of this normal distribution.
     * @return the standard deviation (σ)
     */
    @Override
    public double getStdDev() {
        return stdDev;
    }

    @Override
    public double getVariance() {
        return stdDev * stdDev;
    }

    /**
     * Returns whether this distribution is a point mass at its mean.
     * @return true if the standard deviation is zero
     */
    public boolean isDegenerate() {
        return stdDev == 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalScalarModel)) return false;
        NormalScalarModel that = (NormalScalarModel) o;
        return Double.compare(that.mean, mean) == 0 &&
               Double.compare(that.stdDev, stdDev) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev);
    }

    @Override
    public String toString() {
        return "NormalScalarModel[mean=" + mean + ", stdDev=" + stdDev + "]";
    }
}
