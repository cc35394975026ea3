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
 * Beta distribution scalar model on an interval [lower, upper].
 *
 * <h2>Purpose</h2>
 *
 * <p>The multipliers of a multifractal cascade follow a symmetric Beta(β, β)
 * law whose support is mapped from [0, 1] to [-1, 1]. A parent value x is
 * split into the children (1 + a)x and (1 - a)x, so a multiplier on [-1, 1]
 * keeps both children non-negative.
 *
 * <h2>Parameters</h2>
 *
 * <ul>
 *   <li><b>alpha (α)</b>: first shape parameter; α &gt; 0</li>
 *   <li><b>beta (β)</b>: second shape parameter; β &gt; 0</li>
 *   <li><b>lower</b>: lower bound of support (default 0)</li>
 *   <li><b>upper</b>: upper bound of support (default 1)</li>
 * </ul>
 *
 * <h2>Moments</h2>
 *
 * <pre>{@code
 * Mean = lower + range * α / (α + β)
 * Variance = range² * αβ / [(α + β)² (α + β + 1)]
 * }</pre>
 *
 * <p>For the cascade multiplier Beta(β, β) on [-1, 1] this gives mean 0 and
 * variance 1 / (2β + 1): larger shape values mean calmer splits.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * // Standard beta on [0, 1]
 * BetaScalarModel beta = new BetaScalarModel(2.0, 5.0);
 *
 * // Cascade multiplier law for shape 3.0
 * BetaScalarModel multiplier = BetaScalarModel.symmetricMultiplier(3.0);
 * }</pre>
 *
 * @see ScalarModel
 * @see MultifractalWaveletModel#getMultiplier(int)
 */
public class BetaScalarModel implements ScalarModel {

    public static final String MODEL_TYPE = "beta";

    private final double alpha;
    private final double beta;
    private final double lower;
    private final double upper;

    /**
     * Constructs a beta scalar model on the standard interval [0, 1].
     *
     * @param alpha the first shape parameter (α); must be positive
     * @param beta the second shape parameter (β); must be positive
     * @throws IllegalArgumentException if alpha or beta is not positive
     */
    public BetaScalarModel(double alpha, double beta) {
        this(alpha, beta, 0.0, 1.0);
    }

    /**
     * Constructs a beta scalar model on a custom interval [lower, upper].
     *
     * @param alpha the first shape parameter (α); must be positive and finite
     * @param beta the second shape parameter (β); must be positive and finite
     * @param lower the lower bound of the support
     * @param upper the upper bound of the support
     * @throws IllegalArgumentException if alpha or beta is not a positive finite value, or lower ≥ upper
     */
    public BetaScalarModel(double alpha, double beta, double lower, double upper) {
        if (!(alpha > 0) || Double.isInfinite(alpha)) {
            throw new IllegalArgumentException("Alpha must be positive and finite, got: " + alpha);
        }
        if (!(beta > 0) || Double.isInfinite(beta)) {
            throw new IllegalArgumentException("Beta must be positive and finite, got: " + beta);
        }
        if (!(lower < upper)) {
            throw new IllegalArgumentException("Lower must be less than upper: " + lower + " >= " + upper);
        }
        this.alpha = alpha;
        this.beta = beta;
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Creates the symmetric multiplier law Beta(shape, shape) on [-1, 1].
     *
     * @param shape the common shape parameter (α = β)
     * @return the multiplier model
     */
    public static BetaScalarModel symmetricMultiplier(double shape) {
        return new BetaScalarModel(shape, shape, -1.0, 1.0);
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    /**
     * Returns the first shape parameter α.
     * @return alpha
     */
    public double getAlpha() {
        return alpha;
    }

    /**
     * Returns the second shape parameter β.
     * @return beta
     */
    public double getBeta() {
        return beta;
    }

    /**
     * Returns the lower bound of the support.
     * @return the lower bound
     */
    public double getLower() {
        return lower;
    }

    /**
     * Returns the upper bound of the support.
     * @return the upper bound
     */
    public double getUpper() {
        return upper;
    }

    /**
     * Returns the range (upper - lower) of the support.
     * @return the range
     */
    public double getRange() {
        return upper - lower;
    }

    /**
     * Returns whether this distribution is symmetric (α = β).
     * @return true if symmetric
     */
    public boolean isSymmetric() {
        return Double.compare(alpha, beta) == 0;
    }

    @Override
    public double getMean() {
        double standardMean = alpha / (alpha + beta);
        return lower + getRange() * standardMean;
    }

    @Override
    public double getVariance() {
        double sumAB = alpha + beta;
        double standardVariance = (alpha * beta) / (sumAB * sumAB * (sumAB + 1));
        double range = getRange();
        return standardVariance * range * range;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BetaScalarModel)) return false;
        BetaScalarModel that = (BetaScalarModel) o;
        return Double.compare(that.alpha, alpha) == 0 &&
               Double.compare(that.beta, beta) == 0 &&
               Double.compare(that.lower, lower) == 0 &&
               Double.compare(that.upper, upper) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(alpha, beta, lower, upper);
    }

    @Override
    public String toString() {
        return "BetaScalarModel[alpha=" + alpha + ", beta=" + beta +
               ", lower=" + lower + ", upper=" + upper + "]";
    }
}
