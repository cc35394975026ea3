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

import java.util.Arrays;
import java.util.Objects;

/**
 * Wavelet coefficients of a truncated series, partitioned by scale.
 *
 * <p>Block 0 holds the B coarse scaling coefficients; block k (1 ≤ k ≤ S)
 * holds the {@code B · 2^(k-1)} detail coefficients of scale k, coarsest
 * first. See {@link DecompositionShape} for the layout.
 */
public final class WaveletCoefficients {

    private final double[] coefficients;
    private final DecompositionShape shape;

    WaveletCoefficients(double[] coefficients, DecompositionShape shape) {
        this.coefficients = Objects.requireNonNull(coefficients, "coefficients cannot be null");
        this.shape = Objects.requireNonNull(shape, "shape cannot be null");
        if (coefficients.length != shape.requiredSamples()) {
            throw new IllegalArgumentException("Expected " + shape.requiredSamples()
                + " coefficients for " + shape + ", got: " + coefficients.length);
        }
    }

    public DecompositionShape getShape() {
        return shape;
    }

    /**
     * Returns the total number of coefficients, B · 2^S.
     * @return the coefficient count
     */
    public int size() {
        return coefficients.length;
    }

    /**
     * Returns a copy of the coarse scaling coefficients (block 0).
     * @return the scaling coefficients
     */
    public double[] getScalingCoefficients() {
        return getBlock(0);
    }

    /**
     * Returns a copy of the detail coefficients of one scale.
     *
     * @param scale 1 for the coarsest detail block, S for the finest
     * @return the detail coefficients
     */
    public double[] getDetailCoefficients(int scale) {
        if (scale < 1) {
            throw new IndexOutOfBoundsException("Detail scales start at 1, got: " + scale);
        }
        return getBlock(scale);
    }

    /**
     * Returns a copy of coefficient block {@code index}.
     *
     * @param index 0 for the scaling block, 1..S for detail blocks
     * @return the block
     */
    public double[] getBlock(int index) {
        int offset = shape.blockOffset(index);
        return Arrays.copyOfRange(coefficients, offset, offset + shape.blockLength(index));
    }

    /// Backing array for in-package estimators; never handed out.
    double[] buffer() {
        return coefficients;
    }
}
