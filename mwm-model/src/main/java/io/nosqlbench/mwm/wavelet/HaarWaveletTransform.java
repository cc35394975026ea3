package io.nosqlbench.mwm.wavelet;

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

/**
 * Orthonormal Haar wavelet transform.
 *
 * <p>One forward level over a working length m maps every sample pair to
 *
 * <pre>{@code
 * scaling[k] = (x[2k] + x[2k+1]) · √½      k ∈ [0, m/2)
 * detail[k]  = (x[2k] - x[2k+1]) · √½
 * }</pre>
 *
 * <p>writing scaling coefficients to {@code [0, m/2)} and detail
 * coefficients to {@code [m/2, m)}. The filter is orthonormal, so the sum of
 * squares of the buffer is preserved up to rounding.
 */
public final class HaarWaveletTransform implements WaveletTransform {

    private static final double SQRT_HALF = Math.sqrt(0.5);

    @Override
    public void forward(double[] buffer, int length, int levels) {
        checkLayout(buffer, length, levels);
        double[] scratch = new double[length];
        int m = length;
        for (int level = 0; level < levels; level++) {
            int half = m >> 1;
            for (int k = 0; k < half; k++) {
                double even = buffer[2 * k];
                double odd = buffer[2 * k + 1];
                scratch[k] = (even + odd) * SQRT_HALF;
                scratch[half + k] = (even - odd) * SQRT_HALF;
            }
            System.arraycopy(scratch, 0, buffer, 0, m);
            m = half;
        }
    }

    @Override
    public void inverse(double[] buffer, int length, int levels) {
        checkLayout(buffer, length, levels);
        double[] scratch = new double[length];
        int m = length >> levels;
        for (int level = 0; level < levels; level++) {
            for (int k = 0; k < m; k++) {
                double scaling = buffer[k];
                double detail = buffer[m + k];
                scratch[2 * k] = (scaling + detail) * SQRT_HALF;
                scratch[2 * k + 1] = (scaling - detail) * SQRT_HALF;
            }
            m <<= 1;
            System.arraycopy(scratch, 0, buffer, 0, m);
        }
    }

    @Override
    public String getName() {
        return "haar";
    }

    private static void checkLayout(double[] buffer, int length, int levels) {
        if (levels < 0 || levels > 30) {
            throw new IllegalArgumentException("Levels must be in [0, 30], got: " + levels);
        }
        if (length < 0 || length > buffer.length) {
            throw new IllegalArgumentException(
                "Length " + length + " is outside the buffer of " + buffer.length + " values");
        }
        if ((length & ((1 << levels) - 1)) != 0) {
            throw new IllegalArgumentException(
                "Length " + length + " is not divisible by 2^" + levels);
        }
    }
}
