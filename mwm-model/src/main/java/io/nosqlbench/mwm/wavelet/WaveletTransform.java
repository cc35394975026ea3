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
 * In-place, orthogonal, decimating discrete wavelet transform.
 *
 * <h2>Coefficient Layout</h2>
 *
 * <p>A forward transform of {@code levels} levels over a buffer prefix of
 * length {@code B · 2^levels} runs the pyramid algorithm: each level splits
 * the current working prefix into its scaling half (front) and its detail
 * half (back), then continues on the scaling half only. The result is:
 *
 * <pre>{@code
 * [ scaling: B | detail 1: B | detail 2: 2B | ... | detail L: B·2^(L-1) ]
 *   coarsest ────────────────────────────────────────────────► finest
 * }</pre>
 *
 * <p>Implementations hold no per-call state, so a single instance may be
 * shared between threads.
 *
 * @see HaarWaveletTransform
 */
public interface WaveletTransform {

    /**
     * Transforms {@code buffer[0, length)} in place.
     *
     * @param buffer the samples to transform; overwritten with coefficients
     * @param length the prefix length to transform; must be divisible by 2^levels
     * @param levels the number of decomposition levels
     * @throws IllegalArgumentException if length is not divisible by 2^levels or exceeds the buffer
     */
    void forward(double[] buffer, int length, int levels);

    /**
     * Reverses {@link #forward(double[], int, int)} in place.
     *
     * @param buffer the coefficients, in the layout produced by forward
     * @param length the prefix length to reconstruct
     * @param levels the number of levels to undo
     * @throws IllegalArgumentException if length is not divisible by 2^levels or exceeds the buffer
     */
    void inverse(double[] buffer, int length, int levels);

    /**
     * Returns a short name for this wavelet.
     * @return the wavelet name
     */
    String getName();
}
