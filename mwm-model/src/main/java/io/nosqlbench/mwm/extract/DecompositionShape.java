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

import io.nosqlbench.mwm.model.InsufficientDataException;
import io.nosqlbench.mwm.model.InvalidConfigurationException;

/**
 * The (blocks, scales) geometry of a wavelet decomposition.
 *
 * <p>A decomposition with B coarse blocks and S scales consumes exactly
 * {@code B · 2^S} samples. Its coefficients split into S + 1 blocks:
 *
 * <pre>{@code
 * block:   0 (scaling) | 1      | 2      | ... | S
 * length:  B           | B      | 2B     | ... | B·2^(S-1)
 * }</pre>
 *
 * <h2>Deriving a Shape</h2>
 *
 * <ul>
 *   <li>{@link #forBlocks(int, int)}: S = ⌊log2(n / blocks)⌋, then the coarse
 *       block count is widened to ⌊n / 2^S⌋, so the requested count is a minimum</li>
 *   <li>{@link #forScales(int, int)}: B = ⌊n / 2^S⌋</li>
 *   <li>{@link #of(int, int)}: both given explicitly</li>
 * </ul>
 *
 * <p>Every shape has at least two coarse blocks (the Gaussian fit needs a
 * sample variance) and at least one scale.
 *
 * @param blocks the number of coarse scaling coefficients B
 * @param scales the number of dyadic levels S
 */
public record DecompositionShape(int blocks, int scales) {

    /**
     * Validates the configuration itself, independent of any series.
     *
     * @throws InvalidConfigurationException if blocks &lt; 2 or scales &lt; 1
     */
    public DecompositionShape {
        requireBlocks(blocks);
        requireScales(scales);
    }

    /**
     * Uses the given block and scale counts as they are.
     *
     * @param blocks the number of coarse blocks
     * @param scales the number of scales
     * @return the shape
     * @throws InvalidConfigurationException if blocks &lt; 2 or scales &lt; 1
     */
    public static DecompositionShape of(int blocks, int scales) {
        return new DecompositionShape(blocks, scales);
    }

    /**
     * Derives the deepest decomposition that keeps at least {@code minBlocks}
     * coarse coefficients for a series of {@code available} samples.
     *
     * @param available the series length
     * @param minBlocks the minimum number of coarse coefficients
     * @return the derived shape
     * @throws InvalidConfigurationException if minBlocks &lt; 2
     * @throws InsufficientDataException if not even one scale can be formed
     */
    public static DecompositionShape forBlocks(int available, int minBlocks) {
        requireBlocks(minBlocks);
        int ratio = available / minBlocks;
        if (ratio < 2) {
            throw new InsufficientDataException(available, 2L * minBlocks,
                minBlocks + " blocks leave no room for a single scale");
        }
        int scales = 31 - Integer.numberOfLeadingZeros(ratio);
        return new DecompositionShape(available >> scales, scales);
    }

    /**
     * Derives the block count for a decomposition of exactly {@code scales} levels.
     *
     * @param available the series length
     * @param scales the number of scales
     * @return the derived shape
     * @throws InvalidConfigurationException if scales &lt; 1
     * @throws InsufficientDataException if fewer than two coarse blocks result
     */
    public static DecompositionShape forScales(int available, int scales) {
        requireScales(scales);
        long required = requiredSamples(2, scales);
        if (available < required) {
            throw new InsufficientDataException(available, required,
                scales + " scales need two coarse blocks of 2^" + scales + " samples");
        }
        return new DecompositionShape(available >> scales, scales);
    }

    /**
     * Returns the number of samples this decomposition consumes, B · 2^S.
     * @return the sample count, saturated at {@link Long#MAX_VALUE}
     */
    public long requiredSamples() {
        return requiredSamples(blocks, scales);
    }

    /**
     * Returns the length of coefficient block {@code index}.
     *
     * @param index 0 for the scaling block, 1..S for detail blocks coarse to fine
     * @return the block length
     */
    public int blockLength(int index) {
        checkBlockIndex(index);
        return index == 0 ? blocks : blocks << (index - 1);
    }

    /**
     * Returns the offset of coefficient block {@code index}.
     *
     * @param index 0 for the scaling block, 1..S for detail blocks coarse to fine
     * @return the block offset
     */
    public int blockOffset(int index) {
        checkBlockIndex(index);
        return index == 0 ? 0 : blocks << (index - 1);
    }

    private void checkBlockIndex(int index) {
        if (index < 0 || index > scales) {
            throw new IndexOutOfBoundsException("Block index " + index + " outside [0, " + scales + "]");
        }
    }

    private static long requiredSamples(int blocks, int scales) {
        if (scales > 32) {
            return Long.MAX_VALUE;
        }
        return (long) blocks << scales;
    }

    private static void requireBlocks(int blocks) {
        if (blocks <= 0) {
            throw new InvalidConfigurationException("Number of blocks must be positive, got: " + blocks);
        }
        if (blocks < 2) {
            throw new InvalidConfigurationException("Number of blocks must be at least two, got: " + blocks);
        }
    }

    private static void requireScales(int scales) {
        if (scales <= 0) {
            throw new InvalidConfigurationException("Number of scales must be positive, got: " + scales);
        }
    }
}
