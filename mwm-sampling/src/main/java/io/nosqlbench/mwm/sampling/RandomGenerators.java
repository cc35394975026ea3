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

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.util.Locale;

/**
 * Seeded random number generators for reproducible path generation.
 * Based on Apache Commons RNG.
 */
public final class RandomGenerators {

    private RandomGenerators() {
    }

    /**
     * Available PRNG algorithms.
     * XO_SHI_RO_256_PP is the default for its statistical quality and speed.
     */
    public enum Algorithm {
        /** XorShiRo256++, 256-bit state, period 2^256 - 1. */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),
        /** XorShiRo128++, 128-bit state, period 2^128 - 1. */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),
        /** SplitMix64, 64-bit state, period 2^64. */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),
        /** Mersenne Twister, 19937-bit state. */
        MT(RandomSource.MT),
        /** KISS, 128-bit state. */
        KISS(RandomSource.KISS);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }

        /**
         * Resolves an algorithm by name, ignoring case and accepting dashes for underscores.
         *
         * @param name the algorithm name, e.g. {@code xo-shi-ro-256-pp}
         * @return the matching algorithm
         * @throws IllegalArgumentException if no algorithm matches
         */
        public static Algorithm fromName(String name) {
            String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
            return Algorithm.valueOf(normalized);
        }
    }

    /**
     * Creates a generator with the given algorithm and seed.
     *
     * @param algorithm the PRNG algorithm
     * @param seed the seed
     * @return a restorable uniform random provider
     */
    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return (RestorableUniformRandomProvider) algorithm.getSource().create(seed);
    }

    /**
     * Creates a generator with the default algorithm and the given seed.
     *
     * @param seed the seed
     * @return a restorable uniform random provider
     */
    public static RestorableUniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }
}
