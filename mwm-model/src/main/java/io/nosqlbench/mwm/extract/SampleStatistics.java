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

/**
 * Summary statistics over a contiguous range of an array.
 *
 * <p>The fitting pipeline reads every statistic through this interface so
 * that coefficient blocks can be summarized in place, without copying, and
 * so that tests can substitute a stub.
 *
 * @see CommonsMathStatistics
 */
public interface SampleStatistics {

    /**
     * Arithmetic mean of {@code values[begin, begin + length)}.
     *
     * @param values the values
     * @param begin the first index
     * @param length the number of values; must be positive
     * @return the mean
     */
    double mean(double[] values, int begin, int length);

    /**
     * Unbiased sample variance (divisor {@code length - 1}) of
     * {@code values[begin, begin + length)}.
     *
     * @param values the values
     * @param begin the first index
     * @param length the number of values; must be positive
     * @return the variance, 0 for a single value
     */
    double variance(double[] values, int begin, int length);

    /**
     * Mean of the squared values of {@code values[begin, begin + length)}.
     *
     * @param values the values
     * @param begin the first index
     * @param length the number of values; must be positive
     * @return the mean square
     */
    double meanSquare(double[] values, int begin, int length);
}
