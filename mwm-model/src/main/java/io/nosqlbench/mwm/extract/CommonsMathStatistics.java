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

import org.apache.commons.math3.stat.StatUtils;

/**
 * {@link SampleStatistics} backed by Apache Commons Math {@link StatUtils}.
 *
 * <p>Mean and variance use the corrected two-pass algorithms of
 * Commons Math. The mean square is the plain sum of squares divided by the
 * count, accumulated in index order.
 */
public final class CommonsMathStatistics implements SampleStatistics {

    @Override
    public double mean(double[] values, int begin, int length) {
        requirePositive(length);
        return StatUtils.mean(values, begin, length);
    }

    @Override
    public double variance(double[] values, int begin, int length) {
        requirePositive(length);
        return StatUtils.variance(values, begin, length);
    }

    @Override
    public double meanSquare(double[] values, int begin, int length) {
        requirePositive(length);
        return StatUtils.sumSq(values, begin, length) / length;
    }

    private static void requirePositive(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Statistics need at least one value, got length: " + length);
        }
    }
}
