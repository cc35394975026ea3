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
import io.nosqlbench.mwm.wavelet.HaarWaveletTransform;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class CoarseGaussianEstimatorTest {

    @Test
    void fitsMeanAndSampleStdDevOfScalingBlock() {
        // One Haar level: scaling coefficients are (x0 + x1) / sqrt(2)
        double s = Math.sqrt(2.0);
        double[] series = {1 / s, 1 / s, 2 / s, 2 / s, 3 / s, 3 / s};
        WaveletCoefficients coefficients = new ScaleDecomposer(new HaarWaveletTransform()).decompose(series, 3, 1);

        NormalScalarModel model = new CoarseGaussianEstimator(new CommonsMathStatistics()).estimate(coefficients);

        assertEquals(2.0, model.getMean(), 1e-12);
        assertEquals(1.0, model.getStdDev(), 1e-12);
    }

    @Test
    void identicalCoarseValuesGiveDegenerateModel() {
        double[] series = {1, 2, 2, 1, 0, 3, 3, 0};
        WaveletCoefficients coefficients = new ScaleDecomposer(new HaarWaveletTransform()).decompose(series, 4, 1);

        NormalScalarModel model = new CoarseGaussianEstimator(new CommonsMathStatistics()).estimate(coefficients);

        assertEquals(0.0, model.getStdDev(), 1e-15);
        assertTrue(model.getMean() > 0);
    }
}
