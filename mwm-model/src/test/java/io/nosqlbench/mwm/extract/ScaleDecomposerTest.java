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
import io.nosqlbench.mwm.wavelet.HaarWaveletTransform;
import io.nosqlbench.mwm.wavelet.WaveletTransform;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ScaleDecomposerTest {

    /// Records calls and leaves the buffer untouched.
    private static final class RecordingTransform implements WaveletTransform {
        final List<int[]> calls = new ArrayList<>();
        double[] seen;

        @Override
        public void forward(double[] buffer, int length, int levels) {
            calls.add(new int[]{length, levels});
            seen = buffer.clone();
        }

        @Override
        public void inverse(double[] buffer, int length, int levels) {
            throw new UnsupportedOperationException();
        }

        @Override
        public String getName() {
            return "recording";
        }
    }

    @Test
    void truncatesToBlocksTimesPowerOfTwo() {
        RecordingTransform transform = new RecordingTransform();
        double[] series = new double[11];
        for (int i = 0; i < series.length; i++) {
            series[i] = i;
        }

        WaveletCoefficients coefficients = new ScaleDecomposer(transform).decompose(series, 2, 2);

        assertThat(coefficients.size()).isEqualTo(8);
        assertThat(transform.calls).hasSize(1);
        assertThat(transform.calls.get(0)).containsExactly(8, 2);
        assertThat(transform.seen).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
    }

    @Test
    void doesNotModifyCallerSeries() {
        double[] series = {1, 2, 3, 4, 5};
        double[] copy = series.clone();

        new ScaleDecomposer(new HaarWaveletTransform()).decompose(series, 2, 1);

        assertThat(series).containsExactly(copy);
    }

    @Test
    void partitionsHaarCoefficientsByScale() {
        double[] series = {1, 2, 3, 4, 5, 6, 7, 8};
        WaveletCoefficients coefficients = new ScaleDecomposer(new HaarWaveletTransform()).decompose(series, 2, 2);

        assertThat(coefficients.getScalingCoefficients()).hasSize(2);
        assertThat(coefficients.getDetailCoefficients(1)).hasSize(2);
        assertThat(coefficients.getDetailCoefficients(2)).hasSize(4);
        // sums of 4 samples scaled by 1/2
        assertThat(coefficients.getScalingCoefficients()[0]).isCloseTo(5.0, within(1e-12));
        assertThat(coefficients.getScalingCoefficients()[1]).isCloseTo(13.0, within(1e-12));
    }

    @Test
    void zeroBlocksOrScalesIsInvalid() {
        ScaleDecomposer decomposer = new ScaleDecomposer(new HaarWaveletTransform());
        double[] series = new double[64];

        assertThatThrownBy(() -> decomposer.decompose(series, 0, 2))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> decomposer.decompose(series, 2, 0))
            .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void shortSeriesIsInsufficient() {
        ScaleDecomposer decomposer = new ScaleDecomposer(new HaarWaveletTransform());

        assertThatThrownBy(() -> decomposer.decompose(new double[15], 2, 3))
            .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void nonFiniteSampleInUsedPrefixIsRejected() {
        ScaleDecomposer decomposer = new ScaleDecomposer(new HaarWaveletTransform());
        double[] series = {1, 2, Double.NaN, 4};

        assertThatThrownBy(() -> decomposer.decompose(series, 2, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("index 2");
    }

    @Test
    void nonFiniteSampleInDiscardedTailIsIgnored() {
        ScaleDecomposer decomposer = new ScaleDecomposer(new HaarWaveletTransform());
        double[] series = {1, 2, 3, 4, Double.POSITIVE_INFINITY};

        assertThat(decomposer.decompose(series, 2, 1).size()).isEqualTo(4);
    }
}
