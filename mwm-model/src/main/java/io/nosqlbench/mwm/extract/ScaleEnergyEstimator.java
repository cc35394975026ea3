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

import java.util.Objects;

/**
 * Reduces each coefficient block to its mean-square energy.
 *
 * <pre>{@code
 * E[0] = mean(scaling²)
 * E[k] = mean(detail_k²)    k = 1..S
 * }</pre>
 */
public final class ScaleEnergyEstimator {

    private final SampleStatistics statistics;

    public ScaleEnergyEstimator(SampleStatistics statistics) {
        this.statistics = Objects.requireNonNull(statistics, "statistics cannot be null");
    }

    /**
     * Computes the energy sequence E[0..S].
     *
     * @param coefficients the partitioned coefficients
     * @return S + 1 energies, scaling block first
     */
    public double[] estimate(WaveletCoefficients coefficients) {
        DecompositionShape shape = coefficients.getShape();
        double[] buffer = coefficients.buffer();
        double[] energies = new double[shape.scales() + 1];
        for (int k = 0; k <= shape.scales(); k++) {
            energies[k] = statistics.meanSquare(buffer, shape.blockOffset(k), shape.blockLength(k));
        }
        return energies;
    }
}
