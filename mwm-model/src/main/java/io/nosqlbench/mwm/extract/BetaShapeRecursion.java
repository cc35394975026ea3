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

import io.nosqlbench.mwm.model.ModelMismatchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Converts per-scale wavelet energies into Beta multiplier shape parameters.
 *
 * <h2>Recursion</h2>
 *
 * <p>Under the multifractal cascade with symmetric Beta(β, β) multipliers on
 * [-1, 1], the energy ratio of adjacent scales determines the next shape:
 *
 * <pre>{@code
 * β[-1] = 0
 * β[i]  = 0.5 · (E[i] / E[i+1]) · (β[i-1] + 1) - 0.5      i = 0..S-1
 * }</pre>
 *
 * <p>One pass, coarse to fine. The first shape that is not a positive finite
 * number aborts the estimation; no partial result is returned.
 */
public final class BetaShapeRecursion {

    private static final Logger logger = LogManager.getLogger(BetaShapeRecursion.class);

    private BetaShapeRecursion() {
    }

    /**
     * Estimates S shape parameters from S + 1 energies.
     *
     * @param energies the energy sequence E[0..S]
     * @return the shapes β[0..S-1], coarsest first
     * @throws ModelMismatchException if some β[i] is not positive and finite
     * @throws IllegalArgumentException if fewer than two energies are given
     */
    public static double[] estimate(double[] energies) {
        Objects.requireNonNull(energies, "energies cannot be null");
        if (energies.length < 2) {
            throw new IllegalArgumentException("At least two energies are required, got: " + energies.length);
        }

        double[] shapes = new double[energies.length - 1];
        double previous = 0.0;
        for (int i = 0; i < shapes.length; i++) {
            double shape = 0.5 * (energies[i] / energies[i + 1]) * (previous + 1.0) - 0.5;
            if (!(shape > 0) || Double.isInfinite(shape)) {
                logger.debug("Shape at scale {} is {} (energies {} / {})", i, shape, energies[i], energies[i + 1]);
                throw new ModelMismatchException(i,
                    "The model is not appropriate for the data: shape parameter at scale " + i + " is " + shape);
            }
            shapes[i] = shape;
            previous = shape;
        }
        return shapes;
    }
}
