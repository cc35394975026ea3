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
import io.nosqlbench.mwm.wavelet.WaveletTransform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/**
 * Truncates a series and decomposes it into per-scale wavelet coefficients.
 *
 * <h2>Algorithm</h2>
 *
 * <ol>
 *   <li>Check that the series holds at least {@code B · 2^S} samples</li>
 *   <li>Copy exactly that prefix; trailing samples are discarded, never padded</li>
 *   <li>Run the wavelet transform for S levels over the copy</li>
 * </ol>
 *
 * <p>The caller's array is never modified.
 */
public final class ScaleDecomposer {

    private static final Logger logger = LogManager.getLogger(ScaleDecomposer.class);

    private final WaveletTransform transform;

    /**
     * Creates a decomposer driving the given transform.
     *
     * @param transform the wavelet transform
     */
    public ScaleDecomposer(WaveletTransform transform) {
        this.transform = Objects.requireNonNull(transform, "transform cannot be null");
    }

    /**
     * Decomposes with explicit block and scale counts.
     *
     * @param series the input series
     * @param blocks the number of coarse blocks
     * @param scales the number of scales
     * @return the partitioned coefficients
     * @throws io.nosqlbench.mwm.model.InvalidConfigurationException if blocks &lt; 2 or scales &lt; 1
     * @throws InsufficientDataException if the series is shorter than blocks · 2^scales
     */
    public WaveletCoefficients decompose(double[] series, int blocks, int scales) {
        return decompose(series, DecompositionShape.of(blocks, scales));
    }

    /**
     * Decomposes according to a validated shape.
     *
     * @param series the input series
     * @param shape the decomposition shape
     * @return the partitioned coefficients
     * @throws InsufficientDataException if the series is shorter than the shape requires
     * @throws IllegalArgumentException if a used sample is not finite
     */
    public WaveletCoefficients decompose(double[] series, DecompositionShape shape) {
        Objects.requireNonNull(series, "series cannot be null");
        Objects.requireNonNull(shape, "shape cannot be null");

        long required = shape.requiredSamples();
        if (required > series.length) {
            throw new InsufficientDataException(series.length, required,
                shape.blocks() + " blocks over " + shape.scales() + " scales");
        }
        int used = (int) required;
        double[] buffer = Arrays.copyOf(series, used);
        for (int i = 0; i < used; i++) {
            if (!Double.isFinite(buffer[i])) {
                throw new IllegalArgumentException("Series value at index " + i + " is not finite: " + buffer[i]);
            }
        }
        if (used < series.length) {
            logger.debug("Discarding {} trailing samples of {}", series.length - used, series.length);
        }

        transform.forward(buffer, used, shape.scales());
        return new WaveletCoefficients(buffer, shape);
    }
}
