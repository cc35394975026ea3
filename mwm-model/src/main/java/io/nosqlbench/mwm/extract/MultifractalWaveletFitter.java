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
import io.nosqlbench.mwm.model.ModelMismatchException;
import io.nosqlbench.mwm.model.MultifractalWaveletModel;
import io.nosqlbench.mwm.model.NormalScalarModel;
import io.nosqlbench.mwm.wavelet.HaarWaveletTransform;
import io.nosqlbench.mwm.wavelet.WaveletTransform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fits a multifractal wavelet model with Beta-distributed multipliers.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>{@code
 * series ──► truncate ──► wavelet transform ──► per-scale energies
 *                                 │                     │
 *                                 ▼                     ▼
 *                       Gaussian fit (block 0)   Beta shape recursion
 *                                 └──────────┬──────────┘
 *                                            ▼
 *                                 MultifractalWaveletModel
 * }</pre>
 *
 * <p>Fitting is deterministic: the same series and decomposition always
 * produce a bit-identical model. The fitter holds no mutable state and may
 * be shared between threads.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * MultifractalWaveletFitter fitter = new MultifractalWaveletFitter();
 * MultifractalWaveletModel model = fitter.fit(series, 5);
 * }</pre>
 *
 * @see ScaleDecomposer
 * @see ScaleEnergyEstimator
 * @see BetaShapeRecursion
 * @see CoarseGaussianEstimator
 */
public final class MultifractalWaveletFitter {

    private static final Logger logger = LogManager.getLogger(MultifractalWaveletFitter.class);

    private final ScaleDecomposer decomposer;
    private final ScaleEnergyEstimator energyEstimator;
    private final CoarseGaussianEstimator gaussianEstimator;

    /**
     * Creates a fitter using the Haar transform and Commons Math statistics.
     */
    public MultifractalWaveletFitter() {
        this(new HaarWaveletTransform(), new CommonsMathStatistics());
    }

    /**
     * Creates a fitter with explicit collaborators.
     *
     * @param transform the wavelet transform
     * @param statistics the statistics provider
     */
    public MultifractalWaveletFitter(WaveletTransform transform, SampleStatistics statistics) {
        Objects.requireNonNull(transform, "transform cannot be null");
        Objects.requireNonNull(statistics, "statistics cannot be null");
        this.decomposer = new ScaleDecomposer(transform);
        this.energyEstimator = new ScaleEnergyEstimator(statistics);
        this.gaussianEstimator = new CoarseGaussianEstimator(statistics);
    }

    /**
     * Fits using at least {@code blocks} coarse coefficients; the scale count
     * is derived from the series length.
     *
     * @param data the observed series
     * @param blocks the minimum number of coarse coefficients; at least 2
     * @return the fitted model
     * @throws InvalidConfigurationException if blocks &lt; 2
     * @throws InsufficientDataException if the series cannot hold a single scale
     * @throws ModelMismatchException if the data does not fit the model
     */
    public MultifractalWaveletModel fit(double[] data, int blocks) {
        Objects.requireNonNull(data, "data cannot be null");
        return fit(data, DecompositionShape.forBlocks(data.length, blocks));
    }

    /**
     * Fits over exactly {@code scales} levels; the block count is derived
     * from the series length.
     *
     * @param data the observed series
     * @param scales the number of scales; at least 1
     * @return the fitted model
     * @throws InvalidConfigurationException if scales &lt; 1
     * @throws InsufficientDataException if fewer than two coarse blocks result
     * @throws ModelMismatchException if the data does not fit the model
     */
    public MultifractalWaveletModel fitWithScales(double[] data, int scales) {
        Objects.requireNonNull(data, "data cannot be null");
        return fit(data, DecompositionShape.forScales(data.length, scales));
    }

    /**
     * Fits with an explicit decomposition shape.
     *
     * @param data the observed series
     * @param shape the decomposition shape
     * @return the fitted model
     * @throws InsufficientDataException if the series is shorter than the shape requires
     * @throws ModelMismatchException if the data does not fit the model
     */
    public MultifractalWaveletModel fit(double[] data, DecompositionShape shape) {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(shape, "shape cannot be null");
        logger.debug("Fitting {} samples with {} blocks over {} scales",
            data.length, shape.blocks(), shape.scales());

        WaveletCoefficients coefficients = decomposer.decompose(data, shape);
        double[] energies = energyEstimator.estimate(coefficients);
        double[] shapes = BetaShapeRecursion.estimate(energies);
        NormalScalarModel root = gaussianEstimator.estimate(coefficients);

        MultifractalWaveletModel model = new MultifractalWaveletModel(root, shapes, shape.blocks());
        if (logger.isDebugEnabled()) {
            logger.debug("Fitted mean={}, stdDev={}, shapes={}",
                root.getMean(), root.getStdDev(), Arrays.toString(shapes));
        }
        return model;
    }
}
