package io.nosqlbench.mwm.model;

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

import java.util.Arrays;
import java.util.Objects;

/**
 * A fitted multifractal wavelet model (MWM) with Beta-distributed multipliers.
 *
 * <p>The model describes a positive process through its Haar wavelet
 * structure: a Gaussian law for the coarsest scaling coefficients, and for
 * each finer scale a symmetric Beta multiplier law that splits every value
 * into two children.
 *
 * <h2>Model Structure</h2>
 *
 * <pre>{@code
 *   root ~ N(μ, σ²) · 2^(-S/2)
 *                  │
 *   scale 0    (1±a₀)            a₀ ~ Beta(β₀, β₀) on [-1, 1]
 *                /      \
 *   scale 1  (1±a₁)  (1±a₁)      a₁ ~ Beta(β₁, β₁) on [-1, 1]
 *               ...
 *   scale S-1   2^S leaf values = one synthetic path
 * }</pre>
 *
 * <h2>Invariants</h2>
 *
 * <ul>
 *   <li>1 ≤ S ≤ {@value #MAX_SCALES}, so a path of 2^S values fits in an array</li>
 *   <li>every shape parameter β_i is finite and strictly positive</li>
 *   <li>the root law has a finite mean and a finite, non-negative standard deviation</li>
 * </ul>
 *
 * <p>Instances are immutable and may be shared freely between threads.
 * Models are normally produced by the fitter in the extract package; the
 * public constructor exists for callers that already know their parameters.
 *
 * @see NormalScalarModel
 * @see BetaScalarModel
 */
public final class MultifractalWaveletModel {

    /** Largest supported number of scales. */
    public static final int MAX_SCALES = 30;

    private final NormalScalarModel root;
    private final double[] shapes;
    private final int coarseBlocks;

    /**
     * Constructs a model from its root law and per-scale shape parameters.
     *
     * @param root the Gaussian law of the coarsest scaling coefficients
     * @param shapes the Beta shape parameters, coarsest scale first
     * @param coarseBlocks the number of coarse coefficients the model was fitted on (informational)
     * @throws IllegalArgumentException if an invariant is violated
     */
    public MultifractalWaveletModel(NormalScalarModel root, double[] shapes, int coarseBlocks) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        Objects.requireNonNull(shapes, "shapes cannot be null");
        if (shapes.length < 1 || shapes.length > MAX_SCALES) {
            throw new IllegalArgumentException(
                "Number of scales must be in [1, " + MAX_SCALES + "], got: " + shapes.length);
        }
        for (int i = 0; i < shapes.length; i++) {
            if (!(shapes[i] > 0) || Double.isInfinite(shapes[i])) {
                throw new IllegalArgumentException(
                    "Shape parameter at scale " + i + " must be positive and finite, got: " + shapes[i]);
            }
        }
        if (coarseBlocks < 1) {
            throw new IllegalArgumentException("Coarse block count must be positive, got: " + coarseBlocks);
        }
        this.shapes = shapes.clone();
        this.coarseBlocks = coarseBlocks;
    }

    /**
     * Returns the Gaussian law of the coarsest scaling coefficients.
     * @return the root model
     */
    public NormalScalarModel getRoot() {
        return root;
    }

    /**
     * Returns μ, the mean of the coarsest scaling coefficients.
     * @return the root mean
     */
    public double getMean() {
        return root.getMean();
    }

    /**
     * Returns σ, the standard deviation of the coarsest scaling coefficients.
     * @return the root standard deviation
     */
    public double getStdDev() {
        return root.getStdDev();
    }

    /**
     * Returns the number of scales S.
     * @return the number of scales
     */
    public int getScales() {
        return shapes.length;
    }

    /**
     * Returns the number of coarse coefficients this model was fitted on.
     * @return the coarse block count
     */
    public int getCoarseBlocks() {
        return coarseBlocks;
    }

    /**
     * Returns the Beta shape parameter of one scale.
     *
     * @param scale the scale index, 0 being the coarsest
     * @return β for that scale
     * @throws IndexOutOfBoundsException if the scale is out of range
     */
    public double getShape(int scale) {
        Objects.checkIndex(scale, shapes.length);
        return shapes[scale];
    }

    /**
     * Returns a copy of all shape parameters, coarsest scale first.
     * @return the shape parameters
     */
    public double[] getShapes() {
        return shapes.clone();
    }

    /**
     * Returns the multiplier law of one scale: Beta(β, β) rescaled to [-1, 1].
     *
     * @param scale the scale index, 0 being the coarsest
     * @return the multiplier model
     */
    public BetaScalarModel getMultiplier(int scale) {
        return BetaScalarModel.symmetricMultiplier(getShape(scale));
    }

    /**
     * Returns the length of a path sampled from this model, 2^S.
     * @return the path length
     */
    public int getPathLength() {
        return 1 << shapes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MultifractalWaveletModel)) return false;
        MultifractalWaveletModel that = (MultifractalWaveletModel) o;
        return coarseBlocks == that.coarseBlocks &&
               root.equals(that.root) &&
               Arrays.equals(shapes, that.shapes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(root, coarseBlocks) + Arrays.hashCode(shapes);
    }

    @Override
    public String toString() {
        return "MultifractalWaveletModel[mean=" + root.getMean() +
               ", stdDev=" + root.getStdDev() +
               ", coarseBlocks=" + coarseBlocks +
               ", shapes=" + Arrays.toString(shapes) + "]";
    }
}
