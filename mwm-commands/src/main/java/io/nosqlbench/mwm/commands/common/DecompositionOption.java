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

package io.nosqlbench.mwm.commands.common;

import io.nosqlbench.mwm.extract.MultifractalWaveletFitter;
import io.nosqlbench.mwm.model.MultifractalWaveletModel;
import picocli.CommandLine;

/**
 * Mutually exclusive {@code --blocks} / {@code --scales} choice, used as a picocli
 * {@link CommandLine.ArgGroup} with multiplicity one.
 */
public class DecompositionOption {

    @CommandLine.Option(
        names = {"-b", "--blocks"},
        description = "Minimum number of coarse blocks; the number of scales is derived from the series length",
        required = true
    )
    private Integer blocks;

    @CommandLine.Option(
        names = {"--scales"},
        description = "Number of scales; the number of coarse blocks is derived from the series length",
        required = true
    )
    private Integer scales;

    public DecompositionOption() {
    }

    DecompositionOption(Integer blocks, Integer scales) {
        this.blocks = blocks;
        this.scales = scales;
    }

    /**
     * Fits the series with whichever of the two parameters was given.
     *
     * @param fitter the fitter to use
     * @param series the series to fit
     * @return the fitted model
     */
    public MultifractalWaveletModel fit(MultifractalWaveletFitter fitter, double[] series) {
        if (blocks != null) {
            return fitter.fit(series, blocks);
        }
        return fitter.fitWithScales(series, scales);
    }

    @Override
    public String toString() {
        return blocks != null ? "blocks=" + blocks : "scales=" + scales;
    }
}
