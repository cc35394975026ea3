package io.nosqlbench.mwm.commands;

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

import io.nosqlbench.mwm.commands.common.DecompositionOption;
import io.nosqlbench.mwm.commands.common.InputFileOption;
import io.nosqlbench.mwm.commands.common.VerbosityOption;
import io.nosqlbench.mwm.commands.series.SeriesReader;
import io.nosqlbench.mwm.extract.MultifractalWaveletFitter;
import io.nosqlbench.mwm.model.MultifractalModelException;
import io.nosqlbench.mwm.model.MultifractalWaveletModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Fits a multifractal wavelet model to a series file and prints its parameters.
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * # Derive the number of scales from a minimum of 5 coarse blocks
 * mwm fit -i traffic.txt --blocks 5
 *
 * # Fix the number of scales instead
 * mwm fit -i traffic.txt --scales 10
 * }</pre>
 */
@CommandLine.Command(name = "fit",
    header = "Fit a multifractal wavelet model to a series",
    description = "Reads a series file, fits the model and prints the series length, the samples used, "
        + "the decomposition and the fitted parameters.",
    exitCodeListHeading = "Exit codes:%n",
    exitCodeList = {
        "0:model fitted",
        "1:the model cannot be fitted to the series",
        "2:input error"
    })
public class CMD_mwm_fit implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_mwm_fit.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FIT_FAILED = 1;
    static final int EXIT_INPUT_ERROR = 2;

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private DecompositionOption decomposition;

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
        } catch (IllegalStateException e) {
            System.err.println("Error: " + e.getMessage());
            logger.error("Invalid options: {}", e.getMessage());
            return EXIT_INPUT_ERROR;
        }
        verbosityOption.applyLogLevel();

        double[] series;
        try {
            inputFileOption.validate();
            series = SeriesReader.read(inputFileOption.getInputPath());
        } catch (IllegalStateException | IOException e) {
            System.err.println("Error: " + e.getMessage());
            logger.error("Cannot read series {}: {}", inputFileOption, e.getMessage());
            return EXIT_INPUT_ERROR;
        }

        try {
            MultifractalWaveletModel model = decomposition.fit(new MultifractalWaveletFitter(), series);
            if (verbosityOption.showNormalOutput()) {
                printReport(System.out, inputFileOption.getInputPath(), series.length, model);
            }
            return EXIT_SUCCESS;
        } catch (MultifractalModelException e) {
            System.err.println("Error: " + e.getMessage());
            logger.error("Fit failed ({}) for {} with {}: {}",
                e.getKind(), inputFileOption, decomposition, e.getMessage());
            return EXIT_FIT_FAILED;
        }
    }

    /**
     * Prints the text report of a fitted model.
     *
     * @param out the destination
     * @param input the series file
     * @param length the number of values in the series
     * @param model the fitted model
     */
    static void printReport(PrintStream out, Path input, int length, MultifractalWaveletModel model) {
        long used = (long) model.getCoarseBlocks() << model.getScales();
        out.printf("Series:        %s%n", input);
        out.printf("Length:        %d%n", length);
        out.printf("Samples used:  %d%n", used);
        out.printf("Blocks:        %d%n", model.getCoarseBlocks());
        out.printf("Scales:        %d%n", model.getScales());
        out.printf("Mean:          %s%n", model.getMean());
        out.printf("Std dev:       %s%n", model.getStdDev());
        out.println("Shapes:");
        for (int i = 0; i < model.getScales(); i++) {
            out.printf("  scale %2d:    %s%n", i, model.getShape(i));
        }
    }
}
