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
import io.nosqlbench.mwm.commands.common.OutputFileOption;
import io.nosqlbench.mwm.commands.common.RandomSeedOption;
import io.nosqlbench.mwm.commands.common.VerbosityOption;
import io.nosqlbench.mwm.commands.series.SeriesReader;
import io.nosqlbench.mwm.extract.MultifractalWaveletFitter;
import io.nosqlbench.mwm.model.ModelMismatchException;
import io.nosqlbench.mwm.model.MultifractalModelException;
import io.nosqlbench.mwm.model.MultifractalWaveletModel;
import io.nosqlbench.mwm.sampling.CascadeSampler;
import io.nosqlbench.mwm.sampling.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Fits a model to a series file and writes synthetic paths drawn from it.
 *
 * <p>Paths are written one value per line, concatenated in draw order. A path
 * whose root draw is negative is redrawn with fresh randomness, up to
 * {@code --max-attempts} times.
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * # Draw 4 paths to stdout
 * mwm generate -i traffic.txt --blocks 5 -n 4 --seed 42
 *
 * # Write to a file with a different generator
 * mwm generate -i traffic.txt --scales 12 -o synthetic.txt --algorithm MT
 * }</pre>
 */
@CommandLine.Command(name = "generate",
    header = "Generate synthetic paths from a fitted model",
    description = "Fits a multifractal wavelet model to the series, then draws paths of length 2^scales.",
    exitCodeListHeading = "Exit codes:%n",
    exitCodeList = {
        "0:paths written",
        "1:the model cannot be fitted or a path could not be drawn",
        "2:input or output error"
    })
public class CMD_mwm_generate implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_mwm_generate.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_MODEL_ERROR = 1;
    static final int EXIT_INPUT_ERROR = 2;

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private DecompositionOption decomposition;

    @CommandLine.Option(names = {"-n", "--paths"},
        description = "Number of paths to generate (default: ${DEFAULT-VALUE})",
        defaultValue = "1")
    private int paths;

    @CommandLine.Option(names = {"--max-attempts"},
        description = "Draws allowed per path before giving up on negative roots (default: ${DEFAULT-VALUE})",
        defaultValue = "10")
    private int maxAttempts;

    @CommandLine.Option(names = {"--algorithm"},
        description = "PRNG algorithm (${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE})",
        defaultValue = "XO_SHI_RO_256_PP")
    private RandomGenerators.Algorithm algorithm;

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

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
            if (paths < 1) {
                throw new IllegalStateException("Number of paths must be positive, got: " + paths);
            }
            if (maxAttempts < 1) {
                throw new IllegalStateException("Max attempts must be positive, got: " + maxAttempts);
            }
            inputFileOption.validate();
            outputFileOption.validate();
            series = SeriesReader.read(inputFileOption.getInputPath());
        } catch (IllegalStateException | IOException e) {
            System.err.println("Error: " + e.getMessage());
            logger.error("Invalid input: {}", e.getMessage());
            return EXIT_INPUT_ERROR;
        }

        List<double[]> drawn;
        long seed = randomSeedOption.resolve();
        try {
            MultifractalWaveletModel model = decomposition.fit(new MultifractalWaveletFitter(), series);
            logger.info("Fitted {} scales from {} values of {}", model.getScales(), series.length, inputFileOption);
            drawn = draw(new CascadeSampler(model), RandomGenerators.create(algorithm, seed));
        } catch (MultifractalModelException e) {
            System.err.println("Error: " + e.getMessage());
            logger.error("Generation failed ({}): {}", e.getKind(), e.getMessage());
            return EXIT_MODEL_ERROR;
        }

        try {
            write(drawn);
        } catch (IOException e) {
            System.err.println("Error writing paths: " + e.getMessage());
            logger.error("Cannot write {}: {}", outputFileOption, e.getMessage());
            return EXIT_INPUT_ERROR;
        }

        if (verbosityOption.showVerbose()) {
            System.err.printf("Generated %d path(s) of length %d with %s, seed %d (%s)%n",
                drawn.size(), drawn.get(0).length, algorithm, seed,
                randomSeedOption.isExplicit() ? "given" : "time-based");
        }
        return EXIT_SUCCESS;
    }

    private List<double[]> draw(CascadeSampler sampler, UniformRandomProvider rng) {
        List<double[]> drawn = new ArrayList<>(paths);
        for (int p = 0; p < paths; p++) {
            drawn.add(drawWithRetries(sampler, rng, p));
        }
        return drawn;
    }

    private double[] drawWithRetries(CascadeSampler sampler, UniformRandomProvider rng, int pathIndex) {
        ModelMismatchException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return sampler.sample(rng);
            } catch (ModelMismatchException e) {
                logger.debug("Path {} attempt {} of {} rejected: {}", pathIndex, attempt, maxAttempts, e.getMessage());
                last = e;
            }
        }
        throw new ModelMismatchException(last.getScale(),
            "No valid path after " + maxAttempts + " attempts: " + last.getMessage());
    }

    private void write(List<double[]> drawn) throws IOException {
        if (outputFileOption.isStandardOutput()) {
            Writer writer = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            writeValues(drawn, writer);
            writer.flush();
            return;
        }
        Path output = outputFileOption.getOutputPath();
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            writeValues(drawn, writer);
        }
        logger.info("Wrote {} path(s) to {}", drawn.size(), output);
    }

    private static void writeValues(List<double[]> drawn, Writer writer) throws IOException {
        for (double[] path : drawn) {
            for (double value : path) {
                writer.write(Double.toString(value));
                writer.write('\n');
            }
        }
    }
}
