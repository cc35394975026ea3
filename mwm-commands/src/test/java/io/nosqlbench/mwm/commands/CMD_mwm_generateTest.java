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

import io.nosqlbench.mwm.commands.series.SeriesReader;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_mwm_generateTest extends CommandTestSupport {

    @Test
    public void testGeneratesRequestedPathsToStdout() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);

        Result result = run("generate", "-i", series.toString(), "--blocks", "5",
            "-n", "3", "--seed", "42", "--max-attempts", "1000");

        assertThat(result.exitCode()).isEqualTo(0);
        double[] values = SeriesReader.read(new StringReader(result.out()));
        assertThat(values).hasSize(3 * 8);
        assertThat(Arrays.stream(values).boxed().toList()).allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(0.0));
    }

    @Test
    public void testSameSeedIsReproducible() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);

        Result first = run("generate", "-i", series.toString(), "--scales", "3",
            "-n", "2", "-s", "7", "--max-attempts", "1000");
        Result second = run("generate", "-i", series.toString(), "--scales", "3",
            "-n", "2", "-s", "7", "--max-attempts", "1000");
        Result other = run("generate", "-i", series.toString(), "--scales", "3",
            "-n", "2", "-s", "7", "--max-attempts", "1000", "--algorithm", "mt");

        assertThat(first.exitCode()).isEqualTo(0);
        assertThat(second.out()).isEqualTo(first.out());
        assertThat(other.exitCode()).isEqualTo(0);
        assertThat(other.out()).isNotEqualTo(first.out());
    }

    @Test
    public void testVerboseSummaryReportsSeed() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);

        Result given = run("generate", "-i", series.toString(), "--blocks", "5",
            "-s", "5", "--max-attempts", "1000", "-v");
        Result timed = run("generate", "-i", series.toString(), "--blocks", "5",
            "--max-attempts", "1000", "-v");

        assertThat(given.exitCode()).isEqualTo(0);
        assertThat(given.err()).contains("seed 5 (given)");
        assertThat(timed.exitCode()).isEqualTo(0);
        assertThat(timed.err()).contains("(time-based)");
    }

    @Test
    public void testWritesOutputFile() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);
        Path output = tempDir.resolve("out/paths.txt");

        Result result = run("generate", "-i", series.toString(), "--blocks", "5",
            "-n", "4", "-s", "11", "--max-attempts", "1000", "-o", output.toString());

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.out()).isEmpty();
        assertThat(Files.readAllLines(output)).hasSize(4 * 8);
    }

    @Test
    public void testExistingOutputNeedsForce() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);
        Path output = writeSeries("existing.txt", "keep\n");

        Result refused = run("generate", "-i", series.toString(), "--blocks", "5",
            "-s", "3", "--max-attempts", "1000", "-o", output.toString());
        assertThat(refused.exitCode()).isEqualTo(CMD_mwm_generate.EXIT_INPUT_ERROR);
        assertThat(Files.readString(output)).isEqualTo("keep\n");

        Result forced = run("generate", "-i", series.toString(), "--blocks", "5",
            "-s", "3", "--max-attempts", "1000", "-o", output.toString(), "--force");
        assertThat(forced.exitCode()).isEqualTo(0);
        assertThat(Files.readAllLines(output)).hasSize(8);
    }

    @Test
    public void testNegativeRootExhaustsAttempts() throws IOException {
        double[] reference = SeriesReader.read(new StringReader(REFERENCE_SERIES));
        String shifted = Arrays.stream(reference)
            .mapToObj(v -> Double.toString(v - 10.0))
            .collect(Collectors.joining("\n"));
        Path series = writeSeries("shifted.txt", shifted);

        Result result = run("generate", "-i", series.toString(), "--blocks", "5",
            "-s", "1", "--max-attempts", "3");

        assertThat(result.exitCode()).isEqualTo(CMD_mwm_generate.EXIT_MODEL_ERROR);
        assertThat(result.err()).contains("No valid path after 3 attempts");
        assertThat(result.out()).isEmpty();
    }

    @Test
    public void testFitFailureExitsWithModelError() throws IOException {
        Path series = writeSeries("short.txt", "1 2 3\n");

        Result result = run("generate", "-i", series.toString(), "--scales", "2");

        assertThat(result.exitCode()).isEqualTo(CMD_mwm_generate.EXIT_MODEL_ERROR);
        assertThat(result.err()).contains("Not enough data");
    }

    @Test
    public void testInvalidCountsAreInputErrors() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);

        assertThat(run("generate", "-i", series.toString(), "--blocks", "5", "-n", "0").exitCode())
            .isEqualTo(CMD_mwm_generate.EXIT_INPUT_ERROR);
        assertThat(run("generate", "-i", series.toString(), "--blocks", "5", "--max-attempts", "0").exitCode())
            .isEqualTo(CMD_mwm_generate.EXIT_INPUT_ERROR);
    }

    @Test
    public void testTopLevelCommandPrintsUsage() {
        Result result = run();

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.out()).contains("fit").contains("generate");
    }
}
