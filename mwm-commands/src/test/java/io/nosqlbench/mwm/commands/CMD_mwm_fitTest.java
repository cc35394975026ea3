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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_mwm_fitTest extends CommandTestSupport {

    @Test
    public void testFitReportsReferenceParameters() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);

        Result result = run("fit", "-i", series.toString(), "--blocks", "5");

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.out())
            .contains("Length:        42")
            .contains("Samples used:  40")
            .contains("Blocks:        5")
            .contains("Scales:        3")
            .contains("Mean:          1.18425287122")
            .contains("Std dev:       0.44665921475")
            .contains("scale  0:    16.3515358394")
            .contains("scale  1:    2.79318870157")
            .contains("scale  2:    3.73937467761");
    }

    @Test
    public void testFitWithScalesMatchesBlocks() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);

        Result byBlocks = run("fit", "-i", series.toString(), "--blocks", "5");
        Result byScales = run("fit", "-i", series.toString(), "--scales", "3");

        assertThat(byScales.exitCode()).isEqualTo(0);
        assertThat(byScales.out()).isEqualTo(byBlocks.out());
    }

    @Test
    public void testQuietSuppressesReport() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);

        Result result = run("fit", "-i", series.toString(), "-b", "5", "-q");

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.out()).isEmpty();
    }

    @Test
    public void testInsufficientDataExitsWithFitFailure() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);

        Result result = run("fit", "-i", series.toString(), "--blocks", "22");

        assertThat(result.exitCode()).isEqualTo(CMD_mwm_fit.EXIT_FIT_FAILED);
        assertThat(result.err()).contains("Not enough data");
        assertThat(result.out()).isEmpty();
    }

    @Test
    public void testModelMismatchExitsWithFitFailure() throws IOException {
        Path series = writeSeries("constant.txt", "2 2 2 2 2 2 2 2 2 2 2 2 2 2 2 2\n");

        Result result = run("fit", "-i", series.toString(), "--blocks", "2");

        assertThat(result.exitCode()).isEqualTo(CMD_mwm_fit.EXIT_FIT_FAILED);
        assertThat(result.err()).contains("not appropriate for the data");
    }

    @Test
    public void testInvalidConfigurationExitsWithFitFailure() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);

        assertThat(run("fit", "-i", series.toString(), "--blocks", "0").exitCode())
            .isEqualTo(CMD_mwm_fit.EXIT_FIT_FAILED);
        assertThat(run("fit", "-i", series.toString(), "--scales", "0").exitCode())
            .isEqualTo(CMD_mwm_fit.EXIT_FIT_FAILED);
    }

    @Test
    public void testMissingFileIsInputError() {
        Result result = run("fit", "-i", tempDir.resolve("absent.txt").toString(), "--blocks", "5");

        assertThat(result.exitCode()).isEqualTo(CMD_mwm_fit.EXIT_INPUT_ERROR);
        assertThat(result.err()).contains("does not exist");
    }

    @Test
    public void testMalformedFileIsInputError() throws IOException {
        Path series = writeSeries("bad.txt", "1.0 2.0\n3.0 three\n");

        Result result = run("fit", "-i", series.toString(), "--blocks", "2");

        assertThat(result.exitCode()).isEqualTo(CMD_mwm_fit.EXIT_INPUT_ERROR);
        assertThat(result.err()).contains("Line 2").contains("three");
    }

    @Test
    public void testBlocksAndScalesAreExclusive() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);

        assertThat(run("fit", "-i", series.toString()).exitCode()).isEqualTo(2);
        assertThat(run("fit", "-i", series.toString(), "--blocks", "5", "--scales", "3").exitCode())
            .isEqualTo(2);
    }

    @Test
    public void testVerboseAndQuietConflict() throws IOException {
        Path series = writeSeries("reference.txt", REFERENCE_SERIES);

        Result result = run("fit", "-i", series.toString(), "--blocks", "5", "-v", "-q");

        assertThat(result.exitCode()).isEqualTo(CMD_mwm_fit.EXIT_INPUT_ERROR);
        assertThat(result.err()).contains("Cannot specify both").doesNotContain("series");
        assertThat(result.out()).isEmpty();
    }
}
