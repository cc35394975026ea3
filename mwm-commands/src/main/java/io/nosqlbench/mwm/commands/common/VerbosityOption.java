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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags for controlling
 * command output and the level of the {@code io.nosqlbench.mwm} loggers.
 */
public class VerbosityOption {

    /** The logger hierarchy adjusted by these flags. */
    public static final String LOGGER_NAME = "io.nosqlbench.mwm";

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output and debug logging"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all output except errors"
    )
    private boolean quiet = false;

    /**
     * Checks if normal (non-quiet) output should be shown.
     *
     * @return true if normal output should be shown
     */
    public boolean showNormalOutput() {
        return !quiet;
    }

    /**
     * Checks if verbose messages should be shown.
     *
     * @return true if verbose messages should be shown
     */
    public boolean showVerbose() {
        return verbose && !quiet;
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException(
                "Cannot specify both --verbose and --quiet options"
            );
        }
    }

    /**
     * Raises the project loggers to DEBUG when verbose, or lowers them to ERROR when quiet.
     */
    public void applyLogLevel() {
        if (verbose) {
            Configurator.setLevel(LOGGER_NAME, Level.DEBUG);
        } else if (quiet) {
            Configurator.setLevel(LOGGER_NAME, Level.ERROR);
        }
    }
}
