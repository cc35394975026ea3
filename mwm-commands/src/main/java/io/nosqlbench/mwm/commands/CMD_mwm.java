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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Tools for fitting multifractal wavelet models to positive series and
/// generating synthetic paths from them.
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "mwm",
    header = "Fit and sample multifractal wavelet models",
    mixinStandardHelpOptions = true,
    subcommands = {
        CommandLine.HelpCommand.class,
        CMD_mwm_fit.class,
        CMD_mwm_generate.class
    })
public class CMD_mwm implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_mwm.class);

    /// run a mwm command
    /// @param args
    ///     command line args
    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /// Builds the command line with the options every entry point shares.
    ///
    /// @return a configured command line
    public static CommandLine newCommandLine() {
        return new CommandLine(new CMD_mwm())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    /// Print usage when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        logger.debug("No subcommand given");
        CommandLine.usage(this, System.out);
        return 0;
    }
}
