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

import picocli.CommandLine;

/**
 * Shared {@code --seed} option for reproducible path generation.
 */
public class RandomSeedOption {

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Random seed for path generation (default: current time)"
    )
    private Long seed;

    /**
     * Resolves the seed to use. Without {@code --seed} this is the current time,
     * so each call may differ; keep the returned value when it must be reported.
     *
     * @return the given seed, or a time-based one
     */
    public long resolve() {
        return seed != null ? seed : System.currentTimeMillis();
    }

    /**
     * Checks if the seed was given on the command line.
     *
     * @return true if {@code --seed} was given
     */
    public boolean isExplicit() {
        return seed != null;
    }
}
