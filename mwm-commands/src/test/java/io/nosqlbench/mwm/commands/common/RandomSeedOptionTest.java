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

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RandomSeedOptionTest {

    @CommandLine.Command(name = "seeded")
    static class SeedHolder {
        @CommandLine.Mixin
        RandomSeedOption seed = new RandomSeedOption();
    }

    @Test
    void explicitSeedIsParsed() {
        SeedHolder holder = new SeedHolder();
        new CommandLine(holder).parseArgs("--seed", "42");

        assertThat(holder.seed.isExplicit()).isTrue();
        assertThat(holder.seed.resolve()).isEqualTo(42L);
    }

    @Test
    void missingSeedFallsBackToTime() {
        SeedHolder holder = new SeedHolder();
        new CommandLine(holder).parseArgs();

        long before = System.currentTimeMillis();
        long resolved = holder.seed.resolve();

        assertThat(holder.seed.isExplicit()).isFalse();
        assertThat(resolved).isGreaterThanOrEqualTo(before);
    }

    @Test
    void invalidSeedIsRejected() {
        assertThatThrownBy(() -> new CommandLine(new SeedHolder()).parseArgs("--seed", "abc"))
            .isInstanceOf(CommandLine.ParameterException.class);
    }
}
