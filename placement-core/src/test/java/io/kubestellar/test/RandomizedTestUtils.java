/*
 * RandomizedTestUtils.java
 *
 * This source file is part of the KubeStellar placement engine project
 *
 * Copyright 2024 The KubeStellar Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.kubestellar.test;

import javax.annotation.Nonnull;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Seeds for randomized tests.
 */
public final class RandomizedTestUtils {
    private static final long FIXED_SEED = 0x5eed5eedL;

    private RandomizedTestUtils() {
    }

    /**
     * Return a stream of seeds for {@link Random}s, suitable as the source of a
     * {@link org.junit.jupiter.params.ParameterizedTest}. The given seeds are always included, so that runs are
     * repeatable; when the {@code tests.includeRandom} system property is {@code true}, {@code tests.iterations}
     * further random seeds are added.
     *
     * @param staticSeeds seeds to always include; {@value FIXED_SEED} if none are given
     * @return a stream of seeds
     */
    @Nonnull
    public static Stream<Long> randomSeeds(long... staticSeeds) {
        LongStream seeds = staticSeeds.length == 0 ? LongStream.of(FIXED_SEED) : LongStream.of(staticSeeds);
        if (includeRandomTests()) {
            Random random = ThreadLocalRandom.current();
            seeds = LongStream.concat(seeds, LongStream.generate(random::nextLong).limit(getIterations()));
        }
        return seeds.boxed();
    }

    private static int getIterations() {
        return Integer.parseInt(System.getProperty("tests.iterations", "0"));
    }

    private static boolean includeRandomTests() {
        return Boolean.parseBoolean(System.getProperty("tests.includeRandom", "false"));
    }
}
