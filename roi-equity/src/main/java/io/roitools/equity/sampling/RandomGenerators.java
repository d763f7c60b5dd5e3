package io.roitools.equity.sampling;

/*
 * Copyright (c) roitools
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

import io.roitools.equity.ConfigurationException;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.CombinationSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.Arrays;

/**
 * Seeded random number generators and the row subsampling built on them.
 * Based on Apache Commons RNG, so a given algorithm and seed always produce the
 * same subsample.
 */
public final class RandomGenerators {

    /**
     * PRNG algorithms available for subsampling.
     */
    public enum Algorithm {
        /**
         * XorShiro256++ - 256-bit state, fast with excellent statistical properties.
         * The default.
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * SplitMix64 - 64-bit state, minimal footprint.
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister - 19937-bit state, for comparison with legacy tooling.
         */
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {}

    /**
     * Creates a generator with the given algorithm and seed.
     */
    public static UniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /**
     * Creates a generator with the default algorithm ({@link Algorithm#XO_SHI_RO_256_PP}).
     */
    public static UniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * @return a fresh seed from the platform's entropy
     */
    public static long newSeed() {
        return RandomSource.createLong();
    }

    /**
     * Draws {@code sampleSize} distinct row indices uniformly without replacement from
     * {@code [0, population)} with a {@link CombinationSampler}. The result is sorted
     * ascending so the subsample keeps the source's row order.
     *
     * @param population number of rows available
     * @param sampleSize number of rows to draw, {@code 1 <= sampleSize <= population}
     * @param rng the random number generator
     * @return sorted row indices
     * @throws ConfigurationException if {@code sampleSize} is out of range
     */
    public static int[] sampleIndices(int population, int sampleSize, UniformRandomProvider rng) {
        if (sampleSize <= 0 || sampleSize > population) {
            throw new ConfigurationException(
                "sample size must be a positive integer no larger than the population (" + population +
                "), was " + sampleSize);
        }
        int[] sample = new CombinationSampler(rng, population, sampleSize).sample();
        Arrays.sort(sample);
        return sample;
    }
}
