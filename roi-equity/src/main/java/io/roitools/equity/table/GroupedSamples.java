package io.roitools.equity.table;

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
import io.roitools.equity.GroupedSample;
import io.roitools.equity.config.EquityConfig;
import io.roitools.equity.sampling.RandomGenerators;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// # GroupedSamples
///
/// Factory for [GroupedSample] from a tabular [GroupingSource].
///
/// ## Subsampling
/// Pairwise indices grow quadratically with the population, so callers can bound
/// the cost by drawing one uniform subsample of rows. The subsample is drawn once,
/// from the full table, **before** grouping; every metric built on the result sees
/// only the subsample as its population.
///
/// Subsampling is seeded. The overloads without a seed draw one from the platform's
/// entropy and log it at INFO level so a run can be repeated.
///
/// ```java
/// GroupedSample sample = GroupedSamples.fromTable(table, List.of("gender"), "wage", 5000, 42L);
/// ```
public final class GroupedSamples {

    private static final Logger logger = LogManager.getLogger(GroupedSamples.class);

    private GroupedSamples() {}

    /// Groups every row of the table.
    public static GroupedSample fromTable(GroupingSource table, List<String> groupColumns, String valueColumn) {
        return group(table, groupColumns, valueColumn, GroupedSample.DEFAULT_MIN_GROUP_SIZE);
    }

    /// Draws a subsample with a fresh seed, then groups it.
    public static GroupedSample fromTable(GroupingSource table, List<String> groupColumns, String valueColumn,
                                          int sampleSize) {
        long seed = RandomGenerators.newSeed();
        logger.info("subsampling {} rows with generated seed {}", sampleSize, seed);
        return fromTable(table, groupColumns, valueColumn, sampleSize, seed);
    }

    /// Draws a seeded subsample, then groups it.
    ///
    /// @throws ConfigurationException if `sampleSize` is not positive or exceeds the row count
    public static GroupedSample fromTable(GroupingSource table, List<String> groupColumns, String valueColumn,
                                          int sampleSize, long seed) {
        GroupingSource sampled = subsample(table, sampleSize,
            RandomGenerators.Algorithm.XO_SHI_RO_256_PP, seed);
        return group(sampled, groupColumns, valueColumn, GroupedSample.DEFAULT_MIN_GROUP_SIZE);
    }

    /// Groups the table with the sample size, seed, generator and minimum group size
    /// taken from a configuration. Without a configured sample size all rows are used.
    public static GroupedSample fromTable(GroupingSource table, List<String> groupColumns, String valueColumn,
                                          EquityConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        config.validate();
        GroupingSource source = table;
        if (config.getSampleSize() != null) {
            long seed;
            if (config.getSeed() != null) {
                seed = config.getSeed();
            } else {
                seed = RandomGenerators.newSeed();
                logger.info("subsampling {} rows with generated seed {}", config.getSampleSize(), seed);
            }
            source = subsample(table, config.getSampleSize(), config.getRngAlgorithm(), seed);
        }
        return group(source, groupColumns, valueColumn, config.getMinGroupSize());
    }

    private static GroupingSource subsample(GroupingSource table, int sampleSize,
                                            RandomGenerators.Algorithm algorithm, long seed) {
        Objects.requireNonNull(table, "table cannot be null");
        int[] rows = RandomGenerators.sampleIndices(table.rowCount(), sampleSize,
            RandomGenerators.create(algorithm, seed));
        logger.debug("drew {} of {} rows (seed {})", rows.length, table.rowCount(), seed);
        return table.select(rows);
    }

    private static GroupedSample group(GroupingSource table, List<String> groupColumns, String valueColumn,
                                       int minGroupSize) {
        Objects.requireNonNull(table, "table cannot be null");
        Objects.requireNonNull(groupColumns, "groupColumns cannot be null");
        Objects.requireNonNull(valueColumn, "valueColumn cannot be null");
        List<Group> groups = table.groupBy(groupColumns, valueColumn);
        if (groups.isEmpty()) {
            throw new ConfigurationException("table has no rows to group");
        }
        List<String> labels = new ArrayList<>(groups.size());
        List<double[]> values = new ArrayList<>(groups.size());
        for (Group group : groups) {
            labels.add(group.label());
            values.add(group.values());
        }
        return new GroupedSample(labels, values, minGroupSize);
    }
}
