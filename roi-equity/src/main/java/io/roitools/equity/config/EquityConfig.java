package io.roitools.equity.config;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.roitools.equity.ConfigurationException;
import io.roitools.equity.GroupedSample;
import io.roitools.equity.measures.VarianceDecomposition;
import io.roitools.equity.sampling.RandomGenerators;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * JSON-serializable settings for building and decomposing grouped samples.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "sample_size": 5000,           // optional; omit to use every row
 *   "seed": 42,                    // optional; generated and logged when absent
 *   "rng_algorithm": "XO_SHI_RO_256_PP",
 *   "min_group_size": 30,
 *   "residual_tolerance": 1e-9
 * }
 * }</pre>
 *
 * <p>Every field is optional. Unset fields take the defaults shown above.
 *
 * @see io.roitools.equity.table.GroupedSamples#fromTable(io.roitools.equity.table.GroupingSource, java.util.List, String, EquityConfig)
 */
public class EquityConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("sample_size")
    private Integer sampleSize;

    @SerializedName("seed")
    private Long seed;

    @SerializedName("rng_algorithm")
    private String rngAlgorithm;

    @SerializedName("min_group_size")
    private Integer minGroupSize;

    @SerializedName("residual_tolerance")
    private Double residualTolerance;

    public EquityConfig() {
    }

    public Integer getSampleSize() {
        return sampleSize;
    }

    public EquityConfig setSampleSize(Integer sampleSize) {
        this.sampleSize = sampleSize;
        return this;
    }

    public Long getSeed() {
        return seed;
    }

    public EquityConfig setSeed(Long seed) {
        this.seed = seed;
        return this;
    }

    /**
     * @return the configured generator, {@link RandomGenerators.Algorithm#XO_SHI_RO_256_PP} when unset
     * @throws ConfigurationException if the name is not a known algorithm
     */
    public RandomGenerators.Algorithm getRngAlgorithm() {
        if (rngAlgorithm == null) {
            return RandomGenerators.Algorithm.XO_SHI_RO_256_PP;
        }
        try {
            return RandomGenerators.Algorithm.valueOf(rngAlgorithm.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unknown rng_algorithm '" + rngAlgorithm + "'", e);
        }
    }

    public EquityConfig setRngAlgorithm(RandomGenerators.Algorithm algorithm) {
        this.rngAlgorithm = algorithm == null ? null : algorithm.name();
        return this;
    }

    public int getMinGroupSize() {
        return minGroupSize == null ? GroupedSample.DEFAULT_MIN_GROUP_SIZE : minGroupSize;
    }

    public EquityConfig setMinGroupSize(Integer minGroupSize) {
        this.minGroupSize = minGroupSize;
        return this;
    }

    public double getResidualTolerance() {
        return residualTolerance == null ? VarianceDecomposition.DEFAULT_RESIDUAL_TOLERANCE : residualTolerance;
    }

    public EquityConfig setResidualTolerance(Double residualTolerance) {
        this.residualTolerance = residualTolerance;
        return this;
    }

    /**
     * Checks every set field.
     *
     * @return this configuration
     * @throws ConfigurationException on the first invalid field
     */
    public EquityConfig validate() {
        if (sampleSize != null && sampleSize <= 0) {
            throw new ConfigurationException("sample_size must be a positive integer, was " + sampleSize);
        }
        if (minGroupSize != null && minGroupSize < 0) {
            throw new ConfigurationException("min_group_size must be >= 0, was " + minGroupSize);
        }
        if (residualTolerance != null && !(residualTolerance >= 0)) {
            throw new ConfigurationException("residual_tolerance must be >= 0, was " + residualTolerance);
        }
        getRngAlgorithm();
        return this;
    }

    /**
     * Loads a configuration from JSON.
     *
     * @throws ConfigurationException if the JSON is malformed
     */
    public static EquityConfig fromJson(String json) {
        try {
            EquityConfig config = GSON.fromJson(json, EquityConfig.class);
            return config == null ? new EquityConfig() : config;
        } catch (JsonParseException e) {
            throw new ConfigurationException("invalid equity configuration JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a configuration from a Reader providing JSON.
     *
     * @throws ConfigurationException if the JSON is malformed
     */
    public static EquityConfig fromJson(Reader reader) {
        try {
            EquityConfig config = GSON.fromJson(reader, EquityConfig.class);
            return config == null ? new EquityConfig() : config;
        } catch (JsonParseException e) {
            throw new ConfigurationException("invalid equity configuration JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Loads and validates a configuration from a JSON file.
     */
    public static EquityConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader).validate();
        }
    }

    /**
     * Serializes this configuration to JSON. Unset fields are omitted.
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
