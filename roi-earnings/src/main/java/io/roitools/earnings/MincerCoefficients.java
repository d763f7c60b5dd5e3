package io.roitools.earnings;

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
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.annotations.SerializedName;
import io.roitools.equity.ConfigurationException;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Pre-computed coefficients of a Mincer earnings regression of log wages on
 * schooling and work experience. The regression itself is fitted elsewhere; this
 * type only carries its output.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Keys follow the term names of the fitted model:
 * <pre>{@code
 * {
 *   "years_of_schooling": 0.091,
 *   "years_of_schooling:work_experience": 0.0004,
 *   "work_experience": 0.032,
 *   "np.power(work_experience, 2)": -0.0005
 * }
 * }</pre>
 *
 * @param schooling coefficient on years of schooling
 * @param schoolingByExperience coefficient on the schooling × experience interaction
 * @param experience coefficient on years of work experience
 * @param experienceSquared coefficient on squared work experience
 */
public record MincerCoefficients(
    @SerializedName("years_of_schooling") double schooling,
    @SerializedName("years_of_schooling:work_experience") double schoolingByExperience,
    @SerializedName("work_experience") double experience,
    @SerializedName("np.power(work_experience, 2)") double experienceSquared
) {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /** Term names of the fitted model, as they appear in the coefficient file. */
    public static final List<String> TERMS = List.of(
        "years_of_schooling",
        "years_of_schooling:work_experience",
        "work_experience",
        "np.power(work_experience, 2)");

    public MincerCoefficients {
        if (!Double.isFinite(schooling) || !Double.isFinite(schoolingByExperience)
            || !Double.isFinite(experience) || !Double.isFinite(experienceSquared)) {
            throw new ConfigurationException("Mincer coefficients must be finite");
        }
    }

    /**
     * Log-wage contribution of {@code experience} years of work experience at the
     * given schooling: {@code c_sx·e·s + c_x·e + c_x2·e²}.
     */
    public double experienceValue(double experienceYears, double schoolingYears) {
        return schoolingByExperience * experienceYears * schoolingYears
            + experience * experienceYears
            + experienceSquared * experienceYears * experienceYears;
    }

    /**
     * @throws ConfigurationException if the JSON is malformed, a term is missing, or a
     *     coefficient is not finite
     */
    public static MincerCoefficients fromJson(String json) {
        JsonElement tree;
        try {
            tree = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new ConfigurationException("invalid Mincer coefficient JSON: " + e.getMessage(), e);
        }
        return fromTree(tree, "JSON");
    }

    /**
     * @throws ConfigurationException if the file is malformed, a term is missing, or a
     *     coefficient is not finite
     */
    public static MincerCoefficients loadFromFile(Path path) throws IOException {
        JsonElement tree;
        try (Reader reader = Files.newBufferedReader(path)) {
            tree = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new ConfigurationException("invalid Mincer coefficient file " + path + ": " + e.getMessage(), e);
        }
        return fromTree(tree, "file " + path);
    }

    private static MincerCoefficients fromTree(JsonElement tree, String source) {
        if (tree == null || !tree.isJsonObject()) {
            throw new ConfigurationException("expected an object of Mincer coefficients in " + source);
        }
        JsonObject object = tree.getAsJsonObject();
        for (String term : TERMS) {
            if (!object.has(term) || object.get(term).isJsonNull()) {
                throw new ConfigurationException("missing Mincer coefficient '" + term + "' in " + source);
            }
        }
        try {
            return GSON.fromJson(object, MincerCoefficients.class);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            // the record adapter wraps exceptions thrown by the canonical constructor
            if (e.getCause() instanceof ConfigurationException) {
                throw (ConfigurationException) e.getCause();
            }
            throw new ConfigurationException("invalid Mincer coefficients in " + source + ": " + e.getMessage(), e);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }
}
