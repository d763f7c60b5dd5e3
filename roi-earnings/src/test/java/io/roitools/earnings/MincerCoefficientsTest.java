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

import io.roitools.equity.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class MincerCoefficientsTest {

    static final String JSON = "{\n" +
        "  \"years_of_schooling\": 0.09,\n" +
        "  \"years_of_schooling:work_experience\": 0.001,\n" +
        "  \"work_experience\": 0.03,\n" +
        "  \"np.power(work_experience, 2)\": -0.0005\n" +
        "}";

    @TempDir
    Path tempDir;

    @Test
    void readsModelTermNames() {
        MincerCoefficients coefficients = MincerCoefficients.fromJson(JSON);

        assertThat(coefficients.schooling()).isEqualTo(0.09);
        assertThat(coefficients.schoolingByExperience()).isEqualTo(0.001);
        assertThat(coefficients.experience()).isEqualTo(0.03);
        assertThat(coefficients.experienceSquared()).isEqualTo(-0.0005);
    }

    @Test
    void experienceValueCombinesTerms() {
        MincerCoefficients coefficients = new MincerCoefficients(0.09, 0.001, 0.03, -0.0005);

        assertThat(coefficients.experienceValue(12, 12)).isCloseTo(0.432, within(1e-12));
        assertThat(coefficients.experienceValue(0, 16)).isEqualTo(0.0);
    }

    @Test
    void jsonRoundTrip() {
        MincerCoefficients coefficients = new MincerCoefficients(0.1, 0.002, 0.04, -0.0006);
        String json = coefficients.toJson();

        assertThat(json).contains("\"np.power(work_experience, 2)\"");
        assertThat(MincerCoefficients.fromJson(json)).isEqualTo(coefficients);
    }

    @Test
    void loadsFromFile() throws Exception {
        Path file = tempDir.resolve("mincer.json");
        Files.writeString(file, JSON);

        assertThat(MincerCoefficients.loadFromFile(file).experience()).isEqualTo(0.03);
    }

    @Test
    void invalidInputIsAConfigurationError() {
        assertThatThrownBy(() -> MincerCoefficients.fromJson("{\"work_experience\": \"steep\"}"))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> MincerCoefficients.fromJson(""))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new MincerCoefficients(Double.NaN, 0, 0, 0))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void nonFiniteCoefficientInJsonIsAConfigurationError() {
        String json = JSON.replace("0.03", "NaN");

        assertThatThrownBy(() -> MincerCoefficients.fromJson(json))
            .isExactlyInstanceOf(ConfigurationException.class);
    }

    @Test
    void missingTermIsAConfigurationError() {
        assertThatThrownBy(() -> MincerCoefficients.fromJson("{\"years_of_schooling\": 0.1}"))
            .isExactlyInstanceOf(ConfigurationException.class)
            .hasMessageContaining("years_of_schooling:work_experience");
        assertThatThrownBy(() -> MincerCoefficients.fromJson(JSON.replace("-0.0005", "null")))
            .isExactlyInstanceOf(ConfigurationException.class)
            .hasMessageContaining("np.power(work_experience, 2)");
    }

    @Test
    void missingTermInFileIsAConfigurationError() throws Exception {
        Path file = tempDir.resolve("partial.json");
        Files.writeString(file, "{\"work_experience\": 0.03}");

        assertThatThrownBy(() -> MincerCoefficients.loadFromFile(file))
            .isExactlyInstanceOf(ConfigurationException.class)
            .hasMessageContaining("partial.json");
    }
}
