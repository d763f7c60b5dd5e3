package io.roitools.charts;

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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SparklineTest {

    @Test
    void widthIsAlwaysRespected() {
        assertThat(Sparkline.bars(new double[]{1, 2, 3, 4, 5}, 12)).hasSize(12);
        assertThat(Sparkline.bars(new double[]{1, 2, 3}, 1)).hasSize(1);
        assertThat(Sparkline.bars(new double[0], 8)).isEqualTo("        ");
        assertThat(Sparkline.bars(null, 3)).isEqualTo("   ");
    }

    @Test
    void tallestBinIsAFullBlock() {
        String bars = Sparkline.bars(new double[]{0, 10, 10, 10}, 2);

        assertThat(bars.charAt(1)).isEqualTo('█');
        assertThat(bars.charAt(0)).isNotEqualTo(' ');
    }

    @Test
    void emptyBinsAreBlank() {
        String bars = Sparkline.bars(new double[]{0, 10}, 3);
        assertThat(bars.charAt(1)).isEqualTo(' ');
    }

    @Test
    void constantDataFillsTheMiddleBin() {
        assertThat(Sparkline.bars(new double[]{5, 5, 5}, 5)).isEqualTo("  █  ");
    }

    @Test
    void nonFiniteValuesAreSkipped() {
        String bars = Sparkline.bars(new double[]{Double.NaN, Double.POSITIVE_INFINITY, 1, 2}, 2);
        assertThat(bars).isEqualTo("██");
    }

    @Test
    void fixedRangeClampsOutliers() {
        String bars = Sparkline.bars(new double[]{-100, 50, 1000}, 4, 0, 100);
        assertThat(bars.charAt(0)).isEqualTo('█');
        assertThat(bars.charAt(2)).isEqualTo('█');
        assertThat(bars.charAt(3)).isEqualTo('█');
    }

    @Test
    void nonPositiveWidthIsRejected() {
        assertThatThrownBy(() -> Sparkline.bars(new double[]{1}, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
