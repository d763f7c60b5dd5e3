package io.roitools.equity.measures;

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

import io.roitools.equity.DomainException;
import io.roitools.equity.GroupedSample;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class ThielTTest {

    private static final double EPSILON = 1e-12;

    @Test
    public void testEqualValuesHaveNoInequality() {
        GroupedSample sample = GroupedSample.builder()
            .group("A", 3, 3, 3)
            .group("B", 3, 3, 3)
            .build();
        ThielT theil = new ThielT(sample);
        theil.calculate();

        assertEquals(0.0, theil.within(), EPSILON);
        assertEquals(0.0, theil.between(), EPSILON);
        assertEquals(0.0, theil.overall(), EPSILON);
        assertTrue(Double.isNaN(theil.ratio()), "ratio of zero inequality is undefined");
    }

    @Test
    public void testSkewedGroupsStayInRange() {
        GroupedSample sample = GroupedSample.builder()
            .group("A", 1, 1)
            .group("B", 1, 1, 1, 1, 1, 1, 200, 200)
            .build();
        ThielT theil = new ThielT(sample);
        theil.calculate();

        assertEquals(1.2867667395659919, theil.within(), 1e-10);
        assertEquals(0.19897996975726162, theil.between(), 1e-10);
        assertThat(theil.ratio()).isBetween(0.0, 1.0);
    }

    @Test
    public void testDecompositionMatchesIndexOfPooledValues() {
        GroupedSample sample = GroupedSample.builder()
            .group("A", 1, 2)
            .group("B", 4, 8)
            .build();
        ThielT theil = new ThielT(sample);
        theil.calculate();

        assertEquals(0.056633012265132426, theil.within(), 1e-12);
        assertEquals(0.19274475702175753, theil.between(), 1e-12);
        assertEquals(ThielT.theil(sample.flat()), theil.overall(), 1e-12);
        assertEquals(theil.overall(), theil.within() + theil.between(), 0.0);
    }

    @Test
    public void testNegativeValueIsRejectedBeforeComputation() {
        GroupedSample sample = GroupedSample.builder()
            .group("A", 1, 2)
            .group("B", -4, 8)
            .build();
        ThielT theil = new ThielT(sample);

        assertThatThrownBy(theil::calculate)
            .isInstanceOf(DomainException.class)
            .hasMessageContaining("THEIL_T")
            .hasMessageContaining("VarianceDecomposition")
            .satisfies(e -> assertThat(((DomainException) e).getMnemonic()).isEqualTo(ThielT.MNEMONIC));
        assertThat(theil.isCalculated()).isFalse();
    }

    @Test
    public void testZeroValueIsRejected() {
        ThielT theil = new ThielT(GroupedSample.single("all", 0, 1, 2));
        assertThatThrownBy(theil::calculate).isInstanceOf(DomainException.class);
    }

    @Test
    public void testScaleInvariance() {
        ThielT base = new ThielT(GroupedSample.builder().group("A", 1, 2).group("B", 4, 8).build());
        ThielT scaled = new ThielT(GroupedSample.builder().group("A", 10, 20).group("B", 40, 80).build());
        base.calculate();
        scaled.calculate();

        assertEquals(base.within(), scaled.within(), EPSILON);
        assertEquals(base.between(), scaled.between(), EPSILON);
    }

    @Test
    public void testSingleArrayIndex() {
        assertEquals(0.0, ThielT.theil(new double[]{5, 5, 5}), 0.0);
        assertEquals(0.24937776928688987, ThielT.theil(new double[]{1, 2, 4, 8}), 1e-12);
        assertThatThrownBy(() -> ThielT.theil(new double[]{Double.NaN}))
            .isInstanceOf(DomainException.class);
    }
}
