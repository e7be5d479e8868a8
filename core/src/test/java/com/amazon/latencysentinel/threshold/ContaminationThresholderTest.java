/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.latencysentinel.threshold;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.latencysentinel.config.ThresholdMode;

public class ContaminationThresholderTest {

    private static final double EPSILON = 1e-12;

    @ParameterizedTest
    @CsvSource({ "0.1,9,0", "0.1,10,1", "0.1,21,2", "0.1,30,3", "0.1,51,5", "0.5,21,10", "0.3,10,3" })
    public void testAnomalyBudget(double contamination, int count, int expectedBudget) {
        ContaminationThresholder thresholder = new ContaminationThresholder(contamination, ThresholdMode.TOP_FRACTION);
        assertEquals(expectedBudget, thresholder.getAnomalyBudget(count));
    }

    @Test
    public void testTopFractionThreshold() {
        ContaminationThresholder thresholder = new ContaminationThresholder(0.1, ThresholdMode.TOP_FRACTION);
        double[] history = new double[] { 0.5, 0.9, 0.1, 0.7, 0.3, 0.8, 0.2, 0.6, 0.4 };

        // nine history scores and the query leave one slot, the threshold is the second highest
        double threshold = thresholder.getThreshold(history);
        assertEquals(0.8, threshold, EPSILON);
        assertTrue(thresholder.isAnomaly(0.95, threshold));
        assertTrue(thresholder.isAnomaly(0.85, threshold));
        assertFalse(thresholder.isAnomaly(0.8, threshold));
        assertFalse(thresholder.isAnomaly(0.5, threshold));
    }

    @Test
    public void testTopFractionWithoutBudget() {
        ContaminationThresholder thresholder = new ContaminationThresholder(0.1, ThresholdMode.TOP_FRACTION);
        double[] history = new double[] { 0.2, 0.9, 0.4 };

        double threshold = thresholder.getThreshold(history);
        assertEquals(0.9, threshold, EPSILON);
        assertFalse(thresholder.isAnomaly(0.9, threshold));
    }

    @Test
    public void testTopFractionBudgetCoversHistory() {
        ContaminationThresholder thresholder = new ContaminationThresholder(0.9, ThresholdMode.TOP_FRACTION);
        double[] history = new double[] { 0.6, 0.3, 0.5 };

        // four ranked scores give three slots, so only the lowest history score remains
        assertEquals(0.3, thresholder.getThreshold(history), EPSILON);
    }

    @ParameterizedTest
    @EnumSource(ThresholdMode.class)
    public void testEqualScoresAreNeverAnomalous(ThresholdMode mode) {
        ContaminationThresholder thresholder = new ContaminationThresholder(0.1, mode);
        double[] history = new double[20];
        Arrays.fill(history, 0.5);

        double threshold = thresholder.getThreshold(history);
        assertEquals(0.5, threshold, EPSILON);
        assertFalse(thresholder.isAnomaly(0.5, threshold));
    }

    @Test
    public void testTrainingPercentileThreshold() {
        ContaminationThresholder thresholder = new ContaminationThresholder(0.1, ThresholdMode.TRAINING_PERCENTILE);
        double[] history = new double[] { 5.0, 1.0, 4.0, 2.0, 3.0 };

        // position 0.9 * 4 = 3.6 lies between 4.0 and 5.0
        double threshold = thresholder.getThreshold(history);
        assertThat(threshold, closeTo(4.6, EPSILON));
        assertTrue(thresholder.isAnomaly(4.7, threshold));
        assertFalse(thresholder.isAnomaly(4.6, threshold));
    }

    @Test
    public void testPercentile() {
        double[] scores = new double[] { 3.0, 1.0, 2.0, 4.0 };
        assertEquals(1.0, ContaminationThresholder.percentile(scores, 0.0), EPSILON);
        assertEquals(4.0, ContaminationThresholder.percentile(scores, 1.0), EPSILON);
        assertEquals(2.5, ContaminationThresholder.percentile(scores, 0.5), EPSILON);
        assertEquals(3.7, ContaminationThresholder.percentile(scores, 0.9), EPSILON);
        assertEquals(7.0, ContaminationThresholder.percentile(new double[] { 7.0 }, 0.9), EPSILON);
        // input order is preserved
        assertEquals(3.0, scores[0]);
    }

    @ParameterizedTest
    @EnumSource(ThresholdMode.class)
    public void testLargerContaminationNeverRaisesThreshold(ThresholdMode mode) {
        Random random = new Random(17);
        double[] contaminations = new double[] { 0.01, 0.05, 0.1, 0.2, 0.3, 0.5, 0.9 };
        for (int trial = 0; trial < 50; trial++) {
            double[] history = new double[20 + random.nextInt(40)];
            for (int i = 0; i < history.length; i++) {
                history[i] = random.nextDouble();
            }

            double previous = Double.POSITIVE_INFINITY;
            for (double contamination : contaminations) {
                double threshold = new ContaminationThresholder(contamination, mode).getThreshold(history);
                assertThat(threshold, lessThanOrEqualTo(previous));
                previous = threshold;
            }
        }
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 1.0, -0.1, 1.5, Double.NaN })
    public void testInvalidContamination(double contamination) {
        assertThrows(IllegalArgumentException.class,
                () -> new ContaminationThresholder(contamination, ThresholdMode.TOP_FRACTION));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(NullPointerException.class, () -> new ContaminationThresholder(0.1, null));
        ContaminationThresholder thresholder = new ContaminationThresholder(0.1, ThresholdMode.TOP_FRACTION);
        assertThrows(NullPointerException.class, () -> thresholder.getThreshold(null));
        assertThrows(IllegalArgumentException.class, () -> thresholder.getThreshold(new double[0]));
        assertEquals(0.1, thresholder.getContamination());
        assertEquals(ThresholdMode.TOP_FRACTION, thresholder.getMode());
    }
}
