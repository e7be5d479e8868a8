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

package com.amazon.latencysentinel;

import static com.amazon.latencysentinel.CommonUtils.averagePathLength;
import static com.amazon.latencysentinel.CommonUtils.maxDepth;
import static com.amazon.latencysentinel.CommonUtils.normalizeScore;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class CommonUtilsTest {

    private static final double EPSILON = 1e-6;

    @Test
    public void testCheckArgument() {
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.checkArgument(false, "error message"));
        CommonUtils.checkArgument(true, "no error");
    }

    @Test
    public void testCheckState() {
        assertThrows(IllegalStateException.class, () -> CommonUtils.checkState(false, "error message"));
        CommonUtils.checkState(true, "no error");
    }

    @Test
    public void testCheckNotNull() {
        assertThrows(NullPointerException.class, () -> CommonUtils.checkNotNull(null, "error message"));
        assertEquals("value", CommonUtils.checkNotNull("value", "no error"));
    }

    @Test
    public void testCheckFinite() {
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.checkFinite(Double.NaN, "nan"));
        assertThrows(IllegalArgumentException.class,
                () -> CommonUtils.checkFinite(Double.POSITIVE_INFINITY, "infinity"));
        CommonUtils.checkFinite(-12.5, "no error");
    }

    @Test
    public void testAveragePathLength() {
        assertEquals(0.0, averagePathLength(0));
        assertEquals(0.0, averagePathLength(1));
        // 2 * (ln(1) + gamma) - 1
        assertThat(averagePathLength(2), closeTo(2 * CommonUtils.EULER_CONSTANT - 1.0, EPSILON));
        assertThat(averagePathLength(2), closeTo(0.1544313, EPSILON));

        // 2 * (ln(2) + gamma) - 4 / 3
        assertThat(averagePathLength(3), closeTo(1.2073924, EPSILON));
        // 2 * (ln(255) + gamma) - 510 / 256
        assertThat(averagePathLength(256), closeTo(10.2447, 1e-4));
    }

    @Test
    public void testAveragePathLengthIsIncreasing() {
        for (int n = 1; n < 1000; n++) {
            assertThat(averagePathLength(n + 1) > averagePathLength(n), is(true));
        }
    }

    @ParameterizedTest
    @CsvSource({ "1,0", "2,1", "3,2", "4,2", "20,5", "50,6", "256,8", "257,9" })
    public void testMaxDepth(int sampleSize, int expectedDepth) {
        assertEquals(expectedDepth, maxDepth(sampleSize));
    }

    @Test
    public void testMaxDepthRejectsEmptySample() {
        assertThrows(IllegalArgumentException.class, () -> maxDepth(0));
    }

    @Test
    public void testNormalizeScore() {
        // a point at the average depth of an unsuccessful search scores 0.5
        assertEquals(0.5, normalizeScore(averagePathLength(20), 20), EPSILON);
        assertEquals(1.0, normalizeScore(0.0, 20));
        assertEquals(1.0, normalizeScore(3.0, 1));
        assertThat(normalizeScore(averagePathLength(2), 2), closeTo(0.5, EPSILON));
        assertThat(normalizeScore(1.0, 256) > normalizeScore(8.0, 256), is(true));
    }
}
