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

package com.amazon.latencysentinel.returntypes;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class VerdictTest {

    @Test
    public void testGetters() {
        Verdict verdict = new Verdict(500.0, 0.87, 0.44, true);
        assertEquals(500.0, verdict.getValue());
        assertEquals(0.87, verdict.getAnomalyScore());
        assertEquals(0.44, verdict.getThreshold());
        assertTrue(verdict.isAnomaly());
        assertFalse(new Verdict(12.0, 0.5, 0.5, false).isAnomaly());
    }

    @Test
    public void testEqualsAndHashCode() {
        Verdict verdict = new Verdict(12.0, 0.5, 0.5, false);
        Verdict same = new Verdict(12.0, 0.5, 0.5, false);

        assertEquals(verdict, verdict);
        assertEquals(verdict, same);
        assertEquals(verdict.hashCode(), same.hashCode());
        assertNotEquals(verdict, new Verdict(12.0, 0.5, 0.5, true));
        assertNotEquals(verdict, new Verdict(12.0, 0.6, 0.5, false));
        assertNotEquals(verdict, new Verdict(13.0, 0.5, 0.5, false));
        assertNotEquals(verdict, null);
        assertNotEquals(verdict, "verdict");
    }

    @Test
    public void testToString() {
        assertThat(new Verdict(500.0, 0.875, 0.5, true).toString(), containsString("anomaly=true"));
    }
}
