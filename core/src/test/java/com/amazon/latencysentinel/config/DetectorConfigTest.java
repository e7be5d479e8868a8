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

package com.amazon.latencysentinel.config;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.function.Consumer;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class DetectorConfigTest {

    @Test
    public void testDefaultConfig() {
        DetectorConfig config = DetectorConfig.defaultConfig();
        assertEquals(50, config.getWindowCapacity());
        assertEquals(20, config.getMinPoints());
        assertEquals(100, config.getNumberOfTrees());
        assertEquals(256, config.getSampleSize());
        assertEquals(0.1, config.getContamination());
        assertEquals(42L, config.getRandomSeed());
        assertEquals(ThresholdMode.TOP_FRACTION, config.getThresholdMode());
    }

    @Test
    public void testBuilderWithCustomArguments() {
        DetectorConfig config = DetectorConfig.builder().windowCapacity(120).minPoints(30).numberOfTrees(40)
                .sampleSize(64).contamination(0.05).randomSeed(7L)
                .thresholdMode(ThresholdMode.TRAINING_PERCENTILE).build();

        assertEquals(120, config.getWindowCapacity());
        assertEquals(30, config.getMinPoints());
        assertEquals(40, config.getNumberOfTrees());
        assertEquals(64, config.getSampleSize());
        assertEquals(0.05, config.getContamination());
        assertEquals(7L, config.getRandomSeed());
        assertEquals(ThresholdMode.TRAINING_PERCENTILE, config.getThresholdMode());
    }

    @Test
    public void testToBuilder() {
        DetectorConfig config = DetectorConfig.builder().windowCapacity(80).contamination(0.2).build();
        DetectorConfig copy = config.toBuilder().randomSeed(3L).build();

        assertEquals(80, copy.getWindowCapacity());
        assertEquals(0.2, copy.getContamination());
        assertEquals(3L, copy.getRandomSeed());
        assertEquals(config.getMinPoints(), copy.getMinPoints());
        assertThat(copy.toString(), containsString("windowCapacity=80"));
    }

    @Test
    public void testWindowEqualToMinPoints() {
        DetectorConfig config = DetectorConfig.builder().windowCapacity(20).minPoints(20).build();
        assertEquals(20, config.getWindowCapacity());
    }

    static Stream<Arguments> invalidConfigurations() {
        return Stream.of(
                Arguments.of("windowCapacity", (Consumer<DetectorConfig.Builder<?>>) b -> b.windowCapacity(0)),
                Arguments.of("minPoints", (Consumer<DetectorConfig.Builder<?>>) b -> b.minPoints(1)),
                Arguments.of("windowCapacity",
                        (Consumer<DetectorConfig.Builder<?>>) b -> b.windowCapacity(10).minPoints(20)),
                Arguments.of("numberOfTrees", (Consumer<DetectorConfig.Builder<?>>) b -> b.numberOfTrees(0)),
                Arguments.of("sampleSize", (Consumer<DetectorConfig.Builder<?>>) b -> b.sampleSize(0)),
                Arguments.of("contamination", (Consumer<DetectorConfig.Builder<?>>) b -> b.contamination(0.0)),
                Arguments.of("contamination", (Consumer<DetectorConfig.Builder<?>>) b -> b.contamination(1.0)),
                Arguments.of("contamination", (Consumer<DetectorConfig.Builder<?>>) b -> b.contamination(-0.5)));
    }

    @ParameterizedTest
    @MethodSource("invalidConfigurations")
    public void testInvalidConfiguration(String field, Consumer<DetectorConfig.Builder<?>> change) {
        DetectorConfig.Builder<?> builder = DetectorConfig.builder();
        change.accept(builder);
        InvalidConfigurationException exception = assertThrows(InvalidConfigurationException.class, builder::build);
        assertThat(exception.getMessage(), containsString(field));
    }

    @Test
    public void testNullThresholdMode() {
        assertThrows(NullPointerException.class, () -> DetectorConfig.builder().thresholdMode(null).build());
    }
}
