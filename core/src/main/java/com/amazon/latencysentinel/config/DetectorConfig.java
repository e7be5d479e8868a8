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

import static com.amazon.latencysentinel.CommonUtils.checkNotNull;
import static com.amazon.latencysentinel.config.InvalidConfigurationException.checkConfiguration;

/**
 * Immutable set of options shared by the sliding-window buffer and the
 * isolation forest detector. Instances are created with {@link #builder()};
 * every option that is not set takes its {@code DEFAULT_*} value, and the
 * combination is validated once in {@link Builder#build()}.
 */
public class DetectorConfig {

    /**
     * Default number of samples kept in the sliding window.
     */
    public static final int DEFAULT_WINDOW_CAPACITY = 50;

    /**
     * Default number of history points required before a sample is classified.
     */
    public static final int DEFAULT_MIN_POINTS = 20;

    /**
     * Default number of trees in the forest.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    /**
     * Default upper bound on the number of points each tree is grown on.
     */
    public static final int DEFAULT_SAMPLE_SIZE = 256;

    /**
     * Default expected fraction of anomalies in the history.
     */
    public static final double DEFAULT_CONTAMINATION = 0.1;

    public static final long DEFAULT_RANDOM_SEED = 42L;

    public static final ThresholdMode DEFAULT_THRESHOLD_MODE = ThresholdMode.TOP_FRACTION;

    private final int windowCapacity;
    private final int minPoints;
    private final int numberOfTrees;
    private final int sampleSize;
    private final double contamination;
    private final long randomSeed;
    private final ThresholdMode thresholdMode;

    protected DetectorConfig(Builder<?> builder) {
        checkConfiguration(builder.windowCapacity > 0, "windowCapacity must be greater than 0");
        checkConfiguration(builder.minPoints >= 2, "minPoints must be at least 2");
        checkConfiguration(builder.windowCapacity >= builder.minPoints,
                "windowCapacity must be greater than or equal to minPoints");
        checkConfiguration(builder.numberOfTrees >= 1, "numberOfTrees must be at least 1");
        checkConfiguration(builder.sampleSize >= 1, "sampleSize must be at least 1");
        checkConfiguration(builder.contamination > 0.0 && builder.contamination < 1.0,
                "contamination must be strictly between 0 and 1");
        checkNotNull(builder.thresholdMode, "thresholdMode must not be null");

        windowCapacity = builder.windowCapacity;
        minPoints = builder.minPoints;
        numberOfTrees = builder.numberOfTrees;
        sampleSize = builder.sampleSize;
        contamination = builder.contamination;
        randomSeed = builder.randomSeed;
        thresholdMode = builder.thresholdMode;
    }

    /**
     * @return a new DetectorConfig builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @return a DetectorConfig with every option at its default value.
     */
    public static DetectorConfig defaultConfig() {
        return builder().build();
    }

    /**
     * @return a builder initialized with the options of this config.
     */
    public Builder<?> toBuilder() {
        return builder().windowCapacity(windowCapacity).minPoints(minPoints).numberOfTrees(numberOfTrees)
                .sampleSize(sampleSize).contamination(contamination).randomSeed(randomSeed)
                .thresholdMode(thresholdMode);
    }

    public int getWindowCapacity() {
        return windowCapacity;
    }

    public int getMinPoints() {
        return minPoints;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public double getContamination() {
        return contamination;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public ThresholdMode getThresholdMode() {
        return thresholdMode;
    }


    @Override
    public String toString() {
        return String.format("DetectorConfig(windowCapacity=%d, minPoints=%d, numberOfTrees=%d, sampleSize=%d, "
                + "contamination=%s, randomSeed=%d, thresholdMode=%s)", windowCapacity, minPoints, numberOfTrees,
                sampleSize, contamination, randomSeed, thresholdMode);
    }

    public static class Builder<T extends Builder<T>> {

        private int windowCapacity = DEFAULT_WINDOW_CAPACITY;
        private int minPoints = DEFAULT_MIN_POINTS;
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private double contamination = DEFAULT_CONTAMINATION;
        private long randomSeed = DEFAULT_RANDOM_SEED;
        private ThresholdMode thresholdMode = DEFAULT_THRESHOLD_MODE;

        public T windowCapacity(int windowCapacity) {
            this.windowCapacity = windowCapacity;
            return (T) this;
        }

        public T minPoints(int minPoints) {
            this.minPoints = minPoints;
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return (T) this;
        }

        public T contamination(double contamination) {
            this.contamination = contamination;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return (T) this;
        }

        public T thresholdMode(ThresholdMode thresholdMode) {
            this.thresholdMode = thresholdMode;
            return (T) this;
        }

        public DetectorConfig build() {
            return new DetectorConfig(this);
        }
    }
}
