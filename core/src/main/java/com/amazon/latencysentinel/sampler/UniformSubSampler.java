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

package com.amazon.latencysentinel.sampler;

import static com.amazon.latencysentinel.CommonUtils.checkArgument;
import static com.amazon.latencysentinel.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Random;

/**
 * Draws fixed-size subsamples uniformly without replacement. Each tree of an
 * isolation forest is grown on its own subsample, which bounds the depth of
 * the trees when the history is large. When the input is not larger than the
 * sample size the whole input is used.
 */
public class UniformSubSampler {

    /**
     * The maximum number of values in a subsample.
     */
    private final int sampleSize;

    private final Random random;

    public UniformSubSampler(int sampleSize, Random random) {
        checkArgument(sampleSize > 0, "sampleSize must be greater than 0");
        this.sampleSize = sampleSize;
        this.random = checkNotNull(random, "random must not be null");
    }

    /**
     * @param populationSize the number of values available
     * @return the size of the subsamples drawn from that many values.
     */
    public int getEffectiveSampleSize(int populationSize) {
        return Math.min(sampleSize, populationSize);
    }

    /**
     * Draw a subsample of the given values. The order of the returned values is
     * not meaningful.
     *
     * @param points the population, which is not modified
     * @return a new array holding min(sampleSize, points.length) values
     */
    public double[] sample(double[] points) {
        checkNotNull(points, "points must not be null");
        if (points.length <= sampleSize) {
            return Arrays.copyOf(points, points.length);
        }

        // partial Fisher-Yates shuffle over a copy of the population
        double[] shuffled = Arrays.copyOf(points, points.length);
        for (int i = 0; i < sampleSize; i++) {
            int j = i + random.nextInt(shuffled.length - i);
            double tmp = shuffled[i];
            shuffled[i] = shuffled[j];
            shuffled[j] = tmp;
        }
        return Arrays.copyOf(shuffled, sampleSize);
    }

    public int getSampleSize() {
        return sampleSize;
    }
}
