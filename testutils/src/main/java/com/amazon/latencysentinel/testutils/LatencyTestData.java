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

package com.amazon.latencysentinel.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * This class samples latencies from a mixture of two normal distributions. One
 * of them is the base distribution of a healthy endpoint, the other one is a
 * degraded regime with higher latency, and there are random transitions
 * between the two. Independently of the regime, a probe may time out, in which
 * case the timeout penalty is emitted instead of a latency. Latencies are
 * clamped at zero.
 */
public class LatencyTestData {

    public static final double DEFAULT_TIMEOUT_PENALTY = 2000.0;

    private final double baseMu;
    private final double baseSigma;
    private final double degradedMu;
    private final double degradedSigma;
    private final double transitionToDegradedProbability;
    private final double transitionToBaseProbability;
    private final double timeoutProbability;

    public LatencyTestData(double baseMu, double baseSigma, double degradedMu, double degradedSigma,
            double transitionToDegradedProbability, double transitionToBaseProbability, double timeoutProbability) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.degradedMu = degradedMu;
        this.degradedSigma = degradedSigma;
        this.transitionToDegradedProbability = transitionToDegradedProbability;
        this.transitionToBaseProbability = transitionToBaseProbability;
        this.timeoutProbability = timeoutProbability;
    }

    public LatencyTestData() {
        this(15.0, 2.0, 250.0, 40.0, 0.01, 0.3, 0.0);
    }

    public double[] generateTestData(int numberOfSamples, long seed) {
        Random rng = new Random(seed);
        NormalDistribution dist = new NormalDistribution(rng);
        double[] result = new double[numberOfSamples];
        boolean degraded = false;

        for (int i = 0; i < numberOfSamples; i++) {
            if (rng.nextDouble() < timeoutProbability) {
                result[i] = DEFAULT_TIMEOUT_PENALTY;
            } else if (!degraded) {
                result[i] = Math.max(0.0, dist.nextDouble(baseMu, baseSigma));
            } else {
                result[i] = Math.max(0.0, dist.nextDouble(degradedMu, degradedSigma));
            }

            if (!degraded && rng.nextDouble() < transitionToDegradedProbability) {
                degraded = true;
            } else if (degraded && rng.nextDouble() < transitionToBaseProbability) {
                degraded = false;
            }
        }

        return result;
    }

    /**
     * @return samples drawn uniformly from [lower, upper).
     */
    public static double[] uniform(int numberOfSamples, double lower, double upper, long seed) {
        Random rng = new Random(seed);
        double[] result = new double[numberOfSamples];
        for (int i = 0; i < numberOfSamples; i++) {
            result[i] = lower + rng.nextDouble() * (upper - lower);
        }
        return result;
    }

    public static double[] constant(int numberOfSamples, double value) {
        double[] result = new double[numberOfSamples];
        Arrays.fill(result, value);
        return result;
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(1.0 - u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
