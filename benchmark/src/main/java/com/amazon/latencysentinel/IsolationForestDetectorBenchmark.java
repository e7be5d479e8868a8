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

import java.util.Arrays;
import java.util.Optional;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.latencysentinel.config.DetectorConfig;
import com.amazon.latencysentinel.returntypes.Verdict;
import com.amazon.latencysentinel.testutils.LatencyTestData;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class IsolationForestDetectorBenchmark {

    public final static int DATA_SIZE = 1_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "50", "256", "1000" })
        int windowCapacity;

        @Param({ "50", "100" })
        int numberOfTrees;

        double[] data;
        DetectorConfig config;
        StreamingDetector detector;

        @Setup(Level.Trial)
        public void setUpData() {
            LatencyTestData testData = new LatencyTestData();
            data = testData.generateTestData(DATA_SIZE + windowCapacity, 99L);
            config = DetectorConfig.builder().windowCapacity(windowCapacity).numberOfTrees(numberOfTrees)
                    .randomSeed(99L).build();
        }

        @Setup(Level.Invocation)
        public void setUpDetector() {
            detector = new StreamingDetector(config);
            for (int i = 0; i < windowCapacity; i++) {
                detector.process(data[i]);
            }
        }
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public StreamingDetector process(BenchmarkState state, Blackhole blackhole) {
        double[] data = state.data;
        StreamingDetector detector = state.detector;
        Optional<Verdict> verdict = Optional.empty();

        for (int i = state.windowCapacity; i < data.length; i++) {
            verdict = detector.process(data[i]);
        }

        blackhole.consume(verdict);
        return detector;
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public IsolationForestDetector classifyFullWindow(BenchmarkState state, Blackhole blackhole) {
        double[] data = state.data;
        IsolationForestDetector detector = new IsolationForestDetector(state.config);
        double[] history = Arrays.copyOf(data, state.windowCapacity);
        Verdict verdict = null;

        for (int i = state.windowCapacity; i < data.length; i++) {
            verdict = detector.classify(history, data[i]);
        }

        blackhole.consume(verdict);
        return detector;
    }
}
