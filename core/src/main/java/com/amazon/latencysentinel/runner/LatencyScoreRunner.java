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

package com.amazon.latencysentinel.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.amazon.latencysentinel.StreamingDetector;
import com.amazon.latencysentinel.config.DetectorConfig;
import com.amazon.latencysentinel.config.InvalidConfigurationException;
import com.amazon.latencysentinel.returntypes.Verdict;

/**
 * Replays a recorded latency series through a streaming detector and appends
 * the anomaly score and the decision to every row.
 */
public class LatencyScoreRunner extends SimpleRunner {

    public LatencyScoreRunner() {
        super(LatencyScoreRunner.class.getName(),
                "Classify the latency read from each input row and append the anomaly score and decision to the row.",
                LatencyScoreTransformer::new);
    }

    public static void main(String... args) throws IOException {
        LatencyScoreRunner runner = new LatencyScoreRunner();
        try {
            runner.configure(args);
        } catch (InvalidConfigurationException e) {
            runner.argumentParser.printUsageAndExit("%s", e.getMessage());
            return;
        }
        System.out.println("Reading from stdin... (Ctrl-c to exit)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        System.out.println("Done.");
    }

    public static class LatencyScoreTransformer implements LineTransformer {

        static final List<String> EMPTY_RESULT = Arrays.asList("NA", "NA");

        private final StreamingDetector detector;

        public LatencyScoreTransformer(DetectorConfig config) {
            this(new StreamingDetector(config));
        }

        public LatencyScoreTransformer(StreamingDetector detector) {
            this.detector = detector;
        }

        @Override
        public List<String> getResultValues(double value) {
            Optional<Verdict> verdict = detector.process(value);
            return verdict
                    .map(v -> Arrays.asList(Double.toString(v.getAnomalyScore()), Boolean.toString(v.isAnomaly())))
                    .orElse(EMPTY_RESULT);
        }

        @Override
        public List<String> getResultColumnNames() {
            return Arrays.asList("anomaly_score", "is_anomaly");
        }

        public StreamingDetector getDetector() {
            return detector;
        }
    }
}
