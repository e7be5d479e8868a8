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

package com.amazon.latencysentinel.agent;

import static com.amazon.latencysentinel.CommonUtils.checkNotNull;

import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.latencysentinel.returntypes.Verdict;

/**
 * Logs the outcome of every monitoring tick. Anomalies are logged at WARN,
 * stable samples at INFO and samples collected before classification starts
 * at DEBUG.
 */
public class VerdictReporter {

    private final Logger log;

    public VerdictReporter() {
        this(LoggerFactory.getLogger(VerdictReporter.class));
    }

    VerdictReporter(Logger log) {
        this.log = checkNotNull(log, "log must not be null");
    }

    /**
     * @param latencyMs the latency fed to the detector
     * @param verdict   the verdict for the latency, empty while warming up
     * @param collected the number of samples held by the detector
     * @param required  the number of samples needed before classification
     */
    public void report(double latencyMs, Optional<Verdict> verdict, int collected, int required) {
        if (!verdict.isPresent()) {
            log.debug("Collecting baseline ({}/{}). Latency: {}ms", collected, required, format(latencyMs));
            return;
        }

        Verdict v = verdict.get();
        if (v.isAnomaly()) {
            log.warn("ANOMALY DETECTED! High Latency: {}ms (score {})", format(latencyMs), score(v));
        } else {
            log.info("System Stable. Latency: {}ms (score {})", format(latencyMs), score(v));
        }
    }

    static String format(double latencyMs) {
        return String.format(Locale.ROOT, "%.2f", latencyMs);
    }

    private static String score(Verdict verdict) {
        return String.format(Locale.ROOT, "%.4f", verdict.getAnomalyScore());
    }
}
