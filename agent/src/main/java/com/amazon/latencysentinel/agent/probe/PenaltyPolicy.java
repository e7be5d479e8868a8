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

package com.amazon.latencysentinel.agent.probe;

import static com.amazon.latencysentinel.CommonUtils.checkArgument;
import static com.amazon.latencysentinel.CommonUtils.checkNotNull;

/**
 * Turns a probe result into the latency fed to the detector. A failed probe is
 * recorded as a fixed penalty latency so that an unreachable endpoint shows up
 * as a latency spike.
 */
public class PenaltyPolicy {

    public static final double DEFAULT_PENALTY_LATENCY_MS = 2000.0;

    private final double penaltyLatencyMs;

    public PenaltyPolicy(double penaltyLatencyMs) {
        checkArgument(Double.isFinite(penaltyLatencyMs) && penaltyLatencyMs >= 0.0,
                "penaltyLatencyMs must be a non-negative number");
        this.penaltyLatencyMs = penaltyLatencyMs;
    }

    public PenaltyPolicy() {
        this(DEFAULT_PENALTY_LATENCY_MS);
    }

    /**
     * @param result a probe result
     * @return the measured latency, or the penalty if the probe failed
     */
    public double apply(ProbeResult result) {
        checkNotNull(result, "result must not be null");
        return result.isSuccess() ? result.getLatencyMs() : penaltyLatencyMs;
    }

    public double getPenaltyLatencyMs() {
        return penaltyLatencyMs;
    }
}
