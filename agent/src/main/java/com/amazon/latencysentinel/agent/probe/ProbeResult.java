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
import static com.amazon.latencysentinel.CommonUtils.checkState;

import java.util.Optional;

/**
 * The outcome of one probe: either a latency in milliseconds or a typed
 * failure with a message.
 */
public final class ProbeResult {

    public enum FailureType {
        /**
         * No response arrived within the probe timeout.
         */
        TIMEOUT,
        /**
         * The endpoint could not be reached or the exchange broke off.
         */
        CONNECTION_FAILURE
    }

    private final double latencyMs;
    private final FailureType failureType;
    private final String message;

    private ProbeResult(double latencyMs, FailureType failureType, String message) {
        this.latencyMs = latencyMs;
        this.failureType = failureType;
        this.message = message;
    }

    public static ProbeResult success(double latencyMs) {
        checkArgument(Double.isFinite(latencyMs) && latencyMs >= 0.0, "latencyMs must be a non-negative number");
        return new ProbeResult(latencyMs, null, null);
    }

    public static ProbeResult failure(FailureType failureType, String message) {
        checkNotNull(failureType, "failureType must not be null");
        return new ProbeResult(Double.NaN, failureType, message);
    }

    public boolean isSuccess() {
        return failureType == null;
    }

    public double getLatencyMs() {
        checkState(isSuccess(), "a failed probe has no latency");
        return latencyMs;
    }

    public Optional<FailureType> getFailureType() {
        return Optional.ofNullable(failureType);
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return String.format("ProbeResult(latencyMs=%f)", latencyMs);
        }
        return String.format("ProbeResult(failureType=%s, message=%s)", failureType, message);
    }
}
