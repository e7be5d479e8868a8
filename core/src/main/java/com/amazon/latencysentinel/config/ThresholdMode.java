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

/**
 * How the anomaly cutoff is derived from the contamination fraction.
 */
public enum ThresholdMode {

    /**
     * The query competes with the history for the top
     * {@code floor(contamination * (history + 1))} scores. The cutoff is the next
     * history score after those slots, and only scores strictly above it are
     * anomalous.
     */
    TOP_FRACTION,

    /**
     * An offset computed on the history alone: the cutoff is the
     * {@code (1 - contamination)} percentile of the history scores, with linear
     * interpolation between ranks.
     */
    TRAINING_PERCENTILE;

}
