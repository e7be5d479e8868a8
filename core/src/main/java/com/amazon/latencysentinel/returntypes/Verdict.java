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

package com.amazon.latencysentinel.returntypes;

import java.util.Objects;

/**
 * The outcome of classifying one sample: its anomaly score, the cutoff the
 * score was compared against, and the resulting decision.
 */
public class Verdict {

    private final double value;
    private final double anomalyScore;
    private final double threshold;
    private final boolean anomaly;

    public Verdict(double value, double anomalyScore, double threshold, boolean anomaly) {
        this.value = value;
        this.anomalyScore = anomalyScore;
        this.threshold = threshold;
        this.anomaly = anomaly;
    }

    /**
     * @return the classified sample.
     */
    public double getValue() {
        return value;
    }

    /**
     * @return the anomaly score of the sample, in (0, 1].
     */
    public double getAnomalyScore() {
        return anomalyScore;
    }

    /**
     * @return the cutoff derived from the contamination fraction.
     */
    public double getThreshold() {
        return threshold;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Verdict other = (Verdict) o;
        return Double.compare(value, other.value) == 0 && Double.compare(anomalyScore, other.anomalyScore) == 0
                && Double.compare(threshold, other.threshold) == 0 && anomaly == other.anomaly;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, anomalyScore, threshold, anomaly);
    }

    @Override
    public String toString() {
        return String.format("Verdict(value=%f, anomalyScore=%f, threshold=%f, anomaly=%b)", value, anomalyScore,
                threshold, anomaly);
    }
}
