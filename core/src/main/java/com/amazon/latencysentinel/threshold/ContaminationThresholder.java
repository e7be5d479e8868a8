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

package com.amazon.latencysentinel.threshold;

import static com.amazon.latencysentinel.CommonUtils.checkArgument;
import static com.amazon.latencysentinel.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.latencysentinel.config.ThresholdMode;

/**
 * Derives the anomaly cutoff from the contamination fraction, that is the
 * expected share of anomalies among the scored values. A score is anomalous
 * when it is strictly greater than the cutoff, so ties with the cutoff are
 * normal and a set of equal scores never yields an anomaly.
 *
 * <p>
 * For both modes a larger contamination can only lower the cutoff.
 * </p>
 */
public class ContaminationThresholder {

    // absorbs representation error in products such as 0.1 * 30
    private static final double RANK_TOLERANCE = 1e-9;

    private final double contamination;
    private final ThresholdMode mode;

    public ContaminationThresholder(double contamination, ThresholdMode mode) {
        checkArgument(contamination > 0.0 && contamination < 1.0, "contamination must be strictly between 0 and 1");
        this.contamination = contamination;
        this.mode = checkNotNull(mode, "mode must not be null");
    }

    /**
     * Compute the cutoff for a query from the scores of the history it is
     * compared against.
     *
     * @param historyScores the anomaly scores of the history values
     * @return the cutoff score
     */
    public double getThreshold(double[] historyScores) {
        checkNotNull(historyScores, "historyScores must not be null");
        checkArgument(historyScores.length > 0, "historyScores must not be empty");
        if (mode == ThresholdMode.TRAINING_PERCENTILE) {
            return percentile(historyScores, 1.0 - contamination);
        }
        return topFractionThreshold(historyScores);
    }

    /**
     * @param score     a score
     * @param threshold a cutoff returned by {@link #getThreshold}
     * @return true if the score is strictly above the cutoff
     */
    public boolean isAnomaly(double score, double threshold) {
        return score > threshold;
    }

    /**
     * The number of scores that may be marked anomalous out of the given count.
     *
     * @param count the number of scores ranked
     * @return floor(contamination * count)
     */
    public int getAnomalyBudget(int count) {
        return (int) Math.floor(contamination * count + RANK_TOLERANCE);
    }

    /**
     * The query competes with the history for the
     * {@code floor(contamination * (history + 1))} top slots. It takes one of them
     * only if it scores strictly above the next history score in line, so a
     * history value that the query merely ties with keeps its slot.
     */
    double topFractionThreshold(double[] historyScores) {
        double[] ranked = Arrays.copyOf(historyScores, historyScores.length);
        Arrays.sort(ranked);
        int budget = getAnomalyBudget(historyScores.length + 1);
        if (budget >= ranked.length) {
            return ranked[0];
        }
        // the (budget + 1)-th highest history score
        return ranked[ranked.length - 1 - budget];
    }

    /**
     * Linear interpolation between closest ranks, matching the default method of
     * the common numerical libraries.
     *
     * @param scores   the scores, not modified
     * @param quantile the quantile in [0, 1]
     * @return the interpolated quantile of the scores
     */
    static double percentile(double[] scores, double quantile) {
        double[] sorted = Arrays.copyOf(scores, scores.length);
        Arrays.sort(sorted);
        double position = quantile * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    public double getContamination() {
        return contamination;
    }

    public ThresholdMode getMode() {
        return mode;
    }
}
