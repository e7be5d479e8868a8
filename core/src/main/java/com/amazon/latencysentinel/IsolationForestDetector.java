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

import static com.amazon.latencysentinel.CommonUtils.checkFinite;
import static com.amazon.latencysentinel.CommonUtils.checkNotNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.latencysentinel.config.DetectorConfig;
import com.amazon.latencysentinel.returntypes.Verdict;
import com.amazon.latencysentinel.threshold.ContaminationThresholder;

/**
 * Classifies a sample against a history of samples with an isolation forest.
 * Every call grows a new forest over the history, scores the history and the
 * query against it, and compares the query score with a cutoff calibrated from
 * the contamination fraction.
 *
 * <p>
 * The detector keeps no state between calls. The forest is seeded from the
 * configured random seed on every call, so equal inputs always produce equal
 * verdicts.
 * </p>
 */
public class IsolationForestDetector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

    private final DetectorConfig config;
    private final ContaminationThresholder thresholder;

    public IsolationForestDetector(DetectorConfig config) {
        this.config = checkNotNull(config, "config must not be null");
        thresholder = new ContaminationThresholder(config.getContamination(), config.getThresholdMode());
    }

    public IsolationForestDetector() {
        this(DetectorConfig.defaultConfig());
    }

    /**
     * Decide whether the query is anomalous relative to the history.
     *
     * @param history the reference values, at least {@code minPoints} of them
     * @param query   the value to classify
     * @return the verdict for the query
     * @throws InsufficientHistoryException if the history is shorter than
     *                                      {@code minPoints}
     */
    public Verdict classify(double[] history, double query) {
        checkNotNull(history, "history must not be null");
        if (history.length < config.getMinPoints()) {
            throw new InsufficientHistoryException(history.length, config.getMinPoints());
        }
        checkFinite(query, "query must be a finite number");

        IsolationForest forest = buildForest(history);
        double queryScore = forest.getAnomalyScore(query);
        double threshold = thresholder.getThreshold(forest.getAnomalyScores(history));
        boolean anomaly = thresholder.isAnomaly(queryScore, threshold);

        if (log.isDebugEnabled()) {
            log.debug("classified {} against {} points: score={}, threshold={}, anomaly={}", query, history.length,
                    queryScore, threshold, anomaly);
        }
        return new Verdict(query, queryScore, threshold, anomaly);
    }

    /**
     * Grow the forest used by {@link #classify} for the given history.
     *
     * @param history the reference values
     * @return a new forest
     */
    public IsolationForest buildForest(double[] history) {
        return IsolationForest.builder().numberOfTrees(config.getNumberOfTrees()).sampleSize(config.getSampleSize())
                .randomSeed(config.getRandomSeed()).build(history);
    }

    public DetectorConfig getConfig() {
        return config;
    }
}
