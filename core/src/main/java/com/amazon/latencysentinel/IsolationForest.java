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

import static com.amazon.latencysentinel.CommonUtils.checkArgument;
import static com.amazon.latencysentinel.CommonUtils.checkFinite;
import static com.amazon.latencysentinel.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import com.amazon.latencysentinel.anomalydetection.PathLengthVisitor;
import com.amazon.latencysentinel.config.DetectorConfig;
import com.amazon.latencysentinel.sampler.UniformSubSampler;
import com.amazon.latencysentinel.tree.IsolationTree;

/**
 * An ensemble of isolation trees grown over a fixed set of scalar values. Each
 * tree is grown on its own uniform subsample of the values, and the anomaly
 * score of a query is derived from its path length averaged over all trees:
 *
 * <pre>
 *     score(x) = 2 ^ (-E[h(x)] / c(psi))
 * </pre>
 *
 * where psi is the subsample size. Scores lie in (0, 1]. Values close to 1 are
 * isolated quickly and therefore anomalous, while values around 0.5 or below
 * are embedded in dense regions.
 *
 * <p>
 * A forest is immutable. Building it twice with the same values and the same
 * random seed produces the same trees.
 * </p>
 */
public class IsolationForest {

    private final List<IsolationTree> trees;

    /**
     * The number of values each tree was grown on.
     */
    private final int sampleSize;

    protected IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = Collections.unmodifiableList(trees);
        this.sampleSize = sampleSize;
    }

    /**
     * @return a new IsolationForest builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param point the value to look up
     * @return the path length of the value averaged over all trees.
     */
    public double getAveragePathLength(double point) {
        checkFinite(point, "point must be a finite number");
        double sum = 0.0;
        for (IsolationTree tree : trees) {
            sum += tree.traverse(point, new PathLengthVisitor());
        }
        return sum / trees.size();
    }

    /**
     * @param point the value to score
     * @return the anomaly score of the value, in (0, 1].
     */
    public double getAnomalyScore(double point) {
        return CommonUtils.normalizeScore(getAveragePathLength(point), sampleSize);
    }

    /**
     * @param points the values to score
     * @return the anomaly score of each value, in the same order.
     */
    public double[] getAnomalyScores(double[] points) {
        checkNotNull(points, "points must not be null");
        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = getAnomalyScore(points[i]);
        }
        return scores;
    }

    public int getNumberOfTrees() {
        return trees.size();
    }

    /**
     * @return the number of values each tree was grown on.
     */
    public int getSampleSize() {
        return sampleSize;
    }

    public List<IsolationTree> getTrees() {
        return trees;
    }

    public static class Builder {

        private int numberOfTrees = DetectorConfig.DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DetectorConfig.DEFAULT_SAMPLE_SIZE;
        private Optional<Long> randomSeed = Optional.empty();

        public Builder numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return this;
        }

        /**
         * Grow the forest over the given values.
         *
         * @param points the values, at least one
         * @return the new forest
         */
        public IsolationForest build(double[] points) {
            checkNotNull(points, "points must not be null");
            checkArgument(points.length > 0, "points must not be empty");
            checkArgument(numberOfTrees > 0, "numberOfTrees must be greater than 0");
            checkArgument(sampleSize > 0, "sampleSize must be greater than 0");

            Random rng = getRandom();
            UniformSubSampler subSampler = new UniformSubSampler(sampleSize, rng);
            int effectiveSampleSize = subSampler.getEffectiveSampleSize(points.length);
            int maxDepth = CommonUtils.maxDepth(effectiveSampleSize);

            List<IsolationTree> trees = new ArrayList<>(numberOfTrees);
            for (int i = 0; i < numberOfTrees; i++) {
                IsolationTree tree = IsolationTree.builder().maxDepth(maxDepth).random(new Random(rng.nextLong()))
                        .build(subSampler.sample(points));
                trees.add(tree);
            }
            return new IsolationForest(trees, effectiveSampleSize);
        }

        public Random getRandom() {
            // If a random seed was given, use it to create a new Random. Otherwise, call
            // the 0-argument constructor
            return randomSeed.map(Random::new).orElseGet(Random::new);
        }
    }
}
