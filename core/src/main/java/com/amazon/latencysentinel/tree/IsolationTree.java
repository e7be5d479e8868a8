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

package com.amazon.latencysentinel.tree;

import static com.amazon.latencysentinel.CommonUtils.checkArgument;
import static com.amazon.latencysentinel.CommonUtils.checkFinite;
import static com.amazon.latencysentinel.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Optional;
import java.util.Random;

import com.amazon.latencysentinel.CommonUtils;
import com.amazon.latencysentinel.Visitor;

/**
 * An isolation tree over a set of scalar values. The tree is grown top down:
 * at each node a split value is drawn uniformly between the smallest and the
 * largest value at the node, values strictly less than the split go to the left
 * child and the remaining values go to the right child. A node becomes a leaf
 * when it holds at most one value, when all of its values are equal, or when it
 * reaches the maximum depth.
 *
 * <p>
 * Values that are far from the bulk of the data get separated after few cuts,
 * so they end up in shallow leaves. Trees are immutable once built.
 * </p>
 */
public class IsolationTree {

    private final Node root;
    private final int maxDepth;

    protected IsolationTree(Node root, int maxDepth) {
        this.root = root;
        this.maxDepth = maxDepth;
    }

    /**
     * @return a new IsolationTree builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Route a value from the root to a leaf, submitting every node on the way to
     * the visitor. Internal nodes are passed to {@link Visitor#accept} from the
     * root downwards and the leaf is passed to {@link Visitor#acceptLeaf} last.
     * The root has depth 0.
     *
     * @param point   the value to route
     * @param visitor the visitor collecting the result
     * @param <R>     the result type of the visitor
     * @return the result of the visitor after the traversal
     */
    public <R> R traverse(double point, Visitor<R> visitor) {
        checkNotNull(visitor, "visitor must not be null");
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            visitor.accept(node, depth);
            node = node.childFor(point);
            depth++;
        }
        visitor.acceptLeaf(node, depth);
        return visitor.getResult();
    }

    /**
     * @return the number of values the tree was grown on.
     */
    public int getMass() {
        return root.getMass();
    }

    /**
     * @return the depth at which growth stops regardless of the leaf mass.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    public INodeView getRoot() {
        return root;
    }

    public static class Builder {

        private Optional<Integer> maxDepth = Optional.empty();
        private Random random;

        /**
         * Sets the height limit. When not set the limit is ceil(log2(n)) for a
         * tree grown on n values.
         *
         * @param maxDepth the maximum depth of a leaf
         * @return this builder
         */
        public Builder maxDepth(int maxDepth) {
            this.maxDepth = Optional.of(maxDepth);
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        /**
         * Grow a tree over the given values. The array is not modified.
         *
         * @param points the values to partition, at least one
         * @return the new tree
         */
        public IsolationTree build(double[] points) {
            checkNotNull(points, "points must not be null");
            checkArgument(points.length > 0, "points must not be empty");
            checkNotNull(random, "random must not be null");
            for (double point : points) {
                checkFinite(point, "points must be finite numbers");
            }
            int limit = maxDepth.orElse(CommonUtils.maxDepth(points.length));
            checkArgument(limit >= 0, "maxDepth must be non-negative");

            double[] workspace = Arrays.copyOf(points, points.length);
            Node root = grow(workspace, 0, workspace.length, 0, limit);
            return new IsolationTree(root, limit);
        }

        /**
         * Grow the subtree over workspace[begin, end). The range is partitioned in
         * place so that each child owns a contiguous range.
         */
        private Node grow(double[] workspace, int begin, int end, int depth, int limit) {
            int mass = end - begin;
            if (mass <= 1 || depth >= limit) {
                return Node.leaf(mass);
            }

            double min = workspace[begin];
            double max = workspace[begin];
            for (int i = begin + 1; i < end; i++) {
                min = Math.min(min, workspace[i]);
                max = Math.max(max, workspace[i]);
            }
            if (min >= max) {
                // duplicates cannot be separated
                return Node.leaf(mass);
            }

            Cut cut = new Cut(drawSplit(min, max));
            int split = partition(workspace, begin, end, cut);
            Node left = grow(workspace, begin, split, depth + 1, limit);
            Node right = grow(workspace, split, end, depth + 1, limit);
            return Node.internal(cut, left, right);
        }

        /**
         * Draw a split value in (min, max]. Both sides of the resulting cut hold at
         * least one value because min is left of it and max is not.
         */
        private double drawSplit(double min, double max) {
            double value = min + random.nextDouble() * (max - min);
            if (value <= min) {
                value = Math.nextUp(min);
            }
            return Math.min(value, max);
        }

        private static int partition(double[] workspace, int begin, int end, Cut cut) {
            int split = begin;
            for (int i = begin; i < end; i++) {
                if (Cut.isLeftOf(workspace[i], cut)) {
                    double tmp = workspace[split];
                    workspace[split] = workspace[i];
                    workspace[i] = tmp;
                    split++;
                }
            }
            return split;
        }
    }
}
