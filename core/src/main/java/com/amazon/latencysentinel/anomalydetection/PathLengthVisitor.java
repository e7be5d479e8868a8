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

package com.amazon.latencysentinel.anomalydetection;

import static com.amazon.latencysentinel.CommonUtils.averagePathLength;

import com.amazon.latencysentinel.Visitor;
import com.amazon.latencysentinel.tree.INodeView;

/**
 * Computes the path length h(x) of a value in one isolation tree: the number of
 * internal nodes on the path from the root to the leaf, plus the expected
 * remaining path length c(mass) of the points still held by the leaf.
 */
public class PathLengthVisitor implements Visitor<Double> {

    private int internalNodes;
    private double pathLength;
    private boolean leafReached;

    public PathLengthVisitor() {
        internalNodes = 0;
        pathLength = 0.0;
        leafReached = false;
    }

    @Override
    public void accept(INodeView node, int depthOfNode) {
        internalNodes++;
    }

    @Override
    public void acceptLeaf(INodeView leafNode, int depthOfNode) {
        leafReached = true;
        pathLength = internalNodes + averagePathLength(leafNode.getMass());
    }

    /**
     * @return the path length, or the internal node count if the traversal has not
     *         reached a leaf yet.
     */
    @Override
    public Double getResult() {
        return leafReached ? pathLength : internalNodes;
    }
}
