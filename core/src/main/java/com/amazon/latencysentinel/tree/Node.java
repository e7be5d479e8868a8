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
import static com.amazon.latencysentinel.CommonUtils.checkNotNull;
import static com.amazon.latencysentinel.CommonUtils.checkState;

/**
 * A node in an {@link IsolationTree}. Internal nodes hold a cut and two
 * children; leaves only hold the mass of points that ended partitioning there.
 * Nodes are immutable.
 */
public class Node implements INodeView {

    private final Cut cut;
    private final Node leftChild;
    private final Node rightChild;
    private final int mass;

    private Node(Cut cut, Node leftChild, Node rightChild, int mass) {
        this.cut = cut;
        this.leftChild = leftChild;
        this.rightChild = rightChild;
        this.mass = mass;
    }

    /**
     * Create a leaf holding the given number of points.
     *
     * @param mass the number of points that reached the leaf
     * @return a new leaf node
     */
    public static Node leaf(int mass) {
        checkArgument(mass >= 0, "mass must be non-negative");
        return new Node(null, null, null, mass);
    }

    /**
     * Create an internal node. Its mass is the sum of its children's masses.
     *
     * @param cut        the cut separating the children
     * @param leftChild  the subtree of values strictly less than the cut value
     * @param rightChild the subtree of values greater than or equal to the cut
     *                   value
     * @return a new internal node
     */
    public static Node internal(Cut cut, Node leftChild, Node rightChild) {
        checkNotNull(cut, "cut must not be null");
        checkNotNull(leftChild, "leftChild must not be null");
        checkNotNull(rightChild, "rightChild must not be null");
        return new Node(cut, leftChild, rightChild, leftChild.getMass() + rightChild.getMass());
    }

    @Override
    public boolean isLeaf() {
        return cut == null;
    }

    @Override
    public int getMass() {
        return mass;
    }

    @Override
    public Cut getCut() {
        checkState(!isLeaf(), "a leaf has no cut");
        return cut;
    }

    public Node getLeftChild() {
        return leftChild;
    }

    public Node getRightChild() {
        return rightChild;
    }

    /**
     * @param point a value being routed through this internal node
     * @return the child the value descends into
     */
    Node childFor(double point) {
        return Cut.isLeftOf(point, cut) ? leftChild : rightChild;
    }
}
