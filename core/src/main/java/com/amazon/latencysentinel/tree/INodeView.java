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

/**
 * A read-only view of a node in an {@link IsolationTree}, as presented to a
 * {@link com.amazon.latencysentinel.Visitor}.
 */
public interface INodeView {

    /**
     * @return true if the node is a leaf, false if it is an internal node.
     */
    boolean isLeaf();

    /**
     * @return the number of points of the subsample that reached this node.
     */
    int getMass();

    /**
     * @return the cut of an internal node.
     * @throws IllegalStateException if the node is a leaf
     */
    Cut getCut();
}
