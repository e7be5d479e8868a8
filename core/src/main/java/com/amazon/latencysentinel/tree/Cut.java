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
 * A Cut divides the number line into two half-lines at a split value. Cuts
 * define the structure of an {@link IsolationTree} and determine the traversal
 * path of {@link IsolationTree#traverse}. The signal is one-dimensional, so a
 * cut carries no dimension index.
 */
public class Cut {

    private final double value;

    /**
     * Create a new Cut at the given value.
     *
     * @param value The split value of the cut.
     */
    public Cut(double value) {
        this.value = value;
    }

    /**
     * Tests on which side of the cut a value falls. Values strictly less than the
     * cut value are to the left; values greater than or equal to it are to the
     * right. Tree construction and traversal both use this rule.
     *
     * @param point A value that we are testing in relation to the cut
     * @param cut   A Cut instance.
     * @return true if the value is strictly less than the cut value, false
     *         otherwise.
     */
    public static boolean isLeftOf(double point, Cut cut) {
        return point < cut.getValue();
    }

    /**
     * @return the split value of the cut.
     */
    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("Cut(%f)", value);
    }
}
