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

import java.util.Objects;

/**
 * A collection of common utility functions.
 */
public class CommonUtils {

    /**
     * Euler-Mascheroni constant, used to approximate harmonic numbers.
     */
    public static final double EULER_CONSTANT = 0.5772156649;

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Throws an {@link IllegalArgumentException} if the value is NaN or infinite.
     *
     * @param value   the value to test
     * @param message the error message
     */
    public static void checkFinite(double value, String message) {
        checkArgument(Double.isFinite(value), message);
    }

    /**
     * The average path length of an unsuccessful search in a binary search tree
     * built over {@code n} points. This is the normalizing constant c(n) of the
     * isolation forest, and also the correction added at a leaf that still holds
     * {@code n} points.
     *
     * @param n the number of points
     * @return c(n), which is 0 for n at most 1
     */
    public static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_CONSTANT;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    /**
     * The height limit of a tree grown on a subsample of the given size, that is
     * ceil(log2(sampleSize)).
     *
     * @param sampleSize the number of points the tree is grown on
     * @return the maximum depth of a leaf
     */
    public static int maxDepth(int sampleSize) {
        checkArgument(sampleSize > 0, "sampleSize must be greater than 0");
        // exact for powers of two, unlike Math.log based rounding
        return 32 - Integer.numberOfLeadingZeros(sampleSize - 1);
    }

    /**
     * Turns an average path length into an anomaly score in (0, 1].
     *
     * @param averagePathLength the path length averaged over all trees
     * @param sampleSize        the number of points each tree was grown on
     * @return 2^(-averagePathLength / c(sampleSize))
     */
    public static double normalizeScore(double averagePathLength, int sampleSize) {
        double normalizer = averagePathLength(sampleSize);
        if (normalizer <= 0) {
            // a single point cannot be separated from anything
            return 1.0;
        }
        return Math.pow(2.0, -averagePathLength / normalizer);
    }
}
