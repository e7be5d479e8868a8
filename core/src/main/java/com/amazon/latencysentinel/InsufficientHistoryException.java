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

/**
 * Raised when a detector is asked to classify a sample against fewer history
 * points than it is configured to require. Callers are expected to gate on the
 * history size before classifying.
 */
public class InsufficientHistoryException extends IllegalArgumentException {

    private final int historySize;
    private final int minPoints;

    public InsufficientHistoryException(int historySize, int minPoints) {
        super(String.format("history holds %d points but at least %d are required", historySize, minPoints));
        this.historySize = historySize;
        this.minPoints = minPoints;
    }

    public int getHistorySize() {
        return historySize;
    }

    public int getMinPoints() {
        return minPoints;
    }
}
