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

package com.amazon.latencysentinel.buffer;

import static com.amazon.latencysentinel.CommonUtils.checkFinite;
import static com.amazon.latencysentinel.CommonUtils.checkState;
import static com.amazon.latencysentinel.config.InvalidConfigurationException.checkConfiguration;

/**
 * A fixed-capacity FIFO window over the most recent scalar samples. New samples
 * are appended at the end and, once the window is full, each push evicts the
 * oldest sample. For example, with a capacity of 4 the window evolves as
 * follows when e and f are pushed:
 *
 * <pre>
 *     abcd => bcde
 *     bcde => cdef
 * </pre>
 *
 * Samples are stored in a circular array, so a push never moves existing
 * values. The buffer expects one writer and one reader per tick and performs
 * no synchronization.
 */
public class SlidingWindowBuffer {

    /**
     * Maximum number of samples retained.
     */
    private final int capacity;

    /**
     * Circular storage for the samples.
     */
    private final double[] values;

    /**
     * The index where the next sample will be written. Once the window is full
     * this is also the index of the oldest sample.
     */
    private int nextIndex;

    /**
     * Number of samples currently retained.
     */
    private int size;

    /**
     * Create a new empty buffer.
     *
     * @param capacity the maximum number of samples to retain, at least 1
     */
    public SlidingWindowBuffer(int capacity) {
        checkConfiguration(capacity > 0, "capacity must be greater than 0");
        this.capacity = capacity;
        values = new double[capacity];
        nextIndex = 0;
        size = 0;
    }

    /**
     * Append a sample, evicting the oldest one if the buffer is already full.
     *
     * @param value the new sample
     */
    public void push(double value) {
        checkFinite(value, "value must be a finite number");
        values[nextIndex] = value;
        nextIndex = (nextIndex + 1) % capacity;
        if (size < capacity) {
            size++;
        }
    }

    /**
     * @return a copy of the retained samples in arrival order, oldest first.
     */
    public double[] contents() {
        double[] result = new double[size];
        int beginIndex = (size < capacity) ? 0 : nextIndex;
        for (int i = 0; i < size; i++) {
            result[i] = values[(beginIndex + i) % capacity];
        }
        return result;
    }

    /**
     * @return the number of samples currently retained.
     */
    public int size() {
        return size;
    }

    /**
     * @return the maximum number of samples retained.
     */
    public int capacity() {
        return capacity;
    }

    /**
     * @return true if the next push will evict a sample.
     */
    public boolean isFull() {
        return size == capacity;
    }

    /**
     * @return the most recently pushed sample.
     * @throws IllegalStateException if the buffer is empty
     */
    public double latest() {
        checkState(size > 0, "buffer is empty");
        return values[(nextIndex - 1 + capacity) % capacity];
    }

    /**
     * Remove every sample.
     */
    public void clear() {
        nextIndex = 0;
        size = 0;
    }
}
