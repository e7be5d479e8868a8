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

import static com.amazon.latencysentinel.CommonUtils.checkNotNull;

import java.util.Optional;

import com.amazon.latencysentinel.buffer.SlidingWindowBuffer;
import com.amazon.latencysentinel.config.DetectorConfig;
import com.amazon.latencysentinel.returntypes.Verdict;

/**
 * Binds a sliding window to a detector. Each processed sample is pushed into
 * the window and, once the window holds at least {@code minPoints} samples,
 * classified against the window contents, which include the sample itself.
 *
 * <p>
 * Not thread safe. The window has a single writer, the caller of
 * {@link #process}.
 * </p>
 */
public class StreamingDetector {

    private final DetectorConfig config;
    private final SlidingWindowBuffer buffer;
    private final IsolationForestDetector detector;

    public StreamingDetector(DetectorConfig config) {
        this(config, new IsolationForestDetector(config));
    }

    public StreamingDetector(DetectorConfig config, IsolationForestDetector detector) {
        this.config = checkNotNull(config, "config must not be null");
        this.detector = checkNotNull(detector, "detector must not be null");
        buffer = new SlidingWindowBuffer(config.getWindowCapacity());
    }

    /**
     * Push a sample and classify it if enough history is available.
     *
     * @param sample the new sample
     * @return the verdict for the sample, or empty while the window holds fewer
     *         than {@code minPoints} samples
     */
    public Optional<Verdict> process(double sample) {
        buffer.push(sample);
        if (buffer.size() < config.getMinPoints()) {
            return Optional.empty();
        }
        return Optional.of(detector.classify(buffer.contents(), sample));
    }

    /**
     * @return true once the window holds enough samples to classify.
     */
    public boolean isReady() {
        return buffer.size() >= config.getMinPoints();
    }

    public SlidingWindowBuffer getBuffer() {
        return buffer;
    }

    public DetectorConfig getConfig() {
        return config;
    }
}
