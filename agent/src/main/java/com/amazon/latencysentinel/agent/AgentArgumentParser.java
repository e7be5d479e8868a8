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

package com.amazon.latencysentinel.agent;

import static com.amazon.latencysentinel.CommonUtils.checkArgument;

import java.net.URI;
import java.util.Locale;

import com.amazon.latencysentinel.agent.probe.HttpLatencyProbe;
import com.amazon.latencysentinel.agent.probe.PenaltyPolicy;
import com.amazon.latencysentinel.runner.ArgumentParser;

/**
 * Command-line arguments of the monitoring agent: the detector options of the
 * replay runner plus the probe and schedule options. The options that describe
 * delimited input do not apply to the agent and are removed.
 */
public class AgentArgumentParser extends ArgumentParser {

    public static final String ARCHIVE_NAME = "target/latency-sentinel-agent-1.0.0.jar";
    public static final String DEFAULT_TARGET_URL = "http://backend-service:80";

    private final StringArgument targetUrl;
    private final LongArgument timeoutMs;
    private final LongArgument pollIntervalMs;
    private final DoubleArgument penaltyLatencyMs;

    public AgentArgumentParser() {
        super(LatencySentinelAgent.class.getName(),
                "Probe an HTTP endpoint at a fixed interval and log whether each latency is anomalous.");

        removeArgument("--delimiter");
        removeArgument("--header-row");
        removeArgument("--value-column");

        targetUrl = new StringArgument("-u", "--target-url", "The endpoint probed with GET requests.",
                DEFAULT_TARGET_URL, AgentArgumentParser::validateUrl);

        addArgument(targetUrl);

        timeoutMs = new LongArgument(null, "--timeout-ms",
                "Milliseconds to wait for a response before the probe counts as failed.",
                HttpLatencyProbe.DEFAULT_TIMEOUT_MS, n -> checkArgument(n > 0, "timeout should be greater than 0"));

        addArgument(timeoutMs);

        pollIntervalMs = new LongArgument(null, "--poll-interval-ms",
                "Milliseconds between the end of one probe and the start of the next.",
                LatencyMonitor.DEFAULT_POLL_INTERVAL_MS,
                n -> checkArgument(n > 0, "poll interval should be greater than 0"));

        addArgument(pollIntervalMs);

        penaltyLatencyMs = new DoubleArgument(null, "--penalty-latency-ms",
                "Latency recorded in milliseconds when a probe fails.", PenaltyPolicy.DEFAULT_PENALTY_LATENCY_MS,
                x -> checkArgument(x >= 0.0, "penalty latency should be non-negative"));

        addArgument(penaltyLatencyMs);
    }

    private static void validateUrl(String url) {
        String scheme = URI.create(url).getScheme();
        checkArgument(scheme != null && scheme.toLowerCase(Locale.ROOT).startsWith("http"),
                "target url should use http or https");
    }

    @Override
    protected String getUsage() {
        return String.format("java -jar %s [options]", ARCHIVE_NAME);
    }

    /**
     * @return the user-specified value of the target-url parameter
     */
    public URI getTargetUrl() {
        return URI.create(targetUrl.getValue());
    }

    /**
     * @return the user-specified value of the timeout-ms parameter
     */
    public long getTimeoutMs() {
        return timeoutMs.getValue();
    }

    /**
     * @return the user-specified value of the poll-interval-ms parameter
     */
    public long getPollIntervalMs() {
        return pollIntervalMs.getValue();
    }

    /**
     * @return the user-specified value of the penalty-latency-ms parameter
     */
    public double getPenaltyLatencyMs() {
        return penaltyLatencyMs.getValue();
    }
}
