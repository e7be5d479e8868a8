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

import static com.amazon.latencysentinel.CommonUtils.checkNotNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.latencysentinel.StreamingDetector;
import com.amazon.latencysentinel.agent.probe.HttpLatencyProbe;
import com.amazon.latencysentinel.agent.probe.PenaltyPolicy;
import com.amazon.latencysentinel.config.DetectorConfig;
import com.amazon.latencysentinel.config.InvalidConfigurationException;

/**
 * Entry point of the monitoring agent. Probes the target endpoint until the
 * process is stopped.
 */
public class LatencySentinelAgent {

    private static final Logger log = LoggerFactory.getLogger(LatencySentinelAgent.class);

    private final AgentArgumentParser arguments;
    private final LatencyMonitor monitor;

    public LatencySentinelAgent(AgentArgumentParser arguments) {
        this.arguments = checkNotNull(arguments, "arguments must not be null");
        DetectorConfig config = arguments.getDetectorConfig();
        monitor = new LatencyMonitor(new HttpLatencyProbe(arguments.getTargetUrl(), arguments.getTimeoutMs()),
                new PenaltyPolicy(arguments.getPenaltyLatencyMs()), new StreamingDetector(config),
                new VerdictReporter(), arguments.getPollIntervalMs());
    }

    public static void main(String... args) {
        AgentArgumentParser parser = new AgentArgumentParser();
        parser.parse(args);

        LatencySentinelAgent agent;
        try {
            agent = new LatencySentinelAgent(parser);
        } catch (InvalidConfigurationException e) {
            parser.printUsageAndExit("%s", e.getMessage());
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(agent::stop, "latency-sentinel-shutdown"));
        agent.start();
    }

    public void start() {
        log.info("Latency sentinel started. Monitoring {} every {} ms with {}", arguments.getTargetUrl(),
                arguments.getPollIntervalMs(), arguments.getDetectorConfig());
        monitor.start();
    }

    public void stop() {
        monitor.stop();
        log.info("Latency sentinel stopped");
    }

    public LatencyMonitor getMonitor() {
        return monitor;
    }
}
