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
import static com.amazon.latencysentinel.CommonUtils.checkNotNull;
import static com.amazon.latencysentinel.CommonUtils.checkState;

import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.latencysentinel.StreamingDetector;
import com.amazon.latencysentinel.agent.probe.LatencyProbe;
import com.amazon.latencysentinel.agent.probe.PenaltyPolicy;
import com.amazon.latencysentinel.agent.probe.ProbeResult;
import com.amazon.latencysentinel.returntypes.Verdict;

/**
 * Drives the probe, detect and report loop. Each tick probes the endpoint once,
 * substitutes the penalty latency for a failed probe, feeds the latency to the
 * streaming detector and reports the outcome. Ticks run on a single thread with
 * a fixed delay between the end of one tick and the start of the next.
 */
public class LatencyMonitor {

    private static final Logger log = LoggerFactory.getLogger(LatencyMonitor.class);

    public static final long DEFAULT_POLL_INTERVAL_MS = 5000L;

    private static final long SHUTDOWN_TIMEOUT_MS = 10_000L;

    private final LatencyProbe probe;
    private final PenaltyPolicy penaltyPolicy;
    private final StreamingDetector detector;
    private final VerdictReporter reporter;
    private final long pollIntervalMs;
    private final ScheduledExecutorService scheduler;
    private boolean started;

    public LatencyMonitor(LatencyProbe probe, PenaltyPolicy penaltyPolicy, StreamingDetector detector,
            VerdictReporter reporter, long pollIntervalMs) {
        this(probe, penaltyPolicy, detector, reporter, pollIntervalMs,
                Executors.newSingleThreadScheduledExecutor(runnable -> new Thread(runnable, "latency-monitor")));
    }

    LatencyMonitor(LatencyProbe probe, PenaltyPolicy penaltyPolicy, StreamingDetector detector,
            VerdictReporter reporter, long pollIntervalMs, ScheduledExecutorService scheduler) {
        checkArgument(pollIntervalMs > 0, "pollIntervalMs must be greater than 0");
        this.probe = checkNotNull(probe, "probe must not be null");
        this.penaltyPolicy = checkNotNull(penaltyPolicy, "penaltyPolicy must not be null");
        this.detector = checkNotNull(detector, "detector must not be null");
        this.reporter = checkNotNull(reporter, "reporter must not be null");
        this.scheduler = checkNotNull(scheduler, "scheduler must not be null");
        this.pollIntervalMs = pollIntervalMs;
        started = false;
    }

    /**
     * Schedule ticks, the first one immediately.
     */
    public synchronized void start() {
        checkState(!started, "monitor has already been started");
        scheduler.scheduleWithFixedDelay(this::runTick, 0L, pollIntervalMs, TimeUnit.MILLISECONDS);
        started = true;
    }

    /**
     * Stop scheduling ticks and wait for a running tick to finish.
     */
    public synchronized void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("monitor did not stop within {} ms, interrupting the running tick", SHUTDOWN_TIMEOUT_MS);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Run one probe, detect and report cycle.
     *
     * @return the verdict for the probed latency, empty while warming up
     */
    public Optional<Verdict> tick() {
        ProbeResult result = probe.probe();
        if (!result.isSuccess()) {
            log.warn("probe failed with {} ({}), recording a penalty latency of {} ms",
                    result.getFailureType().get(), result.getMessage().orElse("no message"),
                    penaltyPolicy.getPenaltyLatencyMs());
        }

        double latencyMs = penaltyPolicy.apply(result);
        Optional<Verdict> verdict = detector.process(latencyMs);
        reporter.report(latencyMs, verdict, detector.getBuffer().size(), detector.getConfig().getMinPoints());
        return verdict;
    }

    void runTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // an exception escaping the scheduled task would cancel all later ticks
            log.error("monitoring tick failed, continuing with the next one", e);
        }
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public synchronized boolean isStarted() {
        return started;
    }
}
