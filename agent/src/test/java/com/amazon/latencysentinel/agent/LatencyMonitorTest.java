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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.latencysentinel.StreamingDetector;
import com.amazon.latencysentinel.agent.probe.LatencyProbe;
import com.amazon.latencysentinel.agent.probe.PenaltyPolicy;
import com.amazon.latencysentinel.agent.probe.ProbeResult;
import com.amazon.latencysentinel.agent.probe.ProbeResult.FailureType;
import com.amazon.latencysentinel.config.DetectorConfig;
import com.amazon.latencysentinel.returntypes.Verdict;

@ExtendWith(MockitoExtension.class)
public class LatencyMonitorTest {

    @Mock
    private LatencyProbe probe;

    @Mock
    private VerdictReporter reporter;

    @Mock
    private ScheduledExecutorService scheduler;

    @Captor
    private ArgumentCaptor<Runnable> task;

    private StreamingDetector detector;
    private LatencyMonitor monitor;

    @BeforeEach
    public void setUp() {
        detector = new StreamingDetector(
                DetectorConfig.builder().windowCapacity(5).minPoints(2).numberOfTrees(10).build());
        monitor = new LatencyMonitor(probe, new PenaltyPolicy(), detector, reporter, 5000L, scheduler);
    }

    @Test
    public void testTickFeedsDetectorAndReports() {
        when(probe.probe()).thenReturn(ProbeResult.success(12.0));

        assertEquals(Optional.empty(), monitor.tick());
        verify(reporter).report(12.0, Optional.empty(), 1, 2);

        Optional<Verdict> verdict = monitor.tick();
        assertTrue(verdict.isPresent());
        assertFalse(verdict.get().isAnomaly());
        verify(reporter).report(12.0, verdict, 2, 2);
    }

    @Test
    public void testFailedProbeRecordsPenalty() {
        when(probe.probe()).thenReturn(ProbeResult.failure(FailureType.TIMEOUT, "request timed out"));

        monitor.tick();
        assertEquals(PenaltyPolicy.DEFAULT_PENALTY_LATENCY_MS, detector.getBuffer().latest());
        verify(reporter).report(2000.0, Optional.empty(), 1, 2);
    }

    @Test
    public void testStartSchedulesWithFixedDelay() {
        assertFalse(monitor.isStarted());
        monitor.start();
        assertTrue(monitor.isStarted());

        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(0L), eq(5000L), eq(TimeUnit.MILLISECONDS));
        assertThrows(IllegalStateException.class, () -> monitor.start());
        assertEquals(5000L, monitor.getPollIntervalMs());
    }

    @Test
    public void testFailingTickDoesNotStopSchedule() {
        monitor.start();
        verify(scheduler).scheduleWithFixedDelay(task.capture(), anyLong(), anyLong(), any(TimeUnit.class));

        when(probe.probe()).thenThrow(new IllegalStateException("probe broken"))
                .thenReturn(ProbeResult.success(10.0));
        task.getValue().run();
        verify(reporter, never()).report(anyDouble(), any(), anyInt(), anyInt());

        task.getValue().run();
        verify(reporter).report(10.0, Optional.empty(), 1, 2);
    }

    @Test
    public void testStop() throws InterruptedException {
        when(scheduler.awaitTermination(anyLong(), any(TimeUnit.class))).thenReturn(true);
        monitor.stop();
        verify(scheduler).shutdown();
        verify(scheduler, never()).shutdownNow();
    }

    @Test
    public void testStopInterruptsSlowTick() throws InterruptedException {
        when(scheduler.awaitTermination(anyLong(), any(TimeUnit.class))).thenReturn(false);
        monitor.stop();
        verify(scheduler).shutdownNow();
    }

    @Test
    public void testScheduledTicksRun() throws InterruptedException {
        CountDownLatch ticks = new CountDownLatch(3);
        when(probe.probe()).thenAnswer(invocation -> {
            ticks.countDown();
            return ProbeResult.success(10.0);
        });

        LatencyMonitor running = new LatencyMonitor(probe, new PenaltyPolicy(), detector, reporter, 10L);
        running.start();
        try {
            assertTrue(ticks.await(10, TimeUnit.SECONDS));
        } finally {
            running.stop();
        }
        verify(reporter, times(1)).report(10.0, Optional.empty(), 1, 2);
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> new LatencyMonitor(probe, new PenaltyPolicy(), detector, reporter, 0L, scheduler));
        assertThrows(NullPointerException.class,
                () -> new LatencyMonitor(null, new PenaltyPolicy(), detector, reporter, 10L, scheduler));
    }
}
