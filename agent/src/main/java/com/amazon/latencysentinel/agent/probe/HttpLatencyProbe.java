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

package com.amazon.latencysentinel.agent.probe;

import static com.amazon.latencysentinel.CommonUtils.checkArgument;
import static com.amazon.latencysentinel.CommonUtils.checkNotNull;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.latencysentinel.agent.probe.ProbeResult.FailureType;

/**
 * Times a GET request against a fixed URI. The response status is not
 * inspected: any response counts as a completed round trip, and only timeouts
 * and transport errors are failures.
 */
public class HttpLatencyProbe implements LatencyProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpLatencyProbe.class);

    public static final long DEFAULT_TIMEOUT_MS = 2000L;

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final HttpClient httpClient;
    private final HttpRequest request;
    private final LongSupplier nanoClock;

    public HttpLatencyProbe(URI target, long timeoutMs) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofMillis(timeoutMs)).build(), target, timeoutMs,
                System::nanoTime);
    }

    HttpLatencyProbe(HttpClient httpClient, URI target, long timeoutMs, LongSupplier nanoClock) {
        checkArgument(timeoutMs > 0, "timeoutMs must be greater than 0");
        this.httpClient = checkNotNull(httpClient, "httpClient must not be null");
        this.nanoClock = checkNotNull(nanoClock, "nanoClock must not be null");
        request = HttpRequest.newBuilder().uri(checkNotNull(target, "target must not be null"))
                .timeout(Duration.ofMillis(timeoutMs)).GET().build();
    }

    @Override
    public ProbeResult probe() {
        long start = nanoClock.getAsLong();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            double latencyMs = (nanoClock.getAsLong() - start) / NANOS_PER_MILLI;
            log.trace("GET {} returned {} after {} ms", request.uri(), response.statusCode(), latencyMs);
            return ProbeResult.success(latencyMs);
        } catch (HttpTimeoutException e) {
            return ProbeResult.failure(FailureType.TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return ProbeResult.failure(FailureType.CONNECTION_FAILURE, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.failure(FailureType.CONNECTION_FAILURE, "interrupted while waiting for a response");
        }
    }

    public URI getTarget() {
        return request.uri();
    }
}
