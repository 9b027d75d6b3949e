package dev.mars.retryflow.retry;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters of a retry output, tagged with the output name.
 */
public class RetryMetrics implements MeterBinder {

    public static final String RUNNING = "retryflow.retry.running";
    public static final String RECEIVED = "retryflow.retry.received";
    public static final String SEND_SUCCESS = "retryflow.retry.send.success";
    public static final String PARTS_SEND_SUCCESS = "retryflow.retry.parts.send.success";
    public static final String SEND_ERROR = "retryflow.retry.send.error";
    public static final String END_OF_RETRIES = "retryflow.retry.end_of_retries";

    private final String outputName;
    private final AtomicInteger running = new AtomicInteger(0);

    private Counter received;
    private Counter sendSuccess;
    private Counter partsSendSuccess;
    private Counter sendError;
    private Counter endOfRetries;

    public RetryMetrics(String outputName) {
        this.outputName = outputName;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder(RUNNING, running, AtomicInteger::get)
            .description("Number of running retry coordinators")
            .tag("output", outputName)
            .register(registry);

        received = Counter.builder(RECEIVED)
            .description("Transactions pulled from the input")
            .tag("output", outputName)
            .register(registry);

        sendSuccess = Counter.builder(SEND_SUCCESS)
            .description("Transactions acknowledged by the wrapped output")
            .tag("output", outputName)
            .register(registry);

        partsSendSuccess = Counter.builder(PARTS_SEND_SUCCESS)
            .description("Messages within acknowledged transactions")
            .tag("output", outputName)
            .register(registry);

        sendError = Counter.builder(SEND_ERROR)
            .description("Failed delivery attempts")
            .tag("output", outputName)
            .register(registry);

        endOfRetries = Counter.builder(END_OF_RETRIES)
            .description("Transactions given up on after exhausting the retry budget")
            .tag("output", outputName)
            .register(registry);
    }

    void started() {
        running.incrementAndGet();
    }

    void stopped() {
        running.decrementAndGet();
    }

    void recordReceived() {
        received.increment();
    }

    void recordSendSuccess(int parts) {
        sendSuccess.increment();
        partsSendSuccess.increment(parts);
    }

    void recordSendError() {
        sendError.increment();
    }

    void recordEndOfRetries() {
        endOfRetries.increment();
    }
}
