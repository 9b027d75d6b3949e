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

import dev.mars.retryflow.api.backoff.Backoff;
import dev.mars.retryflow.api.backoff.BackoffPolicy;
import dev.mars.retryflow.api.transaction.ChannelClosedException;
import dev.mars.retryflow.api.transaction.Response;
import dev.mars.retryflow.api.transaction.Transaction;
import dev.mars.retryflow.api.transaction.TransactionChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns one upstream transaction from its first delivery attempt until a terminal outcome.
 *
 * <p>Each attempt is a fresh transaction carrying the original payload, so every response
 * destination is written at most once. While the worker is retrying it holds one count on the
 * shared error loop counter, which keeps the coordinator from pulling new input.</p>
 */
class RetryWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(RetryWorker.class);

    private final String outputName;
    private final Transaction original;
    private final Transaction firstAttempt;
    private final TransactionChannel attempts;
    private final BackoffPolicy backoffPolicy;
    private final RetryMetrics metrics;
    private final RetryLifecycle lifecycle;
    private final AtomicInteger errorLoops;

    private boolean inErrorLoop;

    RetryWorker(String outputName, Transaction original, Transaction firstAttempt, TransactionChannel attempts,
                BackoffPolicy backoffPolicy, RetryMetrics metrics, RetryLifecycle lifecycle, AtomicInteger errorLoops) {
        this.outputName = outputName;
        this.original = original;
        this.firstAttempt = firstAttempt;
        this.attempts = attempts;
        this.backoffPolicy = backoffPolicy;
        this.metrics = metrics;
        this.lifecycle = lifecycle;
        this.errorLoops = errorLoops;
    }

    @Override
    public void run() {
        Response outcome = null;
        try {
            outcome = deliver();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Retry worker for transaction {} cancelled", original.getId());
        } catch (ChannelClosedException e) {
            logger.debug("Retry output '{}' stopped accepting attempts for transaction {}", outputName, original.getId());
        } finally {
            leaveErrorLoop();
        }

        if (outcome != null) {
            try {
                original.respond(outcome);
            } catch (IllegalStateException e) {
                logger.error("Transaction {} was already answered", original.getId(), e);
            }
        }
    }

    /**
     * @return the terminal outcome, or null if shutdown preempted it
     */
    private Response deliver() throws InterruptedException, ChannelClosedException {
        Transaction attempt = firstAttempt;
        Backoff backoff = null;

        while (true) {
            Response response = attempt.awaitResponse();
            if (response.isAcknowledged()) {
                metrics.recordSendSuccess(original.getPayload().size());
                return Response.ack();
            }

            if (!inErrorLoop) {
                inErrorLoop = true;
                errorLoops.incrementAndGet();
            }
            metrics.recordSendError();
            logger.error("Failed to send message to '{}': {}", outputName, describe(response));

            if (backoff == null) {
                backoff = backoffPolicy.newBackoff();
            }
            Optional<Duration> interval = backoff.nextInterval();
            if (interval.isEmpty()) {
                metrics.recordEndOfRetries();
                logger.warn("Giving up on transaction {} in '{}' after exhausting retries", original.getId(), outputName);
                return Response.noack();
            }

            logger.debug("Retrying transaction {} in {}", original.getId(), interval.get());
            if (lifecycle.awaitClose(interval.get())) {
                return null;
            }

            attempt = new Transaction(original.getPayload());
            attempts.send(attempt);
        }
    }

    private void leaveErrorLoop() {
        if (inErrorLoop) {
            inErrorLoop = false;
            errorLoops.decrementAndGet();
            lifecycle.notifyErrorLoopExit();
        }
    }

    private static String describe(Response response) {
        Throwable error = response.getError();
        if (error == null) {
            return String.valueOf(response.getStatus());
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
