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

import dev.mars.retryflow.api.backoff.BackoffPolicy;
import dev.mars.retryflow.api.error.AlreadyStartedException;
import dev.mars.retryflow.api.output.Output;
import dev.mars.retryflow.api.transaction.ChannelClosedException;
import dev.mars.retryflow.api.transaction.Transaction;
import dev.mars.retryflow.api.transaction.TransactionChannel;
import dev.mars.retryflow.core.backoff.ExponentialBackoffPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Output that wraps another output and retries failed deliveries with backoff until they are
 * acknowledged or the retry budget runs out.
 *
 * <p>A single coordinator thread pulls transactions from the input, hands a fresh attempt of
 * each to the wrapped output and starts a {@link RetryWorker} that owns the transaction from
 * then on. While any worker is retrying, the coordinator stops pulling new input, so a
 * failing target is not flooded with fresh work.</p>
 *
 * <p>Ending the input drains the in-flight workers and then closes the wrapped output.
 * {@link #closeAsync()} cancels everything in flight instead; cancelled transactions receive
 * no response.</p>
 */
public class RetryOutput implements Output {

    private static final Logger logger = LoggerFactory.getLogger(RetryOutput.class);

    private final String name;
    private final Output child;
    private final RetryOutputConfig config;
    private final BackoffPolicy backoffPolicy;
    private final RetryMetrics metrics;
    private final RetryLifecycle lifecycle;

    private final AtomicReference<TransactionChannel> transactionsIn = new AtomicReference<>();
    private final TransactionChannel transactionsOut;
    private final AtomicInteger errorLoops = new AtomicInteger(0);
    private final ExecutorService workerExecutor;

    private final Object startLock = new Object();
    private Thread coordinator;

    public RetryOutput(RetryOutputConfig config, Output child, MeterRegistry meterRegistry) {
        this(config, child, new ExponentialBackoffPolicy(config.getBackoffConfig()), meterRegistry);
    }

    public RetryOutput(RetryOutputConfig config, Output child, BackoffPolicy backoffPolicy, MeterRegistry meterRegistry) {
        this.config = Objects.requireNonNull(config, "Retry output config cannot be null");
        this.child = Objects.requireNonNull(child, "Wrapped output cannot be null");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "Backoff policy cannot be null");
        this.name = config.getName();
        this.transactionsOut = new TransactionChannel(config.getChannelCapacity());
        this.lifecycle = new RetryLifecycle(name);
        this.metrics = new RetryMetrics(name);
        this.metrics.bindTo(Objects.requireNonNull(meterRegistry, "Meter registry cannot be null"));
        this.workerExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "retry-worker-" + name);
            t.setDaemon(true);
            return t;
        });
        this.lifecycle.addCancellationHook(this::cancel);
    }

    @Override
    public void consume(TransactionChannel transactions) {
        Objects.requireNonNull(transactions, "Transaction channel cannot be null");
        synchronized (startLock) {
            if (!lifecycle.isRunning()) {
                throw new IllegalStateException("Retry output '" + name + "' is closed");
            }
            if (!transactionsIn.compareAndSet(null, transactions)) {
                throw new AlreadyStartedException("Retry output '" + name + "' is already consuming");
            }
            try {
                child.consume(transactionsOut);
            } catch (RuntimeException e) {
                transactionsIn.set(null);
                throw e;
            }

            coordinator = new Thread(() -> loop(transactions), "retry-coordinator-" + name);
            coordinator.setDaemon(true);
            coordinator.start();
        }
        logger.info("Retry output '{}' started with {}", name, config.getBackoffConfig());
    }

    private void loop(TransactionChannel source) {
        metrics.started();
        try {
            while (lifecycle.isRunning()) {
                if (!awaitRetriesSettled()) {
                    return;
                }

                Transaction transaction = source.receive();
                if (transaction == null) {
                    logger.info("Input of retry output '{}' closed, draining in-flight transactions", name);
                    return;
                }
                metrics.recordReceived();

                Transaction attempt = new Transaction(transaction.getPayload());
                transactionsOut.send(attempt);
                workerExecutor.execute(new RetryWorker(name, transaction, attempt, transactionsOut,
                    backoffPolicy, metrics, lifecycle, errorLoops));
            }
        } catch (InterruptedException e) {
            logger.debug("Retry coordinator '{}' interrupted", name);
        } catch (ChannelClosedException | RejectedExecutionException e) {
            logger.debug("Retry coordinator '{}' stopped: {}", name, e.getMessage());
        } finally {
            shutdown();
        }
    }

    /**
     * Blocks while any worker is retrying.
     *
     * @return false if shutdown was requested while waiting
     */
    private boolean awaitRetriesSettled() throws InterruptedException {
        while (errorLoops.get() > 0) {
            if (!lifecycle.isRunning()) {
                return false;
            }
            lifecycle.awaitErrorLoopExit(config.getBackpressurePollInterval());
        }
        return lifecycle.isRunning();
    }

    private void shutdown() {
        // cleared so the drain below can block; restored once closed
        boolean interrupted = Thread.interrupted();

        workerExecutor.shutdown();
        while (true) {
            try {
                if (workerExecutor.awaitTermination(config.getClosePollInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
                logger.debug("Retry output '{}' waiting for in-flight transactions", name);
            } catch (InterruptedException e) {
                interrupted = true;
                workerExecutor.shutdownNow();
            }
        }

        transactionsOut.close();
        child.closeAsync();
        while (true) {
            try {
                child.waitForClose(config.getClosePollInterval());
                break;
            } catch (TimeoutException e) {
                logger.debug("Retry output '{}' waiting for wrapped output to close", name);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }

        metrics.stopped();
        lifecycle.markClosed();
        logger.info("Retry output '{}' closed", name);

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void cancel() {
        synchronized (startLock) {
            if (coordinator != null) {
                coordinator.interrupt();
            } else {
                transactionsOut.close();
                child.closeAsync();
                lifecycle.markClosed();
            }
        }
        workerExecutor.shutdownNow();
    }

    @Override
    public boolean isConnected() {
        return child.isConnected();
    }

    @Override
    public void closeAsync() {
        lifecycle.close();
    }

    @Override
    public void waitForClose(Duration timeout) throws TimeoutException, InterruptedException {
        lifecycle.awaitClosed(timeout);
    }

    public String getName() {
        return name;
    }

    int getErrorLoopCount() {
        return errorLoops.get();
    }
}
