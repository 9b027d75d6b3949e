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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shutdown state shared by a retry output's coordinator and its workers.
 *
 * <ul>
 *   <li><b>running</b> - cleared exactly once by the first {@link #close()}</li>
 *   <li><b>close signal</b> - broadcast to everything blocked in {@link #awaitClose(Duration)};
 *       registered cancellation hooks run once on the same transition</li>
 *   <li><b>closed signal</b> - fired by {@link #markClosed()} once every resource is released</li>
 *   <li><b>error loop exit</b> - lossy wake-up from a worker to a coordinator parked in
 *       {@link #awaitErrorLoopExit(Duration)}; dropped when nobody is waiting</li>
 * </ul>
 */
public class RetryLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(RetryLifecycle.class);

    private static final Object WAKE = new Object();

    private final String name;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final CountDownLatch closeSignal = new CountDownLatch(1);
    private final CountDownLatch closedSignal = new CountDownLatch(1);
    private final SynchronousQueue<Object> errorLoopExits = new SynchronousQueue<>();
    private final List<Runnable> cancellationHooks = new CopyOnWriteArrayList<>();

    public RetryLifecycle(String name) {
        this.name = name;
    }

    /**
     * Registers an action run on the first {@link #close()}. Hooks must be registered before
     * the lifecycle can be closed.
     */
    public void addCancellationHook(Runnable hook) {
        cancellationHooks.add(hook);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Requests shutdown. Only the first call has any effect.
     */
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Closing retry output '{}'", name);
        closeSignal.countDown();
        for (Runnable hook : cancellationHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                logger.error("Cancellation hook failed for retry output '{}'", name, e);
            }
        }
    }

    /**
     * Sleeps for the given duration unless shutdown is requested first.
     *
     * @return true if shutdown was requested, false if the full duration elapsed
     */
    public boolean awaitClose(Duration duration) throws InterruptedException {
        return closeSignal.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Wakes a coordinator waiting for retrying transactions to settle. Never blocks.
     */
    public void notifyErrorLoopExit() {
        errorLoopExits.offer(WAKE);
    }

    /**
     * @return true if a worker left its error loop while waiting
     */
    public boolean awaitErrorLoopExit(Duration timeout) throws InterruptedException {
        return errorLoopExits.poll(timeout.toNanos(), TimeUnit.NANOSECONDS) != null;
    }

    public void markClosed() {
        closedSignal.countDown();
    }

    public boolean isClosed() {
        return closedSignal.getCount() == 0;
    }

    /**
     * Blocks until {@link #markClosed()} has been called.
     *
     * @throws TimeoutException if not closed within the timeout
     */
    public void awaitClosed(Duration timeout) throws TimeoutException, InterruptedException {
        if (!closedSignal.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            throw new TimeoutException("Retry output '" + name + "' did not close within " + timeout);
        }
    }
}
