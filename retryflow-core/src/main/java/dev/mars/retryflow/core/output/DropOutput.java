package dev.mars.retryflow.core.output;

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

import dev.mars.retryflow.api.error.AlreadyStartedException;
import dev.mars.retryflow.api.output.Output;
import dev.mars.retryflow.api.transaction.Response;
import dev.mars.retryflow.api.transaction.Transaction;
import dev.mars.retryflow.api.transaction.TransactionChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Output that acknowledges and discards every transaction it receives.
 */
public class DropOutput implements Output {

    private static final Logger logger = LoggerFactory.getLogger(DropOutput.class);

    private final String name;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicReference<Thread> consumerThread = new AtomicReference<>();
    private final CountDownLatch closed = new CountDownLatch(1);
    private final AtomicLong dropped = new AtomicLong();

    public DropOutput(String name) {
        this.name = name;
    }

    @Override
    public void consume(TransactionChannel transactions) {
        Thread thread = new Thread(() -> loop(transactions), "drop-output-" + name);
        thread.setDaemon(true);
        if (!consumerThread.compareAndSet(null, thread)) {
            throw new AlreadyStartedException("Drop output '" + name + "' is already consuming");
        }
        thread.start();
    }

    private void loop(TransactionChannel transactions) {
        try {
            while (running.get()) {
                Transaction transaction = transactions.receive();
                if (transaction == null) {
                    logger.debug("Drop output '{}' input closed", name);
                    break;
                }
                dropped.incrementAndGet();
                transaction.respond(Response.ack());
            }
        } catch (InterruptedException e) {
            logger.debug("Drop output '{}' interrupted", name);
        } finally {
            running.set(false);
            closed.countDown();
        }
    }

    @Override
    public boolean isConnected() {
        return true;
    }

    @Override
    public void closeAsync() {
        if (running.compareAndSet(true, false)) {
            Thread thread = consumerThread.get();
            if (thread != null) {
                thread.interrupt();
            } else {
                closed.countDown();
            }
        }
    }

    @Override
    public void waitForClose(Duration timeout) throws TimeoutException, InterruptedException {
        if (!closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new TimeoutException("Drop output '" + name + "' did not close within " + timeout);
        }
    }

    public long getDroppedCount() {
        return dropped.get();
    }
}
