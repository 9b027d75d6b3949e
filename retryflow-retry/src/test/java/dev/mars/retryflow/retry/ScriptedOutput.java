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

import dev.mars.retryflow.api.error.AlreadyStartedException;
import dev.mars.retryflow.api.output.Output;
import dev.mars.retryflow.api.transaction.Response;
import dev.mars.retryflow.api.transaction.Transaction;
import dev.mars.retryflow.api.transaction.TransactionChannel;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntFunction;

/**
 * Test target that answers each delivery attempt according to a script keyed by the 1-based
 * attempt number. A script returning null leaves the attempt unanswered.
 */
class ScriptedOutput implements Output {

    private final IntFunction<Response> script;
    private final List<Transaction> attempts = new CopyOnWriteArrayList<>();
    private final AtomicReference<Thread> consumer = new AtomicReference<>();
    private final AtomicBoolean connected = new AtomicBoolean(true);
    private final CountDownLatch closed = new CountDownLatch(1);

    ScriptedOutput(IntFunction<Response> script) {
        this.script = script;
    }

    static ScriptedOutput failingTimes(int failures) {
        return new ScriptedOutput(attempt -> attempt <= failures
            ? Response.error(new IOException("target unavailable")) : Response.ack());
    }

    static ScriptedOutput alwaysFailing() {
        return new ScriptedOutput(attempt -> Response.error(new IOException("target unavailable")));
    }

    static ScriptedOutput neverResponding() {
        return new ScriptedOutput(attempt -> null);
    }

    @Override
    public void consume(TransactionChannel transactions) {
        Thread thread = new Thread(() -> loop(transactions), "scripted-output");
        thread.setDaemon(true);
        if (!consumer.compareAndSet(null, thread)) {
            throw new AlreadyStartedException("Scripted output is already consuming");
        }
        thread.start();
    }

    private void loop(TransactionChannel transactions) {
        try {
            Transaction transaction;
            while ((transaction = transactions.receive()) != null) {
                attempts.add(transaction);
                Response response = script.apply(attempts.size());
                if (response != null) {
                    transaction.respond(response);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            closed.countDown();
        }
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    void setConnected(boolean value) {
        connected.set(value);
    }

    @Override
    public void closeAsync() {
        Thread thread = consumer.get();
        if (thread != null) {
            thread.interrupt();
        } else {
            closed.countDown();
        }
    }

    @Override
    public void waitForClose(Duration timeout) throws TimeoutException, InterruptedException {
        if (!closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new TimeoutException("Scripted output did not close within " + timeout);
        }
    }

    boolean isClosed() {
        return closed.getCount() == 0;
    }

    List<Transaction> getAttempts() {
        return attempts;
    }

    boolean awaitAttempts(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (attempts.size() < count) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }
}
