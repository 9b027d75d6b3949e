package dev.mars.retryflow.api.transaction;

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

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, closable hand-off of transactions between a producer and an output.
 *
 * <p>Closing the channel is the producer's signal of permanent end of stream. Transactions
 * already buffered remain receivable after close; once drained, {@link #receive()} returns
 * {@code null}. Every blocking operation responds to thread interruption.</p>
 */
public class TransactionChannel {

    private final int capacity;
    private final ArrayDeque<Transaction> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed;

    public TransactionChannel() {
        this(1);
    }

    public TransactionChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    /**
     * Blocks until there is room for the transaction.
     *
     * @throws ChannelClosedException if the channel is, or becomes, closed
     * @throws InterruptedException if interrupted while waiting
     */
    public void send(Transaction transaction) throws ChannelClosedException, InterruptedException {
        Objects.requireNonNull(transaction, "Transaction cannot be null");
        lock.lockInterruptibly();
        try {
            while (!closed && buffer.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                throw new ChannelClosedException("Transaction channel is closed");
            }
            buffer.addLast(transaction);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a transaction is available.
     *
     * @return the next transaction, or null once the channel is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    public Transaction receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                notEmpty.await();
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to the timeout for a transaction.
     *
     * @return the next transaction, or null on timeout or once the channel is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    public Transaction receive(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                if (remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    private Transaction take() {
        Transaction next = buffer.pollFirst();
        if (next != null) {
            notFull.signal();
        }
        return next;
    }

    /**
     * Closes the channel. Idempotent. Wakes every blocked sender and receiver.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true once closed and every buffered transaction has been received
     */
    public boolean isDrained() {
        lock.lock();
        try {
            return closed && buffer.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Sends without waiting longer than the timeout.
     *
     * @return false if the channel stayed full for the whole timeout
     */
    public boolean offer(Transaction transaction, long timeout, TimeUnit unit)
            throws ChannelClosedException, InterruptedException {
        Objects.requireNonNull(transaction, "Transaction cannot be null");
        long remaining = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (!closed && buffer.size() >= capacity) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = notFull.awaitNanos(remaining);
            }
            if (closed) {
                throw new ChannelClosedException("Transaction channel is closed");
            }
            buffer.addLast(transaction);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }
}
