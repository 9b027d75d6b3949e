package dev.mars.retryflow.api.output;

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

import dev.mars.retryflow.api.transaction.TransactionChannel;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * A delivery target: consumes a stream of transactions and writes one response to each.
 *
 * <p>Implementations report the outcome of every transaction they receive through
 * {@link dev.mars.retryflow.api.transaction.Transaction#respond}. Responses may be written
 * asynchronously and from any thread.</p>
 */
public interface Output {

    /**
     * Wires the input stream of this output and starts consuming it.
     *
     * @param transactions the stream to consume; closing it ends the stream
     * @throws dev.mars.retryflow.api.error.AlreadyStartedException if already wired
     */
    void consume(TransactionChannel transactions);

    /**
     * @return whether the output is currently connected to its target
     */
    boolean isConnected();

    /**
     * Requests the output to stop. Safe to call multiple times and from any thread.
     */
    void closeAsync();

    /**
     * Blocks until the output has fully stopped.
     *
     * @throws TimeoutException if the output has not stopped within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    void waitForClose(Duration timeout) throws TimeoutException, InterruptedException;
}
