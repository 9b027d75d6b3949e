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

import dev.mars.retryflow.api.messaging.MessageBatch;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * A payload paired with a single-use response destination.
 *
 * <p>Whoever currently owns the transaction writes exactly one {@link Response} to it with
 * {@link #respond(Response)}. A second write is a programming error and fails fast.</p>
 */
public final class Transaction {

    private final String id;
    private final MessageBatch payload;
    private final CompletableFuture<Response> response = new CompletableFuture<>();

    public Transaction(MessageBatch payload) {
        this(UUID.randomUUID().toString(), payload);
    }

    public Transaction(String id, MessageBatch payload) {
        this.id = Objects.requireNonNull(id, "Transaction ID cannot be null");
        this.payload = Objects.requireNonNull(payload, "Payload cannot be null");
    }

    public String getId() {
        return id;
    }

    public MessageBatch getPayload() {
        return payload;
    }

    /**
     * Writes the outcome of this transaction.
     *
     * @throws IllegalStateException if a response was already written
     */
    public void respond(Response outcome) {
        Objects.requireNonNull(outcome, "Response cannot be null");
        if (!response.complete(outcome)) {
            throw new IllegalStateException("Response already written for transaction " + id);
        }
    }

    /**
     * Read side of the response destination.
     */
    public CompletableFuture<Response> response() {
        return response;
    }

    /**
     * Blocks until a response is written. A response destination completed exceptionally by a
     * misbehaving target is reported as an error response.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Response awaitResponse() throws InterruptedException {
        try {
            return response.get();
        } catch (ExecutionException e) {
            return Response.error(e.getCause() != null ? e.getCause() : e);
        }
    }

    public boolean isResolved() {
        return response.isDone();
    }

    @Override
    public String toString() {
        return "Transaction{id='" + id + "', payload=" + payload + ", resolved=" + isResolved() + '}';
    }
}
