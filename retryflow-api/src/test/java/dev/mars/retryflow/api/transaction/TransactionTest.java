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

import dev.mars.retryflow.api.error.NotAcknowledgedException;
import dev.mars.retryflow.api.messaging.MessageBatch;
import dev.mars.retryflow.api.messaging.SimpleMessage;
import dev.mars.retryflow.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class TransactionTest {

    @Test
    @DisplayName("Should accept exactly one response")
    void testSingleUseResponse() {
        Transaction transaction = new Transaction(MessageBatch.of(SimpleMessage.of("a")));
        assertFalse(transaction.isResolved());

        transaction.respond(Response.ack());
        assertTrue(transaction.isResolved());

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> transaction.respond(Response.noack()));
        assertTrue(e.getMessage().contains(transaction.getId()));
        assertTrue(transaction.response().join().isAcknowledged());
    }

    @Test
    @DisplayName("Should hand the response to a blocked reader")
    void testAwaitResponse() throws Exception {
        Transaction transaction = new Transaction(MessageBatch.empty());
        AtomicReference<Response> received = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread reader = new Thread(() -> {
            try {
                received.set(transaction.awaitResponse());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        });
        reader.start();

        transaction.respond(Response.error(new RuntimeException("boom")));
        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertTrue(received.get().isError());
        assertEquals("boom", received.get().getError().getMessage());
    }

    @Test
    @DisplayName("Should report an exceptionally completed destination as an error response")
    void testExceptionalCompletion() throws Exception {
        Transaction transaction = new Transaction(MessageBatch.empty());
        transaction.response().completeExceptionally(new IllegalStateException("target crashed"));

        Response response = transaction.awaitResponse();
        assertTrue(response.isError());
        assertEquals("target crashed", response.getError().getMessage());
    }

    @Test
    void testResponseKinds() {
        assertTrue(Response.ack().isAcknowledged());
        assertNull(Response.ack().getError());

        Response noack = Response.noack();
        assertTrue(noack.isNotAcknowledged());
        assertFalse(noack.isError());
        assertInstanceOf(NotAcknowledgedException.class, noack.getError());

        assertThrows(NullPointerException.class, () -> Response.error(null));
    }
}
