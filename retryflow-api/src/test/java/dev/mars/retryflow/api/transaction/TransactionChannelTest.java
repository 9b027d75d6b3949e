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
import dev.mars.retryflow.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class TransactionChannelTest {

    @Test
    @DisplayName("Should deliver buffered transactions after close and then signal end of stream")
    void testDrainAfterClose() throws Exception {
        TransactionChannel channel = new TransactionChannel(2);
        Transaction first = new Transaction(MessageBatch.empty());
        Transaction second = new Transaction(MessageBatch.empty());
        channel.send(first);
        channel.send(second);
        channel.close();

        assertTrue(channel.isClosed());
        assertFalse(channel.isDrained());
        assertSame(first, channel.receive());
        assertSame(second, channel.receive());
        assertNull(channel.receive());
        assertTrue(channel.isDrained());
    }

    @Test
    @DisplayName("Should reject sends once closed")
    void testSendAfterClose() {
        TransactionChannel channel = new TransactionChannel();
        channel.close();
        channel.close();

        assertThrows(ChannelClosedException.class,
            () -> channel.send(new Transaction(MessageBatch.empty())));
    }

    @Test
    @DisplayName("Should wake a blocked receiver when closed")
    void testCloseWakesReceiver() throws Exception {
        TransactionChannel channel = new TransactionChannel();
        AtomicReference<Transaction> received = new AtomicReference<>(new Transaction(MessageBatch.empty()));
        CountDownLatch done = new CountDownLatch(1);

        Thread receiver = new Thread(() -> {
            try {
                received.set(channel.receive());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        });
        receiver.start();

        Thread.sleep(50);
        channel.close();
        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertNull(received.get());
    }

    @Test
    @DisplayName("Should block senders while full and fail them on close")
    void testCloseWakesBlockedSender() throws Exception {
        TransactionChannel channel = new TransactionChannel(1);
        channel.send(new Transaction(MessageBatch.empty()));

        AtomicBoolean closedSeen = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);
        Thread sender = new Thread(() -> {
            try {
                channel.send(new Transaction(MessageBatch.empty()));
            } catch (ChannelClosedException e) {
                closedSeen.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        });
        sender.start();

        assertFalse(done.await(100, TimeUnit.MILLISECONDS), "Sender should block on a full channel");
        channel.close();
        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertTrue(closedSeen.get());
    }

    @Test
    @DisplayName("Should unblock a receiver on interrupt")
    void testInterruptReceiver() throws Exception {
        TransactionChannel channel = new TransactionChannel();
        AtomicBoolean interrupted = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);

        Thread receiver = new Thread(() -> {
            try {
                channel.receive();
            } catch (InterruptedException e) {
                interrupted.set(true);
            } finally {
                done.countDown();
            }
        });
        receiver.start();
        Thread.sleep(50);
        receiver.interrupt();

        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertTrue(interrupted.get());
    }

    @Test
    void testTimedOperations() throws Exception {
        TransactionChannel channel = new TransactionChannel(1);
        assertNull(channel.receive(Duration.ofMillis(20)));

        assertTrue(channel.offer(new Transaction(MessageBatch.empty()), 10, TimeUnit.MILLISECONDS));
        assertFalse(channel.offer(new Transaction(MessageBatch.empty()), 10, TimeUnit.MILLISECONDS));
        assertEquals(1, channel.size());
        assertNotNull(channel.receive(Duration.ofMillis(20)));

        assertThrows(IllegalArgumentException.class, () -> new TransactionChannel(0));
    }
}
