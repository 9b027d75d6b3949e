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

import dev.mars.retryflow.api.error.OutputCreationException;
import dev.mars.retryflow.api.messaging.MessageBatch;
import dev.mars.retryflow.api.messaging.SimpleMessage;
import dev.mars.retryflow.api.output.Output;
import dev.mars.retryflow.api.output.OutputConfig;
import dev.mars.retryflow.api.transaction.Transaction;
import dev.mars.retryflow.api.transaction.TransactionChannel;
import dev.mars.retryflow.core.output.DropOutputRegistrar;
import dev.mars.retryflow.core.provider.OutputFactoryProvider;
import dev.mars.retryflow.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class RetryOutputRegistrarTest {

    private SimpleMeterRegistry registry;
    private OutputFactoryProvider provider;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        provider = new OutputFactoryProvider(registry);
        DropOutputRegistrar.registerWith(provider);
        RetryOutputRegistrar.registerWith(provider);
    }

    @Test
    @DisplayName("Should build a retry output around its child and deliver through it")
    void testCreateRetryOutput() throws Exception {
        Output output = provider.createOutput(OutputConfig.builder("retry")
            .name("orders")
            .property("max-retries", "3")
            .child(OutputConfig.builder("drop").build())
            .build());
        assertInstanceOf(RetryOutput.class, output);

        TransactionChannel source = new TransactionChannel();
        output.consume(source);
        Transaction transaction = new Transaction(MessageBatch.of(SimpleMessage.of("hello")));
        source.send(transaction);

        assertTrue(transaction.response().get(5, TimeUnit.SECONDS).isAcknowledged());
        assertEquals(1.0, registry.get(RetryMetrics.SEND_SUCCESS).tag("output", "orders").counter().count());

        source.close();
        output.waitForClose(Duration.ofSeconds(5));
    }

    @Test
    void testMissingChild() {
        OutputCreationException e = assertThrows(OutputCreationException.class,
            () -> provider.createOutput(OutputConfig.builder("retry").build()));

        assertEquals("cannot create retry output without a child", e.getMessage());
        assertEquals("retry", e.getOutputType());
    }

    @Test
    @DisplayName("Should report a failing child under the child's type")
    void testChildCreationFailure() {
        provider.registerOutput("broken", (config, p) -> {
            throw new IllegalStateException("connection refused");
        });

        OutputCreationException e = assertThrows(OutputCreationException.class,
            () -> provider.createOutput(OutputConfig.builder("retry")
                .child(OutputConfig.builder("broken").build())
                .build()));

        assertEquals("failed to create output 'broken': connection refused", e.getMessage());
        assertEquals("broken", e.getOutputType());
    }

    @Test
    void testUnknownChildType() {
        OutputCreationException e = assertThrows(OutputCreationException.class,
            () -> provider.createOutput(OutputConfig.builder("retry")
                .child(OutputConfig.builder("nope").build())
                .build()));

        assertEquals("nope", e.getOutputType());
    }

    @Test
    void testMalformedRetrySettings() {
        OutputCreationException e = assertThrows(OutputCreationException.class,
            () -> provider.createOutput(OutputConfig.builder("retry")
                .property("backoff.initial-interval", "quickly")
                .child(OutputConfig.builder("drop").build())
                .build()));

        assertEquals("retry", e.getOutputType());
        assertTrue(e.getMessage().startsWith("failed to create output 'retry': failed to parse backoff initial interval"));
    }

    @Test
    void testNestedRetryOutputs() throws Exception {
        Output output = provider.createOutput(OutputConfig.builder("retry")
            .name("outer")
            .child(OutputConfig.builder("retry")
                .name("inner")
                .child(OutputConfig.builder("drop").build())
                .build())
            .build());

        TransactionChannel source = new TransactionChannel();
        output.consume(source);
        Transaction transaction = new Transaction(MessageBatch.of(SimpleMessage.of("nested")));
        source.send(transaction);
        assertTrue(transaction.response().get(5, TimeUnit.SECONDS).isAcknowledged());

        output.closeAsync();
        output.waitForClose(Duration.ofSeconds(5));
    }

    @Test
    void testUnregister() {
        RetryOutputRegistrar.unregisterFrom(provider);
        assertFalse(provider.isTypeSupported("retry"));
    }
}
