package dev.mars.retryflow.api.messaging;

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

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable {@link Message} implementation.
 *
 * @param <T> The type of the message payload
 */
public class SimpleMessage<T> implements Message<T> {

    private final String id;
    private final T payload;
    private final Map<String, String> headers;
    private final Instant createdAt;

    public SimpleMessage(String id, T payload, Map<String, String> headers, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "Message ID cannot be null");
        this.payload = Objects.requireNonNull(payload, "Payload cannot be null");
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public SimpleMessage(String id, T payload, Map<String, String> headers) {
        this(id, payload, headers, Instant.now());
    }

    public SimpleMessage(String id, T payload) {
        this(id, payload, null, Instant.now());
    }

    /**
     * Creates a message with a random identifier.
     */
    public static <T> SimpleMessage<T> of(T payload) {
        return new SimpleMessage<>(UUID.randomUUID().toString(), payload);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public T getPayload() {
        return payload;
    }

    @Override
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public Map<String, String> getHeaders() {
        return headers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimpleMessage<?> that = (SimpleMessage<?>) o;
        return Objects.equals(id, that.id) &&
               Objects.equals(payload, that.payload) &&
               Objects.equals(headers, that.headers) &&
               Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, payload, headers, createdAt);
    }

    @Override
    public String toString() {
        return String.format("SimpleMessage{id='%s', payload=%s, headers=%s, createdAt=%s}",
            id, payload, headers, createdAt);
    }
}
