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

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable group of messages delivered as one unit.
 *
 * <p>A batch is the payload of a transaction. Its {@link #size()} is the number of
 * elements reported as delivered when the transaction succeeds.</p>
 */
public final class MessageBatch implements Iterable<Message<?>> {

    private static final MessageBatch EMPTY = new MessageBatch(List.of());

    private final List<Message<?>> messages;

    private MessageBatch(List<Message<?>> messages) {
        this.messages = messages;
    }

    public static MessageBatch of(List<? extends Message<?>> messages) {
        Objects.requireNonNull(messages, "Messages cannot be null");
        return new MessageBatch(List.copyOf(messages));
    }

    public static MessageBatch of(Message<?>... messages) {
        return of(Arrays.asList(messages));
    }

    public static MessageBatch empty() {
        return EMPTY;
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public Message<?> get(int index) {
        return messages.get(index);
    }

    public List<Message<?>> getMessages() {
        return messages;
    }

    @Override
    public Iterator<Message<?>> iterator() {
        return messages.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return messages.equals(((MessageBatch) o).messages);
    }

    @Override
    public int hashCode() {
        return messages.hashCode();
    }

    @Override
    public String toString() {
        return "MessageBatch{size=" + messages.size() + '}';
    }
}
