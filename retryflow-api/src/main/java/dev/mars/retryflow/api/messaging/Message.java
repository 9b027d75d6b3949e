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

/**
 * A single message flowing through an output pipeline.
 *
 * <p>The retry stage never inspects the payload; messages are carried as part of a
 * {@link MessageBatch} and handed unchanged to the delivery target on every attempt.</p>
 *
 * @param <T> The type of the message payload
 */
public interface Message<T> {

    /**
     * Gets the unique identifier of the message.
     *
     * @return The message ID
     */
    String getId();

    /**
     * Gets the payload of the message.
     *
     * @return The message payload
     */
    T getPayload();

    /**
     * Gets the timestamp when the message was created.
     *
     * @return The creation timestamp
     */
    Instant getCreatedAt();

    /**
     * Gets the headers associated with the message.
     *
     * @return The message headers
     */
    Map<String, String> getHeaders();
}
