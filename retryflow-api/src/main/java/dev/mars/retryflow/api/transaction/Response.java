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

import java.util.Objects;

/**
 * Outcome of delivering a transaction.
 *
 * <ul>
 *   <li>{@link Status#ACK} - the target accepted the payload</li>
 *   <li>{@link Status#ERROR} - a single delivery attempt failed; the cause is attached</li>
 *   <li>{@link Status#NOACK} - the output gave up after exhausting its retry budget. This is a
 *       valid terminal outcome, not a failure of the output itself.</li>
 * </ul>
 */
public final class Response {

    public enum Status { ACK, NOACK, ERROR }

    private static final Response ACK = new Response(Status.ACK, null);

    private final Status status;
    private final Throwable error;

    private Response(Status status, Throwable error) {
        this.status = status;
        this.error = error;
    }

    public static Response ack() {
        return ACK;
    }

    public static Response noack() {
        return new Response(Status.NOACK, new NotAcknowledgedException());
    }

    public static Response error(Throwable error) {
        return new Response(Status.ERROR, Objects.requireNonNull(error, "Error cannot be null"));
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return the failure cause, a {@link NotAcknowledgedException} for NOACK, or null for ACK
     */
    public Throwable getError() {
        return error;
    }

    public boolean isAcknowledged() {
        return status == Status.ACK;
    }

    public boolean isNotAcknowledged() {
        return status == Status.NOACK;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    @Override
    public String toString() {
        return error == null
            ? "Response{status=" + status + '}'
            : "Response{status=" + status + ", error='" + error.getMessage() + "'}";
    }
}
