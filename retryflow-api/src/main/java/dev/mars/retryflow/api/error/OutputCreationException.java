package dev.mars.retryflow.api.error;

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

/**
 * Fatal construction failure of an output. The output is never started.
 */
public class OutputCreationException extends RuntimeException {

    private final String outputType;

    public OutputCreationException(String outputType, String message) {
        super(message);
        this.outputType = outputType;
    }

    public OutputCreationException(String outputType, String message, Throwable cause) {
        super(message, cause);
        this.outputType = outputType;
    }

    /**
     * The declared type name of the output that failed to construct, may be null when no
     * type was supplied.
     */
    public String getOutputType() {
        return outputType;
    }
}
