package dev.mars.retryflow.runtime;

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
 * Options for bootstrapping the RetryFlow runtime: which output types to register and whether
 * to log the resolved output pipeline.
 */
public final class RuntimeConfig {

    private final boolean enableDropOutput;
    private final boolean enableRetryOutput;
    private final boolean logOutputConfig;

    private RuntimeConfig(Builder builder) {
        this.enableDropOutput = builder.enableDropOutput;
        this.enableRetryOutput = builder.enableRetryOutput;
        this.logOutputConfig = builder.logOutputConfig;
    }

    public boolean isDropOutputEnabled() {
        return enableDropOutput;
    }

    public boolean isRetryOutputEnabled() {
        return enableRetryOutput;
    }

    /**
     * Returns whether the sanitised output pipeline is logged when an output is created.
     *
     * @return true if the pipeline is logged at INFO
     */
    public boolean isLogOutputConfig() {
        return logOutputConfig;
    }

    /**
     * Creates a new builder with every output type enabled.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static RuntimeConfig defaults() {
        return builder().build();
    }

    public static final class Builder {
        private boolean enableDropOutput = true;
        private boolean enableRetryOutput = true;
        private boolean logOutputConfig = true;

        private Builder() {}

        public Builder enableDropOutput(boolean enable) {
            this.enableDropOutput = enable;
            return this;
        }

        public Builder enableRetryOutput(boolean enable) {
            this.enableRetryOutput = enable;
            return this;
        }

        public Builder logOutputConfig(boolean enable) {
            this.logOutputConfig = enable;
            return this;
        }

        public RuntimeConfig build() {
            return new RuntimeConfig(this);
        }
    }

    @Override
    public String toString() {
        return "RuntimeConfig{" +
                "enableDropOutput=" + enableDropOutput +
                ", enableRetryOutput=" + enableRetryOutput +
                ", logOutputConfig=" + logOutputConfig +
                '}';
    }
}
