package dev.mars.retryflow.core.config;

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

import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration settings.
 *
 * <p>Accepts ISO-8601 ({@code PT0.5S}) as well as the compact unit form used throughout the
 * configuration files ({@code 100ms}, {@code 1s}, {@code 1m30s}, {@code 2h}). A bare {@code 0}
 * is zero.</p>
 */
public final class Durations {

    private static final Pattern SEGMENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");

    private Durations() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @throws IllegalArgumentException if the value is blank, negative or not a duration
     */
    public static Duration parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Duration value cannot be null or empty");
        }
        String text = value.trim();
        if ("0".equals(text)) {
            return Duration.ZERO;
        }
        if (text.startsWith("P") || text.startsWith("p")) {
            try {
                Duration parsed = Duration.parse(text);
                if (parsed.isNegative()) {
                    throw new IllegalArgumentException("Duration cannot be negative: " + value);
                }
                return parsed;
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration: " + value, e);
            }
        }

        Matcher matcher = SEGMENT.matcher(text);
        Duration total = Duration.ZERO;
        int position = 0;
        while (matcher.find()) {
            if (matcher.start() != position) {
                throw new IllegalArgumentException("Invalid duration: " + value);
            }
            total = total.plus(toDuration(new BigDecimal(matcher.group(1)), matcher.group(2)));
            position = matcher.end();
        }
        if (position == 0 || position != text.length()) {
            throw new IllegalArgumentException("Invalid duration: " + value);
        }
        return total;
    }

    /**
     * Renders a duration in the compact unit form, e.g. {@code 1500ms} or {@code 2s}.
     */
    public static String format(Duration duration) {
        if (duration.isZero()) {
            return "0s";
        }
        long millis = duration.toMillis();
        if (millis * 1_000_000L != duration.toNanos()) {
            return duration.toNanos() + "ns";
        }
        if (millis % 1000 == 0) {
            return (millis / 1000) + "s";
        }
        return millis + "ms";
    }

    private static Duration toDuration(BigDecimal amount, String unit) {
        BigDecimal nanosPerUnit;
        switch (unit) {
            case "ns":
                nanosPerUnit = BigDecimal.ONE;
                break;
            case "us":
            case "µs":
                nanosPerUnit = BigDecimal.valueOf(1_000L);
                break;
            case "ms":
                nanosPerUnit = BigDecimal.valueOf(1_000_000L);
                break;
            case "s":
                nanosPerUnit = BigDecimal.valueOf(1_000_000_000L);
                break;
            case "m":
                nanosPerUnit = BigDecimal.valueOf(60_000_000_000L);
                break;
            case "h":
                nanosPerUnit = BigDecimal.valueOf(3_600_000_000_000L);
                break;
            default:
                throw new IllegalArgumentException("Unknown duration unit: " + unit);
        }
        return Duration.ofNanos(amount.multiply(nanosPerUnit).longValue());
    }
}
