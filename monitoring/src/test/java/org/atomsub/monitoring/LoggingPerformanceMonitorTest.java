/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.atomsub.monitoring;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayNameGeneration(ReplaceUnderscores.class)
class LoggingPerformanceMonitorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingPerformanceMonitor.class);
    private ListAppender<ILoggingEvent> appender;
    private LoggingPerformanceMonitor monitor;

    @BeforeEach
    void log_events_are_captured() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        monitor = new LoggingPerformanceMonitor(new MutableClock(NOW));
    }

    @AfterEach
    void stop_capturing_log_events() {
        logger.detachAppender(appender);
    }

    @Test
    void latency_of_successfully_processed_events_is_logged_at_debug_level() {
        // When
        monitor.accept("orders", "OrderPlaced", OffsetDateTime.ofInstant(NOW.minus(Duration.ofMillis(250)), ZoneOffset.UTC), 2, Map.of());

        // Then
        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
            assertThat(event.getFormattedMessage()).isEqualTo("orders: OrderPlaced processed by 2 handler(s) with a latency of 250 ms");
        });
    }

    @Test
    void events_with_failing_handlers_are_logged_at_warn_level() {
        // When
        monitor.accept("orders", "OrderPlaced", OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), 1, Map.of(String.class, new IllegalStateException("expected")));

        // Then
        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).endsWith("failing handlers: [java.lang.String]");
        });
    }
}
