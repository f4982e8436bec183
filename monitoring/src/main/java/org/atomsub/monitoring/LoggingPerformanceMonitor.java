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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link PerformanceMonitor} that logs the latency (time between the event being written and processed) of every event.
 * Events that failed in a handler are logged at warn level.
 */
public class LoggingPerformanceMonitor implements PerformanceMonitor {
    private static final Logger log = LoggerFactory.getLogger(LoggingPerformanceMonitor.class);

    private final Clock clock;

    public LoggingPerformanceMonitor() {
        this(Clock.systemUTC());
    }

    public LoggingPerformanceMonitor(Clock clock) {
        Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.clock = clock;
    }

    @Override
    public void accept(String stream, String eventTypeName, OffsetDateTime updated, int handlerCount, Map<Class<?>, Throwable> errors) {
        Duration latency = Duration.between(updated.toInstant(), clock.instant());
        if (errors.isEmpty()) {
            log.debug("{}: {} processed by {} handler(s) with a latency of {} ms", stream, eventTypeName, handlerCount, latency.toMillis());
        } else {
            log.warn("{}: {} processed by {} handler(s) with a latency of {} ms, failing handlers: {}", stream, eventTypeName, handlerCount, latency.toMillis(),
                    errors.keySet().stream().map(Class::getName).toList());
        }
    }
}
