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

import org.atomsub.subscription.SubscriptionKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemorySubscriberIntervalMonitorTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private InMemorySubscriberIntervalMonitor monitor;

    @BeforeEach
    void monitor_is_created_before_each_test() {
        clock = new MutableClock(START);
        monitor = new InMemorySubscriberIntervalMonitor(clock, 3);
    }

    @Test
    void ticks_are_recorded_per_stream_and_subscriber() {
        // When
        monitor.updateInterval("orders", Duration.ofSeconds(5), null);
        clock.advance(Duration.ofSeconds(1));
        monitor.updateInterval("orders", Duration.ofSeconds(10), "billing");

        // Then
        assertAll(
                () -> assertThat(monitor.getLastTick("orders", null)).hasValue(new InMemorySubscriberIntervalMonitor.Tick(Duration.ofSeconds(5), START)),
                () -> assertThat(monitor.getLastTick("orders", "billing")).hasValue(new InMemorySubscriberIntervalMonitor.Tick(Duration.ofSeconds(10), START.plusSeconds(1))),
                () -> assertThat(monitor.getTicks()).containsOnlyKeys(SubscriptionKey.of("orders", null), SubscriptionKey.of("orders", "billing"))
        );
    }

    @Test
    void subscriptions_that_have_not_ticked_within_the_tolerance_are_overdue() {
        // Given
        monitor.updateInterval("orders", Duration.ofSeconds(5), null);
        monitor.updateInterval("payments", Duration.ofSeconds(30), null);

        // When
        clock.advance(Duration.ofSeconds(16));

        // Then
        assertThat(monitor.getOverdueSubscriptions()).containsExactly(SubscriptionKey.of("orders", null));
    }

    @Test
    void removed_subscriptions_are_no_longer_monitored() {
        // Given
        monitor.updateInterval("orders", Duration.ofSeconds(5), null);

        // When
        monitor.removeMonitor("orders", null);
        clock.advance(Duration.ofMinutes(1));

        // Then
        assertAll(
                () -> assertThat(monitor.getLastTick("orders", null)).isEmpty(),
                () -> assertThat(monitor.getOverdueSubscriptions()).isEmpty()
        );
    }
}
