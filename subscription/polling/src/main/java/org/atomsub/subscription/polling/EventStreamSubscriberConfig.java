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

package org.atomsub.subscription.polling;

import org.atomsub.handler.ClassNameEventTypeResolver;
import org.atomsub.handler.EventTypeResolver;
import org.atomsub.monitoring.InMemorySubscriberIntervalMonitor;
import org.atomsub.monitoring.PerformanceMonitor;
import org.atomsub.monitoring.SubscriberIntervalMonitor;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuration for {@link PollingEventStreamSubscriber}. Instances are immutable, every setting returns a new instance:
 * <pre>
 * EventStreamSubscriberConfig config = EventStreamSubscriberConfig.defaults()
 *         .defaultPollingInterval(Duration.ofSeconds(1))
 *         .sliceSize(50)
 *         .performanceMonitor(new LoggingPerformanceMonitor());
 * </pre>
 */
public class EventStreamSubscriberConfig {
    public static final Duration DEFAULT_POLLING_INTERVAL = Duration.ofSeconds(5);
    public static final int DEFAULT_SLICE_SIZE = 100;
    public static final int DEFAULT_EVENT_NOT_FOUND_RETRY_COUNT = 10;
    public static final Duration DEFAULT_EVENT_NOT_FOUND_RETRY_DELAY = Duration.ofMillis(500);
    public static final Duration DEFAULT_STATS_WINDOW_PERIOD = Duration.ofSeconds(30);
    public static final int DEFAULT_STATS_WINDOW_COUNT = 10;

    public final Duration defaultPollingInterval;
    public final int sliceSize;
    public final @Nullable Duration longPollingTimeout;
    public final int eventNotFoundRetryCount;
    public final Duration eventNotFoundRetryDelay;
    public final Duration messageProcessingStatsWindowPeriod;
    public final int messageProcessingStatsWindowCount;
    public final EventTypeResolver eventTypeResolver;
    public final List<PerformanceMonitor> performanceMonitors;
    public final SubscriberIntervalMonitor subscriberIntervalMonitor;

    private EventStreamSubscriberConfig(Duration defaultPollingInterval, int sliceSize, @Nullable Duration longPollingTimeout,
                                        int eventNotFoundRetryCount, Duration eventNotFoundRetryDelay,
                                        Duration messageProcessingStatsWindowPeriod, int messageProcessingStatsWindowCount,
                                        EventTypeResolver eventTypeResolver, List<PerformanceMonitor> performanceMonitors,
                                        SubscriberIntervalMonitor subscriberIntervalMonitor) {
        Objects.requireNonNull(defaultPollingInterval, "defaultPollingInterval cannot be null");
        Objects.requireNonNull(eventNotFoundRetryDelay, "eventNotFoundRetryDelay cannot be null");
        Objects.requireNonNull(messageProcessingStatsWindowPeriod, "messageProcessingStatsWindowPeriod cannot be null");
        Objects.requireNonNull(eventTypeResolver, EventTypeResolver.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(performanceMonitors, "performanceMonitors cannot be null");
        Objects.requireNonNull(subscriberIntervalMonitor, SubscriberIntervalMonitor.class.getSimpleName() + " cannot be null");
        if (defaultPollingInterval.isNegative() || defaultPollingInterval.isZero()) {
            throw new IllegalArgumentException("defaultPollingInterval must be > 0 but got " + defaultPollingInterval);
        } else if (sliceSize < 1) {
            throw new IllegalArgumentException("sliceSize must be greater than or equal to 1");
        } else if (longPollingTimeout != null && longPollingTimeout.isNegative()) {
            throw new IllegalArgumentException("longPollingTimeout cannot be negative");
        } else if (eventNotFoundRetryDelay.isNegative()) {
            throw new IllegalArgumentException("eventNotFoundRetryDelay cannot be negative");
        }
        this.defaultPollingInterval = defaultPollingInterval;
        this.sliceSize = sliceSize;
        this.longPollingTimeout = longPollingTimeout;
        this.eventNotFoundRetryCount = eventNotFoundRetryCount;
        this.eventNotFoundRetryDelay = eventNotFoundRetryDelay;
        this.messageProcessingStatsWindowPeriod = messageProcessingStatsWindowPeriod;
        this.messageProcessingStatsWindowCount = messageProcessingStatsWindowCount;
        this.eventTypeResolver = eventTypeResolver;
        this.performanceMonitors = List.copyOf(performanceMonitors);
        this.subscriberIntervalMonitor = subscriberIntervalMonitor;
    }

    /**
     * Poll every 5 seconds, read 100 events per slice without long polling, try to read an event body 10 times with 500 ms
     * in between when it cannot be found, keep statistics for 10 windows of 30 seconds each, use the fully qualified class
     * name as event type name, and keep track of subscription ticks in memory.
     */
    public static EventStreamSubscriberConfig defaults() {
        return new EventStreamSubscriberConfig(DEFAULT_POLLING_INTERVAL, DEFAULT_SLICE_SIZE, null, DEFAULT_EVENT_NOT_FOUND_RETRY_COUNT,
                DEFAULT_EVENT_NOT_FOUND_RETRY_DELAY, DEFAULT_STATS_WINDOW_PERIOD, DEFAULT_STATS_WINDOW_COUNT,
                ClassNameEventTypeResolver.qualified(), List.of(), new InMemorySubscriberIntervalMonitor());
    }

    /**
     * @param defaultPollingInterval The interval used when subscribing without an explicit interval
     */
    public EventStreamSubscriberConfig defaultPollingInterval(Duration defaultPollingInterval) {
        return new EventStreamSubscriberConfig(defaultPollingInterval, sliceSize, longPollingTimeout, eventNotFoundRetryCount, eventNotFoundRetryDelay,
                messageProcessingStatsWindowPeriod, messageProcessingStatsWindowCount, eventTypeResolver, performanceMonitors, subscriberIntervalMonitor);
    }

    /**
     * @param sliceSize The maximum number of events to read from the stream per request
     */
    public EventStreamSubscriberConfig sliceSize(int sliceSize) {
        return new EventStreamSubscriberConfig(defaultPollingInterval, sliceSize, longPollingTimeout, eventNotFoundRetryCount, eventNotFoundRetryDelay,
                messageProcessingStatsWindowPeriod, messageProcessingStatsWindowCount, eventTypeResolver, performanceMonitors, subscriberIntervalMonitor);
    }

    /**
     * @param longPollingTimeout How long the store may wait for new events before answering a read with no events, {@code null} to disable long polling
     */
    public EventStreamSubscriberConfig longPollingTimeout(@Nullable Duration longPollingTimeout) {
        return new EventStreamSubscriberConfig(defaultPollingInterval, sliceSize, longPollingTimeout, eventNotFoundRetryCount, eventNotFoundRetryDelay,
                messageProcessingStatsWindowPeriod, messageProcessingStatsWindowCount, eventTypeResolver, performanceMonitors, subscriberIntervalMonitor);
    }

    /**
     * Configure how reading an event body that cannot be found is retried. The store may be eventually consistent across
     * its nodes so an event listed in a stream may not be readable right away.
     *
     * @param retryCount The number of attempts, values below 1 are treated as 1
     * @param retryDelay The delay between two attempts
     */
    public EventStreamSubscriberConfig eventNotFoundRetry(int retryCount, Duration retryDelay) {
        return new EventStreamSubscriberConfig(defaultPollingInterval, sliceSize, longPollingTimeout, retryCount, retryDelay,
                messageProcessingStatsWindowPeriod, messageProcessingStatsWindowCount, eventTypeResolver, performanceMonitors, subscriberIntervalMonitor);
    }

    /**
     * @param windowPeriod The length of each statistics window
     * @param windowCount  The number of windows to retain
     */
    public EventStreamSubscriberConfig messageProcessingStats(Duration windowPeriod, int windowCount) {
        return new EventStreamSubscriberConfig(defaultPollingInterval, sliceSize, longPollingTimeout, eventNotFoundRetryCount, eventNotFoundRetryDelay,
                windowPeriod, windowCount, eventTypeResolver, performanceMonitors, subscriberIntervalMonitor);
    }

    public EventStreamSubscriberConfig eventTypeResolver(EventTypeResolver eventTypeResolver) {
        return new EventStreamSubscriberConfig(defaultPollingInterval, sliceSize, longPollingTimeout, eventNotFoundRetryCount, eventNotFoundRetryDelay,
                messageProcessingStatsWindowPeriod, messageProcessingStatsWindowCount, eventTypeResolver, performanceMonitors, subscriberIntervalMonitor);
    }

    /**
     * Add a performance monitor to the ones already configured.
     */
    public EventStreamSubscriberConfig performanceMonitor(PerformanceMonitor performanceMonitor) {
        Objects.requireNonNull(performanceMonitor, PerformanceMonitor.class.getSimpleName() + " cannot be null");
        List<PerformanceMonitor> monitors = new ArrayList<>(performanceMonitors);
        monitors.add(performanceMonitor);
        return new EventStreamSubscriberConfig(defaultPollingInterval, sliceSize, longPollingTimeout, eventNotFoundRetryCount, eventNotFoundRetryDelay,
                messageProcessingStatsWindowPeriod, messageProcessingStatsWindowCount, eventTypeResolver, monitors, subscriberIntervalMonitor);
    }

    public EventStreamSubscriberConfig subscriberIntervalMonitor(SubscriberIntervalMonitor subscriberIntervalMonitor) {
        return new EventStreamSubscriberConfig(defaultPollingInterval, sliceSize, longPollingTimeout, eventNotFoundRetryCount, eventNotFoundRetryDelay,
                messageProcessingStatsWindowPeriod, messageProcessingStatsWindowCount, eventTypeResolver, performanceMonitors, subscriberIntervalMonitor);
    }

    @Override
    public String toString() {
        return "EventStreamSubscriberConfig{" +
                "defaultPollingInterval=" + defaultPollingInterval +
                ", sliceSize=" + sliceSize +
                ", longPollingTimeout=" + longPollingTimeout +
                ", eventNotFoundRetryCount=" + eventNotFoundRetryCount +
                ", eventNotFoundRetryDelay=" + eventNotFoundRetryDelay +
                ", messageProcessingStatsWindowPeriod=" + messageProcessingStatsWindowPeriod +
                ", messageProcessingStatsWindowCount=" + messageProcessingStatsWindowCount +
                ", eventTypeResolver=" + eventTypeResolver +
                ", performanceMonitors=" + performanceMonitors +
                ", subscriberIntervalMonitor=" + subscriberIntervalMonitor +
                '}';
    }
}
