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

import org.atomsub.handler.DispatchResult;
import org.atomsub.handler.EventHandlerResolver;
import org.atomsub.handler.EventHandlers;
import org.atomsub.handler.HandlerDispatcher;
import org.atomsub.handler.ResolvedHandlers;
import org.atomsub.monitoring.PerformanceStats;
import org.atomsub.monitoring.SubscriberIntervalMonitor;
import org.atomsub.retry.RetryStrategy;
import org.atomsub.retry.RetryStrategy.Retry;
import org.atomsub.subscription.AdHocInvocationResult;
import org.atomsub.subscription.EventEnvelope;
import org.atomsub.subscription.EventNotFoundException;
import org.atomsub.subscription.EventRead;
import org.atomsub.subscription.EventStoreReadException;
import org.atomsub.subscription.StreamSlice;
import org.atomsub.subscription.StreamSubscription;
import org.atomsub.subscription.SubscriptionKey;
import org.atomsub.subscription.api.blocking.EventStreamSubscriber;
import org.atomsub.subscription.api.blocking.StreamPositionStorage;
import org.atomsub.subscription.api.blocking.StreamReader;
import org.atomsub.subscription.api.blocking.SubscriptionTimerManager;
import org.atomsub.subscription.timer.ScheduledSubscriptionTimerManager;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.atomsub.subscription.AdHocInvocationResult.ResultCode.COULD_NOT_FIND_EVENT;
import static org.atomsub.subscription.AdHocInvocationResult.ResultCode.NO_HANDLERS_FOUND;
import static org.atomsub.subscription.AdHocInvocationResult.ResultCode.SUCCESS;

/**
 * An {@link EventStreamSubscriber} that periodically reads the streams it's subscribed to from a {@link StreamReader},
 * dispatches every event to the handlers that can handle it, and records the position of the last event it has seen in a
 * {@link StreamPositionStorage}. Each (stream, subscriber id) pair has its own checkpoint, so several subscribers may consume
 * the same stream independently.
 * <p>
 * A subscription is paused while it's being polled so that a drain that takes longer than the polling interval never overlaps
 * with itself. Handlers are invoked sequentially, in the order the {@link EventHandlerResolver} returns them. Events are
 * delivered at least once: a handler that fails doesn't prevent the checkpoint from advancing.
 */
@NullMarked
public class PollingEventStreamSubscriber implements EventStreamSubscriber {
    private static final Logger log = LoggerFactory.getLogger(PollingEventStreamSubscriber.class);

    private final StreamReader streamReader;
    private final StreamPositionStorage streamPositionStorage;
    private final SubscriptionTimerManager subscriptionTimerManager;
    private final EventHandlers eventHandlers;
    private final HandlerDispatcher handlerDispatcher;
    private final SubscriberIntervalMonitor subscriberIntervalMonitor;
    private final PerformanceStats allEventsStats;
    private final PerformanceStats processedEventsStats;
    private final EventStreamSubscriberConfig config;
    private final Retry eventNotFoundRetryStrategy;
    private final Set<SubscriptionKey> pollsInProgress = ConcurrentHashMap.newKeySet();

    /**
     * Create a subscriber with the {@link EventStreamSubscriberConfig#defaults() default} configuration.
     */
    public static PollingEventStreamSubscriber create(StreamReader streamReader, EventHandlerResolver eventHandlerResolver, StreamPositionStorage streamPositionStorage) {
        return new PollingEventStreamSubscriber(streamReader, eventHandlerResolver, streamPositionStorage, EventStreamSubscriberConfig.defaults());
    }

    public PollingEventStreamSubscriber(StreamReader streamReader, EventHandlerResolver eventHandlerResolver, StreamPositionStorage streamPositionStorage,
                                        EventStreamSubscriberConfig config) {
        this(streamReader, eventHandlerResolver, streamPositionStorage, new ScheduledSubscriptionTimerManager(), config);
    }

    public PollingEventStreamSubscriber(StreamReader streamReader, EventHandlerResolver eventHandlerResolver, StreamPositionStorage streamPositionStorage,
                                        SubscriptionTimerManager subscriptionTimerManager, EventStreamSubscriberConfig config) {
        Objects.requireNonNull(streamReader, StreamReader.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(eventHandlerResolver, EventHandlerResolver.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(streamPositionStorage, StreamPositionStorage.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(subscriptionTimerManager, SubscriptionTimerManager.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(config, EventStreamSubscriberConfig.class.getSimpleName() + " cannot be null");
        this.streamReader = streamReader;
        this.streamPositionStorage = streamPositionStorage;
        this.subscriptionTimerManager = subscriptionTimerManager;
        this.config = config;
        this.eventHandlers = new EventHandlers(config.eventTypeResolver, eventHandlerResolver);
        this.handlerDispatcher = new HandlerDispatcher(eventHandlers, config.performanceMonitors);
        this.subscriberIntervalMonitor = config.subscriberIntervalMonitor;
        this.allEventsStats = new PerformanceStats(config.messageProcessingStatsWindowPeriod, config.messageProcessingStatsWindowCount);
        this.processedEventsStats = new PerformanceStats(config.messageProcessingStatsWindowPeriod, config.messageProcessingStatsWindowCount);
        this.eventNotFoundRetryStrategy = RetryStrategy.fixed(config.eventNotFoundRetryDelay)
                .maxAttempts(Math.max(config.eventNotFoundRetryCount, 1))
                .retryIf(EventNotFoundException.class::isInstance);
    }

    @Override
    public void subscribeTo(String stream, @Nullable String subscriberId, @Nullable Duration pollInterval) {
        SubscriptionKey key = SubscriptionKey.of(stream, subscriberId);
        Duration interval = pollInterval == null ? config.defaultPollingInterval : pollInterval;
        log.info("Subscribing to {} with an interval of {}", key, interval);
        subscriptionTimerManager.add(key, interval,
                () -> poll(stream, subscriberId),
                () -> subscriberIntervalMonitor.updateInterval(stream, interval, subscriberId));
        log.info("Subscribed to {} with an interval of {}", key, interval);
    }

    @Override
    public void unsubscribeFrom(String stream, @Nullable String subscriberId) {
        SubscriptionKey key = SubscriptionKey.of(stream, subscriberId);
        log.info("Unsubscribing from {}", key);
        subscriptionTimerManager.remove(key);
        subscriberIntervalMonitor.removeMonitor(stream, subscriberId);
        log.info("Unsubscribed from {}", key);
    }

    @Override
    public void poll(String stream, @Nullable String subscriberId) {
        SubscriptionKey key = SubscriptionKey.of(stream, subscriberId);
        if (!pollsInProgress.add(key)) {
            log.debug("{}: Already being polled, skipping", key);
            return;
        }

        log.debug("{}: Begin polling", key);
        subscriptionTimerManager.pause(key);
        try {
            drain(key);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.error("{}: Unexpected error while polling", key, e);
        } finally {
            pollsInProgress.remove(key);
            subscriptionTimerManager.resume(key);
        }
        log.debug("{}: Finished polling", key);
    }

    @Override
    public AdHocInvocationResult adHocInvoke(String stream, long eventNumber, @Nullable String subscriberId) {
        SubscriptionKey key = SubscriptionKey.of(stream, subscriberId);
        log.debug("{}: Ad hoc invocation of event {}", key, eventNumber);
        EventRead eventRead = streamReader.readEvent(stream, eventNumber);
        EventEnvelope envelope = eventRead.envelope();
        if (!eventRead.isSuccess() || envelope == null) {
            log.debug("{}: Event {} could not be found ({})", key, eventNumber, eventRead.status());
            return AdHocInvocationResult.of(COULD_NOT_FIND_EVENT);
        }

        ResolvedHandlers handlers = eventHandlers.getEventHandlersFor(envelope.eventType(), subscriberId);
        Class<?> eventType = handlers.eventType();
        if (handlers.isEmpty() || eventType == null) {
            return AdHocInvocationResult.of(NO_HANDLERS_FOUND);
        }

        Object event;
        try {
            event = readEventBody(key, eventType, envelope);
        } catch (EventNotFoundException e) {
            log.warn("{}: Body of event {} could not be found at {}", key, eventNumber, e.getLink());
            return AdHocInvocationResult.of(COULD_NOT_FIND_EVENT);
        } catch (EventStoreReadException e) {
            log.warn("{}: Body of event {} could not be read", key, eventNumber, e);
            return AdHocInvocationResult.of(COULD_NOT_FIND_EVENT);
        }

        DispatchResult result = handlerDispatcher.dispatch(stream, eventType, handlers.handlers(), event, envelope);
        return result.isSuccess() ? AdHocInvocationResult.of(SUCCESS) : AdHocInvocationResult.failed(result.errors());
    }

    @Override
    public List<StreamSubscription> getSubscriptions() {
        return subscriptionTimerManager.getSubscriptions();
    }

    /**
     * @return Statistics of all events read from the subscribed streams, whether there was a handler for them or not.
     */
    public PerformanceStats getAllEventsStats() {
        return allEventsStats;
    }

    /**
     * @return Statistics of the events that were dispatched to at least one handler.
     */
    public PerformanceStats getProcessedEventsStats() {
        return processedEventsStats;
    }

    public SubscriberIntervalMonitor getSubscriberIntervalMonitor() {
        return subscriberIntervalMonitor;
    }

    public EventStreamSubscriberConfig getConfig() {
        return config;
    }

    @Override
    public void shutdown() {
        log.info("Shutting down {}", PollingEventStreamSubscriber.class.getSimpleName());
        subscriptionTimerManager.shutdown();
    }

    private void drain(SubscriptionKey key) {
        boolean readMore;
        do {
            Long storedPosition = streamPositionStorage.getPositionFor(key.stream(), key.subscriberId());
            long lastPosition = storedPosition == null ? -1 : storedPosition;
            log.debug("{}: Reading events after {}", key, lastPosition);

            StreamSlice slice;
            try {
                slice = streamReader.readStreamEventsForward(key.stream(), lastPosition + 1, config.sliceSize, config.longPollingTimeout);
            } catch (EventStoreReadException e) {
                log.warn("{}: Failed to read events: {}", key, e.getMessage());
                return;
            }
            log.debug("{}: Read {} event(s), status {}", key, slice.entries().size(), slice.status());
            if (!slice.isSuccess()) {
                return;
            }

            for (EventEnvelope envelope : slice.entries()) {
                if (!isSubscribed(key)) {
                    log.debug("{}: No longer subscribed, stopping before event {}", key, envelope.sequenceNumber());
                    return;
                }
                process(key, envelope);
                streamPositionStorage.setPositionFor(key.stream(), key.subscriberId(), envelope.sequenceNumber());
            }

            readMore = !slice.entries().isEmpty() && isSubscribed(key);
        } while (readMore);
    }

    private void process(SubscriptionKey key, EventEnvelope envelope) {
        ResolvedHandlers handlers = eventHandlers.getEventHandlersFor(envelope.eventType(), key.subscriberId());
        allEventsStats.messageProcessed(key.stream());

        Class<?> eventType = handlers.eventType();
        if (handlers.isEmpty() || eventType == null) {
            handlerDispatcher.notifyPerformanceMonitors(key.stream(), envelope.eventType(), envelope.updated(), 0, Map.of());
            return;
        }

        Object event;
        try {
            event = readEventBody(key, eventType, envelope);
        } catch (EventNotFoundException e) {
            log.error("{}: Event {} could not be found at {} after {} attempt(s), skipping it", key, envelope.sequenceNumber(), e.getLink(),
                    Math.max(config.eventNotFoundRetryCount, 1));
            return;
        } catch (Exception e) {
            log.error("{}: Failed to read event {}, skipping it", key, envelope.sequenceNumber(), e);
            return;
        }

        handlerDispatcher.dispatch(key.stream(), eventType, handlers.handlers(), event, envelope);
        processedEventsStats.messageProcessed(key.stream());
    }

    private Object readEventBody(SubscriptionKey key, Class<?> eventType, EventEnvelope envelope) {
        return eventNotFoundRetryStrategy
                .onError((errorInfo, throwable) -> {
                    if (errorInfo.isRetryable()) {
                        log.warn("{}: Event {} could not be found, attempt {} of {}. Trying again.", key, envelope.sequenceNumber(),
                                errorInfo.getAttemptNumber(), errorInfo.getMaxAttempts());
                    }
                })
                .execute(retryInfo -> {
                    Object body = streamReader.readEventBody(eventType, envelope.canonicalLink());
                    if (body == null) {
                        throw new EventNotFoundException(envelope.canonicalLink());
                    }
                    return body;
                });
    }

    private boolean isSubscribed(SubscriptionKey key) {
        return subscriptionTimerManager.contains(key);
    }
}
