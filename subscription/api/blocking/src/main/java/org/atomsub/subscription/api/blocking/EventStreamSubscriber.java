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

package org.atomsub.subscription.api.blocking;

import org.atomsub.subscription.AdHocInvocationResult;
import org.atomsub.subscription.StreamSubscription;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.List;

/**
 * Subscribes to event streams by polling them and dispatches every event to the handlers that are interested in it.
 * The position of the last processed event is stored per stream and subscriber so that processing continues where it
 * left off after a restart.
 */
public interface EventStreamSubscriber {

    /**
     * Start polling {@code stream} for the default subscriber using the default poll interval.
     */
    default void subscribeTo(String stream) {
        subscribeTo(stream, null, null);
    }

    /**
     * Start polling {@code stream} for the given subscriber using the default poll interval.
     */
    default void subscribeTo(String stream, @Nullable String subscriberId) {
        subscribeTo(stream, subscriberId, null);
    }

    /**
     * Start polling {@code stream} for the given subscriber.
     *
     * @param stream       The stream to subscribe to
     * @param subscriberId The subscriber, or {@code null} for the default subscriber
     * @param pollInterval The poll interval, or {@code null} to use the default interval
     * @throws IllegalArgumentException If the subscription already exists
     */
    void subscribeTo(String stream, @Nullable String subscriberId, @Nullable Duration pollInterval);

    /**
     * Stop polling {@code stream} for the given subscriber. An ongoing poll stops after the event that's currently processed.
     */
    void unsubscribeFrom(String stream, @Nullable String subscriberId);

    /**
     * Read and dispatch all events available after the stored position. Normally invoked by the scheduler.
     */
    void poll(String stream, @Nullable String subscriberId);

    /**
     * Dispatch a single event to the handlers of the subscriber without reading or updating the stored position.
     *
     * @param stream       The stream to read the event from
     * @param eventNumber  The sequence number of the event
     * @param subscriberId The subscriber whose handlers to invoke, or {@code null} for the default subscriber
     */
    AdHocInvocationResult adHocInvoke(String stream, long eventNumber, @Nullable String subscriberId);

    /**
     * @return A snapshot of all current subscriptions
     */
    List<StreamSubscription> getSubscriptions();

    /**
     * Stop all subscriptions and release resources.
     */
    default void shutdown() {
    }
}
