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

import org.atomsub.subscription.StreamSubscription;
import org.atomsub.subscription.SubscriptionKey;

import java.time.Duration;
import java.util.List;

/**
 * Owns the recurring schedule of every subscription. Each subscription is scheduled independently of the others.
 */
public interface SubscriptionTimerManager {

    /**
     * Register a new recurring schedule.
     *
     * @param key            The subscription
     * @param interval       The interval between two ticks
     * @param onTick         Invoked on every tick
     * @param onTimerElapsed Invoked right before {@code onTick}, typically used to feed an interval monitor
     * @throws IllegalArgumentException If {@code key} is already registered
     */
    void add(SubscriptionKey key, Duration interval, Runnable onTick, Runnable onTimerElapsed);

    /**
     * Cancel and discard the schedule of the subscription. Does nothing if the subscription isn't registered.
     */
    void remove(SubscriptionKey key);

    /**
     * Suspend the schedule of the subscription without discarding it. Idempotent.
     */
    void pause(SubscriptionKey key);

    /**
     * Continue a paused schedule. Idempotent.
     */
    void resume(SubscriptionKey key);

    /**
     * @return {@code true} if the subscription is registered (paused or not)
     */
    boolean contains(SubscriptionKey key);

    /**
     * @return A snapshot of all registered subscriptions
     */
    List<StreamSubscription> getSubscriptions();

    /**
     * Cancel all schedules and release the threads.
     */
    default void shutdown() {
    }
}
