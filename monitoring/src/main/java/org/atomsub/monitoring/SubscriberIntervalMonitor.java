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

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Keeps track of when each subscription was last triggered, so that stalled subscriptions can be detected.
 */
public interface SubscriberIntervalMonitor {

    /**
     * Invoked every time the schedule of a subscription fires.
     *
     * @param stream       The stream
     * @param interval     The configured interval of the subscription
     * @param subscriberId The subscriber, or {@code null} for the default subscriber
     */
    void updateInterval(String stream, Duration interval, @Nullable String subscriberId);

    /**
     * Forget about the subscription.
     */
    void removeMonitor(String stream, @Nullable String subscriberId);
}
