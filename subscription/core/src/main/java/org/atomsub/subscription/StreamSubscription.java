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

package org.atomsub.subscription;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Objects;

/**
 * A snapshot of a registered subscription.
 *
 * @param key      The stream and subscriber id of the subscription
 * @param interval The interval between two polls
 * @param paused   {@code true} if the schedule of the subscription is currently paused (typically because it's polling)
 */
public record StreamSubscription(SubscriptionKey key, Duration interval, boolean paused) {

    public StreamSubscription {
        Objects.requireNonNull(key, SubscriptionKey.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(interval, "interval cannot be null");
    }

    public String stream() {
        return key.stream();
    }

    public @Nullable String subscriberId() {
        return key.subscriberId();
    }
}
