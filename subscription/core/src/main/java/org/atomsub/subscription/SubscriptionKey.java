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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Identifies a subscription, i.e. the literal pair of a stream and a subscriber id. A {@code null} subscriber id
 * denotes the default subscriber of the stream.
 *
 * @param stream       The name of the stream
 * @param subscriberId The id of the subscriber, or {@code null} for the default subscriber
 */
@NullMarked
public record SubscriptionKey(String stream, @Nullable String subscriberId) {
    public static final String DEFAULT_SUBSCRIBER = "default";

    public SubscriptionKey {
        Objects.requireNonNull(stream, "stream cannot be null");
        if (stream.isBlank()) {
            throw new IllegalArgumentException("stream cannot be blank");
        }
    }

    public static SubscriptionKey of(String stream, @Nullable String subscriberId) {
        return new SubscriptionKey(stream, subscriberId);
    }

    public static SubscriptionKey defaultSubscriberOf(String stream) {
        return new SubscriptionKey(stream, null);
    }

    public boolean isDefaultSubscriber() {
        return subscriberId == null;
    }

    /**
     * @return The subscriber id, or {@value #DEFAULT_SUBSCRIBER} for the default subscriber.
     */
    public String subscriberIdOrDefault() {
        return subscriberId == null ? DEFAULT_SUBSCRIBER : subscriberId;
    }

    @Override
    public String toString() {
        return stream + "|" + subscriberIdOrDefault();
    }
}
