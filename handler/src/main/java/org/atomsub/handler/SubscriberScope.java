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

package org.atomsub.handler;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * Which subscribers a handler applies to. A handler either applies to the default subscriber of a stream, or only to
 * the named subscribers.
 */
public sealed interface SubscriberScope {

    static SubscriberScope defaultSubscriber() {
        return DefaultSubscriber.INSTANCE;
    }

    static SubscriberScope named(String subscriberId, String... additionalSubscriberIds) {
        Objects.requireNonNull(subscriberId, "subscriberId cannot be null");
        String[] ids = Arrays.copyOf(additionalSubscriberIds, additionalSubscriberIds.length + 1);
        ids[ids.length - 1] = subscriberId;
        return new Named(Set.of(ids));
    }

    /**
     * @param subscriberId The subscriber, {@code null} for the default subscriber
     * @return {@code true} if a handler with this scope should receive the events of {@code subscriberId}
     */
    boolean appliesTo(@Nullable String subscriberId);

    final class DefaultSubscriber implements SubscriberScope {
        private static final DefaultSubscriber INSTANCE = new DefaultSubscriber();

        private DefaultSubscriber() {
        }

        @Override
        public boolean appliesTo(@Nullable String subscriberId) {
            return subscriberId == null;
        }

        @Override
        public String toString() {
            return "DefaultSubscriber";
        }
    }

    record Named(Set<String> subscriberIds) implements SubscriberScope {
        public Named {
            Objects.requireNonNull(subscriberIds, "subscriberIds cannot be null");
            if (subscriberIds.isEmpty()) {
                throw new IllegalArgumentException("subscriberIds cannot be empty");
            }
            subscriberIds = Set.copyOf(subscriberIds);
        }

        @Override
        public boolean appliesTo(@Nullable String subscriberId) {
            return subscriberId != null && subscriberIds.contains(subscriberId);
        }
    }
}
