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

import org.jspecify.annotations.Nullable;

/**
 * Durable storage of the sequence number of the last processed event per stream and subscriber.
 */
public interface StreamPositionStorage {

    /**
     * @param stream       The stream
     * @param subscriberId The subscriber, or {@code null} for the default subscriber
     * @return The last stored position or {@code null} if no position has been stored yet
     */
    @Nullable
    Long getPositionFor(String stream, @Nullable String subscriberId);

    /**
     * @param stream       The stream
     * @param subscriberId The subscriber, or {@code null} for the default subscriber
     * @param position     The sequence number of the last processed event
     */
    void setPositionFor(String stream, @Nullable String subscriberId, long position);
}
