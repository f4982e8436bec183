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

import org.atomsub.subscription.EventEnvelope;

/**
 * Handles the content of events of type {@code T} together with the {@link EventEnvelope} they were read from.
 *
 * @param <T> The event type
 */
@FunctionalInterface
public interface EventAndMetadataHandler<T> {

    void handle(T event, EventEnvelope envelope) throws Exception;

    /**
     * Invoked when {@link #handle(Object, EventEnvelope)} throws. Exceptions thrown from here are logged and ignored.
     */
    default void onError(Throwable error, T event) {
    }
}
