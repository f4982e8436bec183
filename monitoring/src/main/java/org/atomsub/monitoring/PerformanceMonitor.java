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

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Receives telemetry for every event read by a subscriber, whether any handler was interested in it or not.
 */
@FunctionalInterface
public interface PerformanceMonitor {

    /**
     * @param stream        The stream the event was read from
     * @param eventTypeName The event type name
     * @param updated       When the event was last modified in the store
     * @param handlerCount  The number of handlers that were invoked, {@code 0} if there were no interested handlers
     * @param errors        The exception thrown by each failing handler, keyed by handler type. Empty when all handlers succeeded.
     */
    void accept(String stream, String eventTypeName, OffsetDateTime updated, int handlerCount, Map<Class<?>, Throwable> errors);
}
