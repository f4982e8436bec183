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

import java.util.List;
import java.util.Objects;

/**
 * The handlers that apply to an event for a certain subscriber.
 *
 * @param eventType The resolved event type, {@code null} if the event type name is unknown
 * @param handlers  The applicable handlers, empty if none
 */
public record ResolvedHandlers(@Nullable Class<?> eventType, List<HandlerRegistration> handlers) {

    public ResolvedHandlers {
        Objects.requireNonNull(handlers, "handlers cannot be null");
        handlers = List.copyOf(handlers);
    }

    static ResolvedHandlers unknownEventType() {
        return new ResolvedHandlers(null, List.of());
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    public int size() {
        return handlers.size();
    }
}
