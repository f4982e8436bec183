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

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An {@link EventTypeResolver} backed by an explicit table of event type names.
 */
public class MappedEventTypeResolver implements EventTypeResolver {

    private final Map<String, Class<?>> types = new ConcurrentHashMap<>();

    /**
     * Map {@code eventType} to its fully qualified class name.
     */
    public MappedEventTypeResolver register(Class<?> eventType) {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        return register(eventType.getName(), eventType);
    }

    public MappedEventTypeResolver register(String eventTypeName, Class<?> eventType) {
        Objects.requireNonNull(eventTypeName, "eventTypeName cannot be null");
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Class<?> existing = types.putIfAbsent(eventTypeName, eventType);
        if (existing != null && !existing.equals(eventType)) {
            throw new IllegalArgumentException("Event type " + eventTypeName + " is already mapped to " + existing.getName());
        }
        return this;
    }

    @Override
    public @Nullable Class<?> resolve(String eventTypeName) {
        return eventTypeName == null ? null : types.get(eventTypeName);
    }
}
