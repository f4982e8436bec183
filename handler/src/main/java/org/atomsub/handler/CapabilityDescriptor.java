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

import java.util.Objects;

/**
 * Describes what an {@link EventHandlerResolver} is asked for: handlers able to handle {@code eventType} with the given {@code arity}.
 */
public record CapabilityDescriptor(Class<?> eventType, Arity arity) {

    public CapabilityDescriptor {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(arity, Arity.class.getSimpleName() + " cannot be null");
    }

    public static CapabilityDescriptor contentOnly(Class<?> eventType) {
        return new CapabilityDescriptor(eventType, Arity.CONTENT_ONLY);
    }

    public static CapabilityDescriptor contentAndMetadata(Class<?> eventType) {
        return new CapabilityDescriptor(eventType, Arity.CONTENT_AND_METADATA);
    }
}
